package com.elara.pine.runtime;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class BarDataTest {

    private static Bar bar(long t, double c) {
        return new Bar(t, c, c, c, c, 1);
    }

    @Test
    void mutatingCalls_bumpVersion_onlyWhenContentChanges() {
        BarData data = new BarData();
        assertEquals(0, data.version());

        assertNull(data.pop());
        data.updateLast(bar(0, 1));
        data.set(0, bar(0, 1));
        assertEquals(0, data.version(), "no-ops on an empty list keep the version");

        data.push(bar(0, 1));
        data.push(bar(1, 2));
        assertEquals(2, data.version());

        data.set(1, bar(1, 3));
        data.set(5, bar(5, 3));
        assertEquals(3, data.version());

        data.updateLast(bar(1, 4));
        assertEquals(4, data.version());
        assertEquals(4.0, data.at(1).close, 0.0);

        Bar removed = data.pop();
        assertEquals(4.0, removed.close, 0.0);
        assertEquals(5, data.version());

        data.setAll(Arrays.asList(bar(0, 9), bar(1, 8), bar(2, 7)));
        assertEquals(6, data.version());
        assertEquals(3, data.length());

        data.invalidate();
        assertEquals(7, data.version());
    }

    @Test
    void bars_isReadOnlyView() {
        BarData data = BarData.from(Collections.singletonList(bar(0, 1)));
        assertThrows(UnsupportedOperationException.class, () -> data.bars().add(bar(1, 2)));
        assertNull(data.at(3));
        assertNull(data.at(-1));
    }

    @Test
    void fromJson_readsBars_andDefaultsMissingFieldsToNaN() throws IOException {
        String json = "[{\"time\": 1, \"open\": 1.5, \"high\": 2, \"low\": 1, \"close\": 1.75, \"volume\": 300},"
                + " {\"time\": 2, \"open\": 1.75, \"high\": 2.5, \"low\": 1.5, \"close\": 2.25}]";
        BarData data = BarData.fromJson(json);
        assertEquals(2, data.length());
        assertEquals(300.0, data.at(0).volume, 0.0);
        assertTrue(Double.isNaN(data.at(1).volume));
        assertEquals(2L, data.at(1).time);
        assertEquals(2.25, Series.fromBars(data, "close").last(), 0.0);
    }

    @Test
    void fromJson_rejectsNonArray() {
        assertThrows(IOException.class, () -> BarData.fromJson("{\"time\": 1}"));
    }
}
