package com.elara.pine.codegen;

import java.util.Collections;
import java.util.List;

import com.elara.pine.parser.Expr.ExprInterface;

/** A user-declared type: its fields in declaration order. */
public final class TypeInfo {

    public static final class FieldInfo {
        public final String name;
        public final String typeName;
        public final ExprInterface defaultValue; // may be null

        public FieldInfo(String name, String typeName, ExprInterface defaultValue) {
            this.name = name;
            this.typeName = typeName;
            this.defaultValue = defaultValue;
        }
    }

    private final String name;
    private final List<FieldInfo> fields;
    private final boolean exported;

    public TypeInfo(String name, List<FieldInfo> fields, boolean exported) {
        this.name = name;
        this.fields = Collections.unmodifiableList(fields);
        this.exported = exported;
    }

    public String name() { return name; }
    public List<FieldInfo> fields() { return fields; }
    public boolean isExported() { return exported; }
}
