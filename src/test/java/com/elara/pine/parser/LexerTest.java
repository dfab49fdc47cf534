package com.elara.pine.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void indentation_producesIndentAndDedent() {
        String src = String.join("\n",
                "if close > open",
                "    x = 1",
                "y = 2");
        assertEquals(Arrays.asList(
                TokenType.IF, TokenType.IDENTIFIER, TokenType.GREATER, TokenType.IDENTIFIER, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
                TokenType.EOF), types(src));
    }

    @Test
    void trailingOperator_continuesTheLogicalLine() {
        String src = String.join("\n",
                "x = 1 +",
                "    2");
        assertEquals(Arrays.asList(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER,
                TokenType.NEWLINE, TokenType.EOF), types(src));
    }

    @Test
    void colorLiteral_isUpperCasedString() {
        List<Token> tokens = new Lexer("c = #ff8800").tokenize();
        Token color = tokens.get(2);
        assertEquals(TokenType.STRING, color.type);
        assertEquals("#FF8800", color.literal);
    }

    @Test
    void commentLine_keepsTextWithoutSlashes() {
        List<Token> tokens = new Lexer("//@version=5\nx = 1").tokenize();
        assertEquals(TokenType.COMMENT, tokens.get(0).type);
        assertEquals("@version=5", tokens.get(0).literal);
    }

    @Test
    void keywordOperators_mapToLogicalTokens() {
        assertEquals(Arrays.asList(
                TokenType.IDENTIFIER, TokenType.AND, TokenType.NOT, TokenType.IDENTIFIER, TokenType.OR,
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.EOF), types("a and not b or c"));
    }

    @Test
    void badInput_isReportedNotThrown() {
        Lexer lexer = new Lexer("x = \"open\ny = #12");
        lexer.tokenize();
        assertEquals(2, lexer.errors().size());
        assertEquals("Unterminated string", lexer.errors().get(0).message);
        assertEquals(2, lexer.errors().get(1).line);
    }
}
