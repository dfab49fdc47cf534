package com.elara.pine.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Line-aware tokenizer. Besides ordinary tokens it produces NEWLINE at the end of each
 * logical line and INDENT/DEDENT when the leading whitespace of a line grows or shrinks.
 *
 * Newlines inside parentheses or brackets, and after a line ending in a binary operator
 * or comma, do not end the logical line. Inside braces indentation is ignored.
 * Problems are collected in {@link #errors()}; the lexer never throws on bad input.
 */
public class Lexer {
    private static final int TAB_WIDTH = 4;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<SyntaxError> errors = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int groupDepth = 0;
    private int braceDepth = 0;
    private boolean atLineStart = true;
    private boolean lineContinues = false;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("while", TokenType.WHILE);
        map.put("switch", TokenType.SWITCH);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("var", TokenType.VAR);
        map.put("varip", TokenType.VARIP);
        map.put("export", TokenType.EXPORT);
        map.put("import", TokenType.IMPORT);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        keywords = Collections.unmodifiableMap(map);
    }

    // A line ending in one of these continues on the next line.
    private static final Set<TokenType> CONTINUATION = EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
            TokenType.AND, TokenType.OR, TokenType.QUESTION, TokenType.COLON, TokenType.COMMA,
            TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.EQUAL, TokenType.COLON_EQUAL,
            TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL,
            TokenType.PERCENT_EQUAL);

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        indents.push(0);
        while (!isAtEnd()) {
            if (atLineStart) {
                beginLine();
                continue;
            }
            start = current;
            scanToken();
        }
        endLogicalLine();
        while (indents.peek() > 0) {
            indents.pop();
            addLayout(TokenType.DEDENT);
        }
        start = current;
        tokens.add(new Token(TokenType.EOF, "", null, line, column()));
        return tokens;
    }

    public List<SyntaxError> errors() {
        return errors;
    }

    private void beginLine() {
        atLineStart = false;
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            width += advance() == '\t' ? TAB_WIDTH : 1;
        }
        if (lineContinues) return;

        // Blank lines never change indentation.
        if (isAtEnd() || peek() == '\n' || peek() == '\r') return;

        if (peek() == '/' && peekNext() == '/') {
            start = current;
            while (!isAtEnd() && peek() != '\n') advance();
            String text = source.substring(start + 2, current).trim();
            tokens.add(new Token(TokenType.COMMENT, source.substring(start, current), text, line, column()));
            addLayout(TokenType.NEWLINE);
            return;
        }

        if (braceDepth > 0) return;

        start = current;
        int top = indents.peek();
        if (width > top) {
            indents.push(width);
            addLayout(TokenType.INDENT);
        } else if (width < top) {
            while (width < indents.peek()) {
                indents.pop();
                addLayout(TokenType.DEDENT);
            }
            if (width != indents.peek()) {
                error("Inconsistent indentation");
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': groupDepth++; addToken(TokenType.LEFT_PAREN); break;
            case ')': groupDepth = Math.max(0, groupDepth - 1); addToken(TokenType.RIGHT_PAREN); break;
            case '[': groupDepth++; addToken(TokenType.LEFT_BRACKET); break;
            case ']': groupDepth = Math.max(0, groupDepth - 1); addToken(TokenType.RIGHT_BRACKET); break;
            case '{': braceDepth++; addToken(TokenType.LEFT_BRACE); break;
            case '}': braceDepth = Math.max(0, braceDepth - 1); addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '.':
                if (isDigit(peek())) number();
                else addToken(TokenType.DOT);
                break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '-': addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS); break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '/':
                if (match('/')) {
                    // trailing comment
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case ':': addToken(match('=') ? TokenType.COLON_EQUAL : TokenType.COLON); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.NOT); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '=':
                if (match('=')) addToken(TokenType.EQUAL_EQUAL);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.EQUAL);
                break;
            case '&':
                if (match('&')) addToken(TokenType.AND);
                else error("Unexpected '&'");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR);
                else error("Unexpected '|'");
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                endLogicalLine();
                line++;
                lineStart = current;
                atLineStart = true;
                break;
            case '"': case '\'':
                string(c);
                break;
            case '#':
                color();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else error("Unexpected character: " + c);
        }
    }

    private void endLogicalLine() {
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        lineContinues = groupDepth > 0 || (last != null && CONTINUATION.contains(last.type));
        if (lineContinues || last == null) return;
        if (last.type == TokenType.NEWLINE || last.type == TokenType.INDENT || last.type == TokenType.DEDENT) return;
        start = current;
        addLayout(TokenType.NEWLINE);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        } else if (peek() == '.' && !isAlpha(peekNext())) {
            // "1." is a valid float literal
            advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int save = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                while (isDigit(peek())) advance();
            } else {
                current = save;
            }
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.parseDouble(text));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case 'r': value.append('\r'); break;
                    default: value.append(esc);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd() || peek() == '\n') {
            error("Unterminated string");
            return;
        }
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private void color() {
        while (isHexDigit(peek())) advance();
        int digits = current - start - 1;
        if (digits != 6 && digits != 8) {
            error("Invalid color literal: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.STRING, source.substring(start, current).toUpperCase());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private int column() { return start - lineStart + 1; }

    private void addLayout(TokenType type) {
        tokens.add(new Token(type, "", null, line, column()));
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, column()));
    }

    private void error(String msg) {
        errors.add(new SyntaxError(msg, line, column()));
    }
}
