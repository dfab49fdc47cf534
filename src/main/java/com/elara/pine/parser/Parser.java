package com.elara.pine.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.elara.debug.Debug;
import com.elara.pine.parser.Expr.Argument;
import com.elara.pine.parser.Expr.ExprInterface;
import com.elara.pine.parser.Statement.Block;
import com.elara.pine.parser.Statement.Parameter;
import com.elara.pine.parser.Statement.Qualifier;
import com.elara.pine.parser.Statement.Stmt;

/**
 * Recursive-descent parser over the layout-aware token stream of {@link Lexer}.
 *
 * Syntax errors are recorded and the parser resynchronizes at the next line, so a single
 * pass reports every independent problem. {@link #parse()} never throws.
 */
public class Parser {
    private static final String TAG = "Parser";

    /** Dotted roots that name library namespaces rather than values. */
    static final Set<String> BUILTIN_NAMESPACES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "ta", "taCore", "math", "array", "matrix", "map", "str", "input", "color", "request",
            "runtime", "syminfo", "timeframe", "barstate", "display", "plot", "shape", "location",
            "size", "line", "label", "box", "table", "linefill", "polyline", "chart", "strategy",
            "ticker", "session", "alert", "format", "scale", "currency", "text", "xloc", "yloc",
            "extend", "font", "position", "order", "hline", "dividends", "earnings", "splits", "log")));

    private static final Set<String> PARAM_QUALIFIERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "simple", "series", "const")));

    private static class ParseError extends RuntimeException {
        ParseError(String message) { super(message); }
    }

    /** Deepest expression nesting accepted before parsing gives up on the statement. */
    static final int MAX_NESTING = 500;

    private final List<Token> tokens;
    private final List<SyntaxError> errors = new ArrayList<>();
    private final Set<String> declaredTypes = new HashSet<>();
    private final Set<String> importAliases = new HashSet<>();
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        prescan();
    }

    /** Tokenizes and parses {@code source}, merging lexer and parser errors. */
    public static ParseResult parseSource(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens);
        List<Stmt> statements = parser.parse();

        List<SyntaxError> all = new ArrayList<>(lexer.errors());
        all.addAll(parser.errors());
        Debug.get().d(TAG, "tokens=" + tokens.size() + " statements=" + statements.size() + " errors=" + all.size());
        return new ParseResult(statements, all);
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            // stray layout at top level is flattened
            if (match(TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT)) continue;
            int before = current;
            try {
                statements.add(statement());
            } catch (ParseError e) {
                synchronize();
                if (current == before) advance();
            }
        }
        return statements;
    }

    public List<SyntaxError> errors() {
        return errors;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.COMMENT)) {
            Token comment = previous();
            match(TokenType.NEWLINE);
            return new Statement.Comment((String) comment.literal, comment.line, comment.column);
        }
        if (match(TokenType.EXPORT)) return exported(previous());
        if (isTypeDeclaration()) return typeDeclaration(false, peek());
        if (isMethodDeclaration()) return methodDeclaration(false, peek());
        if (match(TokenType.IMPORT)) return importStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.BREAK)) {
            Token kw = previous();
            endStatement();
            return new Statement.Break(kw.line, kw.column);
        }
        if (match(TokenType.CONTINUE)) {
            Token kw = previous();
            endStatement();
            return new Statement.Continue(kw.line, kw.column);
        }
        if (match(TokenType.VAR, TokenType.VARIP)) {
            Token kw = previous();
            Qualifier q = kw.type == TokenType.VAR ? Qualifier.VAR : Qualifier.VARIP;
            return declaration(q, kw);
        }
        if (isTupleDestructuring()) return tupleDestructuring();
        if (isFunctionDeclaration()) return functionDeclaration(false, peek());
        if (isHeader()) return header();
        if (typedDeclarationAhead()) return declaration(Qualifier.NONE, peek());
        if (check(TokenType.IDENTIFIER) && peekAt(1).type == TokenType.EQUAL) return declaration(Qualifier.NONE, peek());
        return expressionStatement();
    }

    private Stmt exported(Token kw) {
        if (isTypeDeclaration()) return typeDeclaration(true, kw);
        if (isMethodDeclaration()) return methodDeclaration(true, kw);
        if (isFunctionDeclaration()) return functionDeclaration(true, kw);
        throw error(peek(), "Expect function, type or method after 'export'.");
    }

    private Stmt declaration(Qualifier qualifier, Token start) {
        String typeName = null;
        if (typedDeclarationAhead()) {
            typeName = typeName();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprInterface value = expression();
        endStatement();
        return new Statement.Declaration(name.lexeme, typeName, qualifier, value, start.line, start.column);
    }

    private Stmt expressionStatement() {
        Token start = peek();
        ExprInterface expr = expression();

        if (match(TokenType.COLON_EQUAL)) {
            ExprInterface target = assignable(expr, previous());
            ExprInterface value = expression();
            endStatement();
            return new Statement.Reassignment(target, value, null, start.line, start.column);
        }

        if (match(TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL,
                TokenType.SLASH_EQUAL, TokenType.PERCENT_EQUAL)) {
            Token op = previous();
            ExprInterface target = assignable(expr, op);
            String operator = op.lexeme.substring(0, 1);
            ExprInterface rhs = expression();
            endStatement();
            ExprInterface value = new Expr.Binary(target, operator, rhs, op.line, op.column);
            return new Statement.Reassignment(target, value, operator, start.line, start.column);
        }

        endStatement();
        return new Statement.ExprStmt(expr, start.line, start.column);
    }

    private ExprInterface assignable(ExprInterface target, Token op) {
        if (target instanceof Expr.Identifier || target instanceof Expr.Member || target instanceof Expr.FieldAccess) {
            return target;
        }
        throw error(op, "Invalid assignment target.");
    }

    private Stmt tupleDestructuring() {
        Token start = consume(TokenType.LEFT_BRACKET, "Expect '['.");
        List<String> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expect name in tuple.").lexeme);
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after tuple names.");
        consume(TokenType.EQUAL, "Expect '=' after tuple.");
        ExprInterface value = expression();
        endStatement();
        return new Statement.TupleDestructuring(names, value, start.line, start.column);
    }

    private Stmt ifStatement() {
        Token kw = previous();
        ExprInterface condition = expression();
        Block thenBranch = block();
        Stmt elseBranch = null;

        if (check(TokenType.NEWLINE) && peekAt(1).type == TokenType.ELSE) advance();
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = ifStatement();
            } else {
                elseBranch = block();
            }
        }
        return new Statement.If(condition, thenBranch, elseBranch, kw.line, kw.column);
    }

    private Stmt forStatement() {
        Token kw = previous();

        if (match(TokenType.LEFT_BRACKET)) {
            String index = consume(TokenType.IDENTIFIER, "Expect index name.").lexeme;
            consume(TokenType.COMMA, "Expect ',' after index name.");
            String item = consume(TokenType.IDENTIFIER, "Expect item name.").lexeme;
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after loop names.");
            consumeWord("in", "Expect 'in' after loop names.");
            ExprInterface iterable = expression();
            return new Statement.ForIn(index, item, iterable, block(), kw.line, kw.column);
        }

        Token name = consume(TokenType.IDENTIFIER, "Expect loop variable name.");
        if (checkWord("in")) {
            advance();
            ExprInterface iterable = expression();
            return new Statement.ForIn(null, name.lexeme, iterable, block(), kw.line, kw.column);
        }

        consume(TokenType.EQUAL, "Expect '=' after loop variable.");
        ExprInterface start = expression();
        consumeWord("to", "Expect 'to' in for loop.");
        ExprInterface end = expression();
        ExprInterface step = null;
        if (checkWord("by")) {
            advance();
            step = expression();
        }
        return new Statement.ForRange(name.lexeme, start, end, step, block(), kw.line, kw.column);
    }

    private Stmt whileStatement() {
        Token kw = previous();
        ExprInterface condition = expression();
        return new Statement.While(condition, block(), kw.line, kw.column);
    }

    private Block block() {
        Token start = peek();
        List<Stmt> statements = new ArrayList<>();

        if (match(TokenType.LEFT_BRACE)) {
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                if (match(TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT)) continue;
                blockStatement(statements);
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
            return new Block(statements, start.line, start.column);
        }

        consume(TokenType.NEWLINE, "Expect end of line before block.");
        // comment lines may sit between the header and the first indented line
        while (check(TokenType.COMMENT)) {
            blockStatement(statements);
        }
        consume(TokenType.INDENT, "Expect indented block.");
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;
            blockStatement(statements);
        }
        match(TokenType.DEDENT);
        return new Block(statements, start.line, start.column);
    }

    private void blockStatement(List<Stmt> into) {
        int before = current;
        try {
            into.add(statement());
        } catch (ParseError e) {
            synchronize();
            if (current == before && !check(TokenType.DEDENT) && !check(TokenType.RIGHT_BRACE)) advance();
        }
    }

    // -------------------------
    // Declarations
    // -------------------------

    private Stmt functionDeclaration(boolean exported, Token start) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<Parameter> params = parameters();
        consume(TokenType.ARROW, "Expect '=>' after parameters.");
        boolean expressionBody = !check(TokenType.NEWLINE) && !check(TokenType.LEFT_BRACE);
        Block body = functionBody(expressionBody);
        return new Statement.FunctionDeclaration(name.lexeme, params, body, expressionBody, exported, start.line, start.column);
    }

    private Stmt methodDeclaration(boolean exported, Token start) {
        advance(); // 'method'
        Token name = consume(TokenType.IDENTIFIER, "Expect method name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after method name.");
        List<Parameter> all = parameters();
        if (all.isEmpty() || all.get(0).typeName == null) {
            throw error(name, "Method '" + name.lexeme + "' must declare a typed receiver as its first parameter.");
        }
        Parameter self = all.get(0);
        consume(TokenType.ARROW, "Expect '=>' after parameters.");
        boolean expressionBody = !check(TokenType.NEWLINE) && !check(TokenType.LEFT_BRACE);
        Block body = functionBody(expressionBody);
        return new Statement.MethodDeclaration(name.lexeme, self.typeName, self.name, all.subList(1, all.size()),
                body, expressionBody, exported, start.line, start.column);
    }

    private Block functionBody(boolean expressionBody) {
        if (!expressionBody) return block();
        Token start = peek();
        ExprInterface value = expression();
        endStatement();
        List<Stmt> single = new ArrayList<>();
        single.add(new Statement.ExprStmt(value, start.line, start.column));
        return new Block(single, start.line, start.column);
    }

    /** Parameter list after '(' up to and including ')'. */
    private List<Parameter> parameters() {
        List<Parameter> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                while (check(TokenType.IDENTIFIER) && PARAM_QUALIFIERS.contains(peek().lexeme)
                        && peekAt(1).type == TokenType.IDENTIFIER) {
                    advance();
                }
                String typeName = null;
                int typeLength = typeNameLength(current);
                if (typeLength > 0 && peekAt(typeLength).type == TokenType.IDENTIFIER) {
                    typeName = typeName();
                }
                Token name = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                ExprInterface defaultValue = match(TokenType.EQUAL) ? expression() : null;
                params.add(new Parameter(name.lexeme, typeName, defaultValue));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    private Stmt typeDeclaration(boolean exported, Token start) {
        advance(); // 'type'
        Token name = consume(TokenType.IDENTIFIER, "Expect type name.");
        consume(TokenType.NEWLINE, "Expect end of line after type name.");
        List<Statement.Field> fields = new ArrayList<>();
        while (match(TokenType.COMMENT, TokenType.NEWLINE)) {
            // leading comments
        }
        if (match(TokenType.INDENT)) {
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                if (match(TokenType.NEWLINE, TokenType.COMMENT)) continue;
                match(TokenType.VAR, TokenType.VARIP);
                String fieldType = typeName();
                Token fieldName = consume(TokenType.IDENTIFIER, "Expect field name.");
                ExprInterface defaultValue = match(TokenType.EQUAL) ? expression() : null;
                endStatement();
                fields.add(new Statement.Field(fieldType, fieldName.lexeme, defaultValue));
            }
            match(TokenType.DEDENT);
        }
        return new Statement.TypeDeclaration(name.lexeme, fields, exported, start.line, start.column);
    }

    private Stmt importStatement() {
        Token kw = previous();
        String publisher = consume(TokenType.IDENTIFIER, "Expect publisher name.").lexeme;
        consume(TokenType.SLASH, "Expect '/' after publisher.");
        String library = consume(TokenType.IDENTIFIER, "Expect library name.").lexeme;
        int version = 0;
        if (match(TokenType.SLASH)) {
            Token v = consume(TokenType.NUMBER, "Expect library version.");
            version = ((Double) v.literal).intValue();
        }
        String alias = library;
        if (checkWord("as")) {
            advance();
            alias = consume(TokenType.IDENTIFIER, "Expect alias after 'as'.").lexeme;
        }
        endStatement();
        importAliases.add(alias);
        return new Statement.ImportStatement(publisher, library, version, alias, kw.line, kw.column);
    }

    private Stmt header() {
        Token name = advance();
        consume(TokenType.LEFT_PAREN, "Expect '(' after '" + name.lexeme + "'.");
        List<Argument> args = arguments();
        endStatement();
        if ("library".equals(name.lexeme)) {
            return new Statement.LibraryDeclaration(args, name.line, name.column);
        }
        return new Statement.IndicatorDeclaration(args, name.line, name.column);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        return ternary();
    }

    private ExprInterface ternary() {
        enterNested();
        try {
            return conditional();
        } finally {
            depth--;
        }
    }

    private ExprInterface conditional() {
        ExprInterface condition = or();
        if (match(TokenType.QUESTION)) {
            Token q = previous();
            ExprInterface thenBranch = ternary();
            consume(TokenType.COLON, "Expect ':' in conditional expression.");
            ExprInterface elseBranch = ternary();
            return new Expr.Ternary(condition, thenBranch, elseBranch, q.line, q.column);
        }
        return condition;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            expr = new Expr.Binary(expr, "||", and(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token op = previous();
            expr = new Expr.Binary(expr, "&&", equality(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme, comparison(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = additive();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme, additive(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme, multiplicative(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            expr = new Expr.Binary(expr, op.lexeme, unary(), op.line, op.column);
        }
        return expr;
    }

    private ExprInterface unary() {
        enterNested();
        try {
            return prefixed();
        } finally {
            depth--;
        }
    }

    private void enterNested() {
        if (++depth > MAX_NESTING) {
            depth--;
            throw error(peek(), "Expression nested too deeply");
        }
    }

    private ExprInterface prefixed() {
        if (match(TokenType.MINUS)) {
            Token op = previous();
            return new Expr.Unary("-", unary(), op.line, op.column);
        }
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Expr.Unary("!", unary(), op.line, op.column);
        }
        if (match(TokenType.PLUS)) {
            return unary();
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = primary();
        while (true) {
            if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface offset = expression();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after history offset.");
                expr = new Expr.HistoryAccess(expr, offset, bracket.line, bracket.column);
            } else if (check(TokenType.DOT) && isNameToken(peekAt(1))) {
                advance();
                Token member = advance();
                if (match(TokenType.LEFT_PAREN)) {
                    expr = new Expr.MethodCall(expr, member.lexeme, arguments(), member.line, member.column);
                } else {
                    expr = new Expr.FieldAccess(expr, member.lexeme, member.line, member.column);
                }
            } else {
                break;
            }
        }
        return expr;
    }

    private ExprInterface primary() {
        if (match(TokenType.NUMBER)) {
            Token t = previous();
            return new Expr.NumberLiteral((Double) t.literal, t.lexeme, t.line, t.column);
        }
        if (match(TokenType.STRING)) {
            Token t = previous();
            return new Expr.StringLiteral((String) t.literal, t.line, t.column);
        }
        if (match(TokenType.IDENTIFIER)) {
            return name(previous());
        }
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }
        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new Expr.ArrayLiteral(items, bracket.line, bracket.column);
        }
        if (match(TokenType.SWITCH)) {
            return switchExpression(previous());
        }
        throw error(peek(), "Expect expression.");
    }

    /** Dotted name, optionally generic and/or called. */
    private ExprInterface name(Token first) {
        StringBuilder path = new StringBuilder(first.lexeme);
        while (check(TokenType.DOT) && isNameToken(peekAt(1))) {
            advance();
            path.append('.').append(advance().lexeme);
        }
        String dotted = path.toString();

        List<String> typeArgs = null;
        if (check(TokenType.LESS) && dotted.endsWith(".new")) {
            advance();
            typeArgs = new ArrayList<>();
            do {
                typeArgs.add(typeName());
            } while (match(TokenType.COMMA));
            consume(TokenType.GREATER, "Expect '>' after type arguments.");
        }

        if (match(TokenType.LEFT_PAREN)) {
            return classifyCall(dotted, arguments(), typeArgs, first);
        }
        if (typeArgs != null) {
            throw error(peek(), "Expect '(' after type arguments.");
        }
        if (dotted.indexOf('.') >= 0) {
            return new Expr.Member(dotted, first.line, first.column);
        }
        return new Expr.Identifier(dotted, first.line, first.column);
    }

    private ExprInterface classifyCall(String path, List<Argument> args, List<String> typeArgs, Token first) {
        int lastDot = path.lastIndexOf('.');
        if (lastDot < 0) {
            return new Expr.Call(path, args, typeArgs, first.line, first.column);
        }
        String receiverPath = path.substring(0, lastDot);
        String member = path.substring(lastDot + 1);
        String root = path.substring(0, path.indexOf('.'));

        if ("new".equals(member) && declaredTypes.contains(receiverPath)) {
            return new Expr.TypeInstantiation(receiverPath, args, first.line, first.column);
        }
        if (BUILTIN_NAMESPACES.contains(root) || importAliases.contains(root) || declaredTypes.contains(root)) {
            return new Expr.Call(path, args, typeArgs, first.line, first.column);
        }
        ExprInterface receiver = receiverPath.indexOf('.') >= 0
                ? new Expr.Member(receiverPath, first.line, first.column)
                : new Expr.Identifier(receiverPath, first.line, first.column);
        return new Expr.MethodCall(receiver, member, args, first.line, first.column);
    }

    /** Argument list after '(' up to and including ')'. */
    private List<Argument> arguments() {
        List<Argument> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break; // trailing comma
                if (check(TokenType.IDENTIFIER) && peekAt(1).type == TokenType.EQUAL) {
                    String name = advance().lexeme;
                    advance();
                    args.add(new Argument(name, expression()));
                } else {
                    args.add(new Argument(null, expression()));
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return args;
    }

    private ExprInterface switchExpression(Token kw) {
        ExprInterface subject = null;
        if (!check(TokenType.NEWLINE)) {
            subject = expression();
        }
        consume(TokenType.NEWLINE, "Expect end of line after switch.");
        while (match(TokenType.COMMENT, TokenType.NEWLINE)) {
            // leading comments
        }
        consume(TokenType.INDENT, "Expect indented switch cases.");

        List<Expr.SwitchArm> arms = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.COMMENT)) continue;
            ExprInterface matchExpr = null;
            if (!match(TokenType.ARROW)) {
                matchExpr = expression();
                consume(TokenType.ARROW, "Expect '=>' after switch case.");
            }
            ExprInterface result = expression();
            arms.add(new Expr.SwitchArm(matchExpr, result));
            if (!check(TokenType.DEDENT)) {
                consume(TokenType.NEWLINE, "Expect end of line after switch case.");
            }
        }
        match(TokenType.DEDENT);
        return new Expr.Switch(subject, arms, kw.line, kw.column);
    }

    // -------------------------
    // Lookahead
    // -------------------------

    private void prescan() {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!atStatementStart(i)) continue;
            if (t.type == TokenType.IDENTIFIER && "type".equals(t.lexeme)
                    && tokens.get(i + 1).type == TokenType.IDENTIFIER
                    && i + 2 < tokens.size() && tokens.get(i + 2).type == TokenType.NEWLINE) {
                declaredTypes.add(tokens.get(i + 1).lexeme);
            } else if (t.type == TokenType.IMPORT) {
                String library = null;
                String alias = null;
                for (int j = i + 1; j < tokens.size() && tokens.get(j).type != TokenType.NEWLINE; j++) {
                    Token u = tokens.get(j);
                    if (j == i + 3 && u.type == TokenType.IDENTIFIER) library = u.lexeme;
                    if ("as".equals(u.lexeme) && j + 1 < tokens.size()) alias = tokens.get(j + 1).lexeme;
                }
                if (alias != null) importAliases.add(alias);
                else if (library != null) importAliases.add(library);
            }
        }
    }

    private boolean atStatementStart(int index) {
        if (index == 0) return true;
        TokenType prev = tokens.get(index - 1).type;
        return prev == TokenType.NEWLINE || prev == TokenType.INDENT
                || prev == TokenType.DEDENT || prev == TokenType.EXPORT;
    }

    private boolean isTypeDeclaration() {
        return checkWord("type") && peekAt(1).type == TokenType.IDENTIFIER && peekAt(2).type == TokenType.NEWLINE;
    }

    private boolean isMethodDeclaration() {
        return checkWord("method") && peekAt(1).type == TokenType.IDENTIFIER && peekAt(2).type == TokenType.LEFT_PAREN;
    }

    private boolean isHeader() {
        return check(TokenType.IDENTIFIER)
                && ("indicator".equals(peek().lexeme) || "library".equals(peek().lexeme))
                && peekAt(1).type == TokenType.LEFT_PAREN;
    }

    /** name( ... ) => */
    private boolean isFunctionDeclaration() {
        if (!check(TokenType.IDENTIFIER) || peekAt(1).type != TokenType.LEFT_PAREN) return false;
        int depth = 0;
        for (int i = current + 1; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type;
            if (type == TokenType.LEFT_PAREN) depth++;
            else if (type == TokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type == TokenType.ARROW;
                }
            } else if (type == TokenType.NEWLINE || type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    /** [a, b, ...] = */
    private boolean isTupleDestructuring() {
        if (!check(TokenType.LEFT_BRACKET)) return false;
        int i = current + 1;
        while (true) {
            if (tokenAt(i).type != TokenType.IDENTIFIER) return false;
            i++;
            if (tokenAt(i).type == TokenType.COMMA) {
                i++;
                continue;
            }
            break;
        }
        return tokenAt(i).type == TokenType.RIGHT_BRACKET && tokenAt(i + 1).type == TokenType.EQUAL;
    }

    /** Type name followed by a variable name and '='. */
    private boolean typedDeclarationAhead() {
        int length = typeNameLength(current);
        if (length <= 0) return false;
        return tokenAt(current + length).type == TokenType.IDENTIFIER
                && tokenAt(current + length + 1).type == TokenType.EQUAL;
    }

    /** Number of tokens forming a type name at {@code pos}: T, T[], T<A, B>. 0 when none. */
    private int typeNameLength(int pos) {
        if (tokenAt(pos).type != TokenType.IDENTIFIER) return 0;
        int i = pos + 1;
        if (tokenAt(i).type == TokenType.LESS) {
            int depth = 1;
            i++;
            while (depth > 0) {
                TokenType type = tokenAt(i).type;
                if (type == TokenType.LESS) depth++;
                else if (type == TokenType.GREATER) depth--;
                else if (type != TokenType.IDENTIFIER && type != TokenType.COMMA) return 0;
                i++;
            }
        } else if (tokenAt(i).type == TokenType.LEFT_BRACKET && tokenAt(i + 1).type == TokenType.RIGHT_BRACKET) {
            i += 2;
        }
        return i - pos;
    }

    private String typeName() {
        String base = consume(TokenType.IDENTIFIER, "Expect type name.").lexeme;
        if (match(TokenType.LESS)) {
            StringBuilder sb = new StringBuilder(base).append('<');
            do {
                if (sb.charAt(sb.length() - 1) != '<') sb.append(", ");
                sb.append(typeName());
            } while (match(TokenType.COMMA));
            consume(TokenType.GREATER, "Expect '>' after type arguments.");
            return sb.append('>').toString();
        }
        if (check(TokenType.LEFT_BRACKET) && peekAt(1).type == TokenType.RIGHT_BRACKET) {
            advance();
            advance();
            return "array<" + base + ">";
        }
        return base;
    }

    private static boolean isNameToken(Token t) {
        if (t.type == TokenType.IDENTIFIER) return true;
        return !t.lexeme.isEmpty() && Character.isLetter(t.lexeme.charAt(0));
    }

    // -------------------------
    // Token helpers
    // -------------------------

    /** A simple statement ends at a newline, or where an enclosing block or the input ends. */
    private void endStatement() {
        if (match(TokenType.NEWLINE)) return;
        if (check(TokenType.DEDENT) || check(TokenType.RIGHT_BRACE) || isAtEnd()) return;
        TokenType last = current > 0 ? previous().type : TokenType.NEWLINE;
        if (last == TokenType.DEDENT || last == TokenType.RIGHT_BRACE) return;
        throw error(peek(), "Expect end of line after statement.");
    }

    /** Skips to the start of the next statement at the current block depth. */
    private void synchronize() {
        int indent = 0;
        int braces = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == TokenType.INDENT) {
                indent++;
            } else if (type == TokenType.DEDENT) {
                if (indent == 0) return;
                advance();
                if (--indent == 0 && braces == 0) return;
                continue;
            } else if (type == TokenType.LEFT_BRACE) {
                braces++;
            } else if (type == TokenType.RIGHT_BRACE) {
                if (braces == 0) return;
                braces--;
            } else if (type == TokenType.NEWLINE && indent == 0 && braces == 0) {
                advance();
                if (!check(TokenType.INDENT)) return;
                continue;
            }
            advance();
        }
    }

    private boolean checkWord(String word) {
        return check(TokenType.IDENTIFIER) && word.equals(peek().lexeme);
    }

    private void consumeWord(String word, String message) {
        if (checkWord(word)) {
            advance();
            return;
        }
        throw error(peek(), message);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }
    private Token peekAt(int distance) { return tokenAt(current + distance); }

    private Token tokenAt(int index) {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private ParseError error(Token token, String message) {
        errors.add(new SyntaxError(message, token.line, token.column));
        return new ParseError("[line " + token.line + "] " + message);
    }
}
