package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.List;

/** Turns tokens into expression trees. The trees are {@link Value}s; no separate AST. */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Convenience: lex and parse {@code source} into its top-level forms. */
    public static List<Value> read(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    /** Reads exactly one expression; trailing input is an error. */
    public static Value readOne(String source) {
        List<Value> forms = read(source);
        if (forms.size() != 1) {
            throw new ParseException(1, "Expected exactly one expression, got " + forms.size());
        }
        return forms.get(0);
    }

    public List<Value> parse() {
        List<Value> forms = new ArrayList<>();
        while (!isAtEnd()) {
            forms.add(expression());
        }
        return forms;
    }

    private Value expression() {
        Token t = advance();
        switch (t.type) {
            case NUMBER:
                return Value.number((Double) t.literal);
            case STRING:
                return Value.string((String) t.literal);
            case BOOLEAN:
                return Value.bool((Boolean) t.literal);
            case SYMBOL:
                return Value.symbol((String) t.literal);
            case QUOTE: {
                if (isAtEnd()) throw error(t, "Expect expression after quote.");
                return Value.list(Value.symbol("quote"), expression());
            }
            case LEFT_PAREN:
                return list(t);
            case RIGHT_PAREN:
                throw error(t, "Unexpected ')'.");
            default:
                throw error(t, "Unexpected end of input.");
        }
    }

    private Value list(Token open) {
        List<Value> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (isAtEnd()) throw error(open, "Unclosed '(' opened here.");
            items.add(expression());
        }
        advance();
        return Value.list(items);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        Token t = peek();
        if (!isAtEnd()) current++;
        return t;
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }

    private ParseException error(Token token, String message) {
        return new ParseException(token.line, message);
    }
}
