package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.List;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '\'': addToken(TokenType.QUOTE); break;
            case ';':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '"':
                string();
                break;
            case '#':
                hash();
                break;
            default:
                atom();
        }
    }

    private void hash() {
        while (!isDelimiter(peek())) advance();
        String text = source.substring(start, current);
        switch (text) {
            case "#t": case "#true": addToken(TokenType.BOOLEAN, Boolean.TRUE); break;
            case "#f": case "#false": addToken(TokenType.BOOLEAN, Boolean.FALSE); break;
            default: throw error("Unsupported syntax: " + text);
        }
    }

    /** A number when the whole run parses as one, otherwise a symbol. */
    private void atom() {
        while (!isDelimiter(peek())) advance();
        String text = source.substring(start, current);
        if ("true".equals(text) || "false".equals(text)) {
            addToken(TokenType.BOOLEAN, Boolean.valueOf(text));
        } else if (looksNumeric(text)) {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
        } else {
            addToken(TokenType.SYMBOL, text);
        }
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') line++;
            if (c == '\\') {
                if (isAtEnd()) break;
                char e = advance();
                switch (e) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    default: throw error("Unknown string escape: \\" + e);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    /** Optional sign, digits, optional fraction; at least one digit. */
    private static boolean looksNumeric(String text) {
        int i = 0;
        if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) i++;
        boolean digits = false;
        while (i < text.length() && isDigit(text.charAt(i))) { i++; digits = true; }
        if (i < text.length() && text.charAt(i) == '.') {
            i++;
            while (i < text.length() && isDigit(text.charAt(i))) { i++; digits = true; }
        }
        return digits && i == text.length();
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private boolean isDelimiter(char c) {
        return isAtEnd() || Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';' || c == '\'';
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private ParseException error(String msg) {
        return new ParseException(line, msg);
    }
}
