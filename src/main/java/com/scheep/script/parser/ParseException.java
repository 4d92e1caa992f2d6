package com.scheep.script.parser;

/** Raised by the lexer and parser for text that is not a well-formed expression. */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseException(int line, String message) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
