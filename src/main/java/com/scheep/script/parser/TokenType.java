package com.scheep.script.parser;

public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, QUOTE,
    NUMBER, STRING, BOOLEAN, SYMBOL,
    EOF
}
