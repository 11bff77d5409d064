package com.planning.cpm.config;

import java.util.regex.Pattern;

/** Separator between tokens of a constraint expression. */
public enum Delimiter {
    COMMA(','),
    SEMICOLON(';');

    private final Pattern splitter;

    Delimiter(char symbol) {
        this.splitter = Pattern.compile(Pattern.quote(String.valueOf(symbol)));
    }

    /** Splits on the delimiter, keeping empty trailing tokens. */
    public String[] split(String text) {
        return splitter.split(text, -1);
    }
}
