package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which parser produced a {@link ParseResult}.
 */
public enum ParserKind {
    PRIMARY, FALLBACK;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
