package com.sentrius.yang;

import com.sentrius.yang.model.ParseResult;

/**
 * Turns the text of one YANG document into a {@link ParseResult}.
 *
 * <p>Implementations never throw: every failure is reported as a diagnostic on a
 * result with {@code valid=false}.
 */
public interface SchemaParser {

    ParseResult parse(String content, String filename);
}
