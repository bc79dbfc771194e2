package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A batch entry: the parse result of one file, serialized flat with its filename.
 */
@JsonPropertyOrder({"filename"})
public class FileParseResult {
    private final String filename;
    private final ParseResult result;

    public FileParseResult(String filename, ParseResult result) {
        this.filename = filename;
        this.result = result;
    }

    public String getFilename() {
        return filename;
    }

    @JsonUnwrapped
    public ParseResult getResult() {
        return result;
    }
}
