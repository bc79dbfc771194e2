package com.sentrius.yang.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentrius.yang.model.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and validates the JSON bodies of the parse endpoints.
 */
public class YangRequestReader {
    static final String CONTENT_MUST_BE_STRING = "Content must be a string";
    static final String FILES_MUST_BE_ARRAY = "Files must be an array";

    private final ObjectMapper objectMapper;

    public YangRequestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Body of a single parse: {@code {content, filename?}}.
     * @return the document, with a null name when none was given
     * @throws InvalidRequestException if content is missing or not a string
     */
    public SourceFile readParseRequest(String body) {
        JsonNode root = readTree(body, CONTENT_MUST_BE_STRING);
        JsonNode content = root.get("content");
        if (content == null || !content.isTextual()) {
            throw new InvalidRequestException(CONTENT_MUST_BE_STRING);
        }
        JsonNode filename = root.get("filename");
        return new SourceFile(filename != null && filename.isTextual() ? filename.asText() : null, content.asText());
    }

    /**
     * Body of a batch parse: {@code {files: [{name, content}, ...]}}.
     * @throws InvalidRequestException if files is not an array or an entry has no string content
     */
    public List<SourceFile> readBatchRequest(String body) {
        JsonNode root = readTree(body, FILES_MUST_BE_ARRAY);
        JsonNode files = root.get("files");
        if (files == null || !files.isArray()) {
            throw new InvalidRequestException(FILES_MUST_BE_ARRAY);
        }

        List<SourceFile> sources = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            JsonNode file = files.get(i);
            JsonNode content = file.get("content");
            if (content == null || !content.isTextual()) {
                throw new InvalidRequestException("File at index " + i + ": " + CONTENT_MUST_BE_STRING);
            }
            JsonNode name = file.get("name");
            sources.add(new SourceFile(name != null && name.isTextual() ? name.asText() : null, content.asText()));
        }
        return sources;
    }

    private JsonNode readTree(String body, String emptyMessage) {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException(emptyMessage);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new InvalidRequestException(emptyMessage);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Malformed JSON request: " + e.getOriginalMessage());
        }
    }
}
