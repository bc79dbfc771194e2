package com.sentrius.yang.http;

import com.sentrius.yang.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YangRequestReaderTest {

    private final YangRequestReader reader = new YangRequestReader(YangJson.mapper());

    @Test
    void testParseRequest() {
        SourceFile file = reader.readParseRequest("{\"content\":\"module m {}\",\"filename\":\"m.yang\"}");

        assertEquals("m.yang", file.getName());
        assertEquals("module m {}", file.getContent());
    }

    @Test
    void testParseRequestWithoutFilename() {
        SourceFile file = reader.readParseRequest("{\"content\":\"\"}");

        assertNull(file.getName());
        assertEquals("", file.getContent());
    }

    @Test
    void testContentMustBeString() {
        for (String body : List.of("{}", "{\"content\":42}", "{\"content\":null}", "[]", "")) {
            InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> reader.readParseRequest(body), body);
            assertEquals(YangRequestReader.CONTENT_MUST_BE_STRING, e.getMessage());
        }
    }

    @Test
    void testMalformedJson() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> reader.readParseRequest("{\"content\":"));

        assertTrue(e.getMessage().startsWith("Malformed JSON request"));
    }

    @Test
    void testBatchRequest() {
        List<SourceFile> files = reader.readBatchRequest(
            "{\"files\":[{\"name\":\"a.yang\",\"content\":\"module a {}\"},{\"content\":\"module b {}\"}]}");

        assertEquals(2, files.size());
        assertEquals("a.yang", files.get(0).getName());
        assertNull(files.get(1).getName());
        assertEquals("module b {}", files.get(1).getContent());
    }

    @Test
    void testFilesMustBeArray() {
        for (String body : List.of("{}", "{\"files\":\"a.yang\"}", "{\"files\":{}}")) {
            InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> reader.readBatchRequest(body), body);
            assertEquals(YangRequestReader.FILES_MUST_BE_ARRAY, e.getMessage());
        }
    }

    @Test
    void testBatchEntryWithoutContent() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> reader.readBatchRequest("{\"files\":[{\"name\":\"a.yang\",\"content\":\"x\"},{\"name\":\"b.yang\"}]}"));

        assertEquals("File at index 1: Content must be a string", e.getMessage());
    }
}
