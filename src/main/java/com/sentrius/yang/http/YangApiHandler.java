package com.sentrius.yang.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentrius.yang.YangDocumentService;
import com.sentrius.yang.model.BatchParseResult;
import com.sentrius.yang.model.ParseResult;
import com.sentrius.yang.model.SourceFile;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for the YANG parse operations.
 *
 * Endpoints:
 * - POST /api/yang/parse - Parse one document
 * - POST /api/yang/parse-multiple - Parse a batch and build its dependency graph
 */
public class YangApiHandler implements HttpHandler {
    public static final String PARSE_PATH = "/api/yang/parse";
    public static final String PARSE_MULTIPLE_PATH = "/api/yang/parse-multiple";

    private static final Logger logger = LoggerFactory.getLogger(YangApiHandler.class);

    private final YangDocumentService service;
    private final ObjectMapper objectMapper;
    private final YangRequestReader requestReader;
    private final long maxBodyBytes;

    public YangApiHandler(YangDocumentService service, long maxBodyBytes) {
        this.service = service;
        this.objectMapper = YangJson.mapper();
        this.requestReader = new YangRequestReader(objectMapper);
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        logger.debug("handle() entry: method={}, path={}", method, path);

        try {
            if (!"POST".equals(method)) {
                sendJson(exchange, 405, Map.of("error", "Method not allowed"));
                return;
            }
            String body = readBody(exchange);
            if (body == null) {
                sendJson(exchange, 413, Map.of("error", "Request body exceeds " + maxBodyBytes + " bytes"));
                return;
            }

            if (PARSE_PATH.equals(path)) {
                SourceFile request = requestReader.readParseRequest(body);
                ParseResult result = service.parse(request.getContent(), request.getName());
                sendJson(exchange, 200, result);
            } else if (PARSE_MULTIPLE_PATH.equals(path)) {
                List<SourceFile> files = requestReader.readBatchRequest(body);
                BatchParseResult result = service.parseMultiple(files);
                sendJson(exchange, 200, result);
            } else {
                sendJson(exchange, 404, Map.of("error", "Not found"));
            }
        } catch (InvalidRequestException e) {
            logger.debug("Rejected request to {}: {}", path, e.getMessage());
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Error handling {} {}", method, path, e);
            String message = PARSE_MULTIPLE_PATH.equals(path)
                ? "Failed to parse YANG files" : "Failed to parse YANG content";
            sendJson(exchange, 500, Map.of("error", message));
        }
    }

    private String readBody(HttpExchange exchange) throws IOException {
        try (InputStream input = exchange.getRequestBody()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            int read;
            while ((read = input.read(chunk)) != -1) {
                if (buffer.size() + read > maxBodyBytes) {
                    return null;
                }
                buffer.write(chunk, 0, read);
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        byte[] responseBytes = objectMapper.writeValueAsBytes(payload);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
