package com.sentrius.yang;

import com.sentrius.yang.model.BatchParseResult;
import com.sentrius.yang.model.DependencyGraph.Edge;
import com.sentrius.yang.model.DependencyGraph.EdgeKind;
import com.sentrius.yang.model.FileParseResult;
import com.sentrius.yang.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class YangDocumentServiceTest {

    private static YangDocumentService service(int parallelism) {
        return new YangDocumentService(new ParseCoordinator(new PrimaryParser(), new FallbackParser(), "temp.yang"),
            new DependencyGraphBuilder(), "temp.yang", parallelism);
    }

    @Test
    void testImportBecomesEdge() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(
                new SourceFile("types.yang", TestDocuments.load("types.yang")),
                new SourceFile("main.yang", TestDocuments.load("main.yang"))));

            assertEquals(List.of("types"), batch.getDependencies().get("main.yang"));
            assertEquals(Collections.emptyList(), batch.getDependencies().get("types.yang"));
            assertEquals(List.of(new Edge("main.yang", "types", EdgeKind.IMPORT)), batch.getGraph().getEdges());
            assertTrue(batch.getGraph().hasNode("types.yang"));

            assertEquals(2, batch.getSummary().getTotalModules());
            assertEquals(2, batch.getSummary().getValidModules());
            assertEquals(0, batch.getSummary().getTotalErrors());
        }
    }

    @Test
    void testSummaryCountsInvalidFiles() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(
                new SourceFile("good.yang", TestDocuments.SCENARIO_A),
                new SourceFile("broken.yang", TestDocuments.load("broken-container.yang")),
                new SourceFile("empty.yang", "")));

            assertEquals(3, batch.getSummary().getTotalModules());
            assertEquals(1, batch.getSummary().getValidModules());
            int errors = batch.getFiles().stream().mapToInt(f -> f.getResult().getErrors().size()).sum();
            assertEquals(errors, batch.getSummary().getTotalErrors());
            assertTrue(errors >= 2);
        }
    }

    @Test
    void testIncludesDoNotBecomeEdges() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(
                new SourceFile("example-system.yang", TestDocuments.load("example-system.yang")),
                new SourceFile("example-system-common.yang", TestDocuments.load("example-system-common.yang"))));

            assertEquals(List.of("ietf-inet-types", "ietf-yang-types"),
                batch.getDependencies().get("example-system.yang"));
            assertEquals(List.of(
                new Edge("example-system.yang", "ietf-inet-types", EdgeKind.IMPORT),
                new Edge("example-system.yang", "ietf-yang-types", EdgeKind.IMPORT)), batch.getGraph().getEdges());
            assertFalse(batch.getGraph().hasNode("example-system-common"));
        }
    }

    @Test
    void testEdgeCountMatchesDependencies() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(
                new SourceFile("a.yang", "module a { namespace urn:a; prefix a; include s; }"),
                new SourceFile("b.yang", "module b { namespace urn:b; prefix b; import a { prefix a; } }")));

            int imports = batch.getDependencies().values().stream().mapToInt(List::size).sum();
            assertEquals(1, imports);
            assertEquals(imports, batch.getGraph().getEdges().size());
        }
    }

    @Test
    void testDuplicateFilenamesKeepLastDependencies() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(
                new SourceFile(null, "module a { namespace urn:a; prefix a; import x { prefix x; } }"),
                new SourceFile(null, "module b { namespace urn:b; prefix b; import y { prefix y; } }")));

            assertEquals(2, batch.getFiles().size());
            assertEquals(2, batch.getSummary().getTotalModules());
            assertEquals(1, batch.getDependencies().size());
            assertEquals(List.of("y"), batch.getDependencies().get("temp.yang"));
            assertEquals(List.of(new Edge("temp.yang", "y", EdgeKind.IMPORT)), batch.getGraph().getEdges());
        }
    }

    @Test
    void testMissingFilenameUsesDefault() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(List.of(new SourceFile(null, TestDocuments.SCENARIO_A)));

            assertEquals("temp.yang", batch.getFiles().get(0).getFilename());
            assertTrue(batch.getDependencies().containsKey("temp.yang"));
        }
    }

    @Test
    void testEmptyBatch() {
        try (YangDocumentService service = service(1)) {
            BatchParseResult batch = service.parseMultiple(Collections.emptyList());

            assertTrue(batch.getFiles().isEmpty());
            assertTrue(batch.getDependencies().isEmpty());
            assertTrue(batch.getGraph().getNodes().isEmpty());
            assertEquals(0, batch.getSummary().getTotalModules());
            assertEquals(0, batch.getSummary().getValidModules());
            assertEquals(0, batch.getSummary().getTotalErrors());
        }
    }

    @Test
    void testParallelBatchKeepsInputOrder() {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String content = "module m" + i + " { namespace \"urn:m" + i + "\"; prefix m" + i + ";" +
                             (i > 0 ? " import m" + (i - 1) + " { prefix p; }" : "") + " }";
            files.add(new SourceFile("m" + i + ".yang", content));
        }

        BatchParseResult sequential;
        try (YangDocumentService service = service(1)) {
            sequential = service.parseMultiple(files);
        }
        BatchParseResult parallel;
        try (YangDocumentService service = service(4)) {
            parallel = service.parseMultiple(files);
        }

        List<String> expectedNames = files.stream().map(SourceFile::getName).collect(Collectors.toList());
        assertEquals(expectedNames, parallel.getFiles().stream().map(FileParseResult::getFilename)
            .collect(Collectors.toList()));
        assertEquals(sequential.getDependencies(), parallel.getDependencies());
        assertEquals(sequential.getGraph().getEdges(), parallel.getGraph().getEdges());
        assertEquals(sequential.getGraph().getNodes(), parallel.getGraph().getNodes());
        assertEquals(19, parallel.getGraph().getEdges().size());
        assertEquals(20, parallel.getSummary().getValidModules());
    }

    @Test
    void testSingleParseDelegates() {
        try (YangDocumentService service = service(1)) {
            assertTrue(service.parse(TestDocuments.SCENARIO_A, "m.yang").isValid());
        }
    }
}
