package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"files", "dependencies", "graph", "summary"})
public class BatchParseResult {
    private final List<FileParseResult> files;
    private final Map<String, List<String>> dependencies;
    private final DependencyGraph graph;
    private final Summary summary;

    public BatchParseResult(List<FileParseResult> files, Map<String, List<String>> dependencies,
                            DependencyGraph graph) {
        this.files = Collections.unmodifiableList(files);
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        this.graph = graph;
        this.summary = Summary.of(files);
    }

    public List<FileParseResult> getFiles() {
        return files;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public Summary getSummary() {
        return summary;
    }

    @JsonPropertyOrder({"totalModules", "validModules", "totalErrors"})
    public static class Summary {
        private final int totalModules;
        private final int validModules;
        private final int totalErrors;

        public Summary(int totalModules, int validModules, int totalErrors) {
            this.totalModules = totalModules;
            this.validModules = validModules;
            this.totalErrors = totalErrors;
        }

        static Summary of(List<FileParseResult> files) {
            int valid = 0;
            int errors = 0;
            for (FileParseResult file : files) {
                if (file.getResult().isValid()) {
                    valid++;
                }
                errors += file.getResult().getErrors().size();
            }
            return new Summary(files.size(), valid, errors);
        }

        public int getTotalModules() {
            return totalModules;
        }

        public int getValidModules() {
            return validModules;
        }

        public int getTotalErrors() {
            return totalErrors;
        }
    }
}
