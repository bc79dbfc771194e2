package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of parsing one document. Built once through {@link Builder} and not
 * modified afterwards.
 */
@JsonPropertyOrder({"valid", "tree", "modules", "errors", "metadata", "parser"})
public class ParseResult {
    private final boolean valid;
    private final Map<String, SchemaNode> tree;
    private final List<SchemaNode> modules;
    private final List<Diagnostic> errors;
    private final ModuleMetadata metadata;
    private final ParserKind parserUsed;

    private ParseResult(Builder builder) {
        this.valid = builder.valid;
        builder.modules.forEach(SchemaNode::freeze);
        this.tree = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tree));
        this.modules = Collections.unmodifiableList(new ArrayList<>(builder.modules));
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.metadata = builder.metadata != null ? builder.metadata : ModuleMetadata.empty(null);
        this.parserUsed = builder.parserUsed;
    }

    public boolean isValid() {
        return valid;
    }

    public Map<String, SchemaNode> getTree() {
        return tree;
    }

    public List<SchemaNode> getModules() {
        return modules;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public ModuleMetadata getMetadata() {
        return metadata;
    }

    @JsonProperty("parser")
    public ParserKind getParserUsed() {
        return parserUsed;
    }

    /**
     * Copy of this result with the given diagnostics appended. A result that
     * receives an error is no longer valid.
     */
    public ParseResult withAdditionalErrors(List<Diagnostic> extra) {
        Builder builder = new Builder(parserUsed).metadata(metadata);
        modules.forEach(builder::addModule);
        errors.forEach(builder::addError);
        extra.forEach(builder::addError);
        boolean addsError = extra.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
        return builder.valid(valid && !addsError).build();
    }

    public static class Builder {
        private final ParserKind parserUsed;
        private final Map<String, SchemaNode> tree = new LinkedHashMap<>();
        private final List<SchemaNode> modules = new ArrayList<>();
        private final List<Diagnostic> errors = new ArrayList<>();
        private ModuleMetadata metadata;
        private boolean valid = true;

        public Builder(ParserKind parserUsed) {
            this.parserUsed = parserUsed;
        }

        /**
         * Adds a top-level module; it is also keyed into the tree by name.
         */
        public Builder addModule(SchemaNode module) {
            modules.add(module);
            tree.put(module.getName(), module);
            return this;
        }

        public Builder addError(Diagnostic diagnostic) {
            errors.add(diagnostic);
            return this;
        }

        public Builder addErrors(List<Diagnostic> diagnostics) {
            errors.addAll(diagnostics);
            return this;
        }

        public Builder metadata(ModuleMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder valid(boolean valid) {
            this.valid = valid;
            return this;
        }

        public int moduleCount() {
            return modules.size();
        }

        public ParseResult build() {
            return new ParseResult(this);
        }
    }

    @Override
    public String toString() {
        return "ParseResult{valid=" + valid + ", modules=" + modules + ", errors=" + errors +
               ", parser=" + parserUsed + "}";
    }
}
