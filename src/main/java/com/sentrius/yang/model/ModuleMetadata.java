package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Header information of a parsed document: what it imports and includes, its
 * revision history, and its namespace and prefix.
 */
@JsonPropertyOrder({"filename", "imports", "includes", "revisions", "namespace", "prefix"})
public class ModuleMetadata {
    private final String filename;
    private final List<String> imports;
    private final List<String> includes;
    private final List<String> revisions;
    private final String namespace;
    private final String prefix;

    private ModuleMetadata(Builder builder) {
        this.filename = builder.filename;
        this.imports = Collections.unmodifiableList(new ArrayList<>(builder.imports));
        this.includes = Collections.unmodifiableList(new ArrayList<>(builder.includes));
        this.revisions = Collections.unmodifiableList(new ArrayList<>(builder.revisions));
        this.namespace = builder.namespace;
        this.prefix = builder.prefix;
    }

    public static ModuleMetadata empty(String filename) {
        return new Builder(filename).build();
    }

    public String getFilename() {
        return filename;
    }

    public List<String> getImports() {
        return imports;
    }

    public List<String> getIncludes() {
        return includes;
    }

    public List<String> getRevisions() {
        return revisions;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getPrefix() {
        return prefix;
    }

    public static class Builder {
        private final String filename;
        private final List<String> imports = new ArrayList<>();
        private final List<String> includes = new ArrayList<>();
        private final List<String> revisions = new ArrayList<>();
        private String namespace;
        private String prefix;

        public Builder(String filename) {
            this.filename = filename;
        }

        public Builder addImport(String module) {
            imports.add(module);
            return this;
        }

        public Builder addInclude(String submodule) {
            includes.add(submodule);
            return this;
        }

        public Builder addRevision(String date) {
            revisions.add(date);
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public boolean hasNamespace() {
            return namespace != null;
        }

        public boolean hasPrefix() {
            return prefix != null;
        }

        public ModuleMetadata build() {
            return new ModuleMetadata(this);
        }
    }

    @Override
    public String toString() {
        return "ModuleMetadata{filename='" + filename + "', imports=" + imports + ", includes=" + includes +
               ", revisions=" + revisions + ", namespace='" + namespace + "', prefix='" + prefix + "'}";
    }
}
