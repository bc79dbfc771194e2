package com.sentrius.yang.model;

public class SourceFile {
    private final String name;
    private final String content;

    public SourceFile(String name, String content) {
        this.name = name;
        this.content = content;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "SourceFile{name='" + name + "', length=" + (content != null ? content.length() : 0) + "}";
    }
}
