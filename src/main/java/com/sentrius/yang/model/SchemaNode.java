package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of the schema tree. Nodes are filled in while a document is parsed
 * and become read-only when the {@link ParseResult} holding them is built.
 */
@JsonPropertyOrder({"type", "name", "line", "description", "mandatory", "config", "properties", "children"})
public class SchemaNode {
    private final NodeType type;
    private final String name;
    private final Integer line;
    private String description;
    private boolean mandatory;
    private boolean config = true;
    private final NodeProperties properties = new NodeProperties();
    private final List<SchemaNode> children = new ArrayList<>();
    private boolean frozen;

    public SchemaNode(NodeType type, String name, Integer line) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.line = line;
    }

    public NodeType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Integer getLine() {
        return line;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        checkMutable();
        this.description = description;
    }

    public boolean isMandatory() {
        return mandatory;
    }

    public void setMandatory(boolean mandatory) {
        checkMutable();
        this.mandatory = mandatory;
    }

    public boolean isConfig() {
        return config;
    }

    public void setConfig(boolean config) {
        checkMutable();
        this.config = config;
    }

    public NodeProperties getProperties() {
        return properties;
    }

    public List<SchemaNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(SchemaNode child) {
        checkMutable();
        children.add(Objects.requireNonNull(child, "child"));
    }

    /**
     * Makes this node, its properties and its whole subtree read-only.
     */
    void freeze() {
        if (frozen) {
            return;
        }
        frozen = true;
        properties.freeze();
        for (SchemaNode child : children) {
            child.freeze();
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Schema node '" + name + "' is read-only once the parse result is built");
        }
    }

    /**
     * Finds the first direct child with the given name.
     * @param childName The child name
     * @return The child, or null if there is none
     */
    public SchemaNode findChild(String childName) {
        for (SchemaNode child : children) {
            if (Objects.equals(childName, child.getName())) {
                return child;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "SchemaNode{type=" + type + ", name='" + name + "', line=" + line +
               ", children=" + children.size() + "}";
    }
}
