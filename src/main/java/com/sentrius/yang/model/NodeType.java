package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

public enum NodeType {
    MODULE("module", true),
    SUBMODULE("submodule", true),
    CONTAINER("container", true),
    LIST("list", true),
    LEAF("leaf", false),
    LEAF_LIST("leaf-list", false),
    RPC("rpc", true),
    ACTION("action", true),
    INPUT("input", true),
    OUTPUT("output", true),
    NOTIFICATION("notification", true),
    CHOICE("choice", true),
    CASE("case", true),
    GROUPING("grouping", true),
    AUGMENT("augment", true),
    ANYDATA("anydata", false),
    ANYXML("anyxml", false),
    UNKNOWN("unknown", false);

    private static final Map<String, NodeType> BY_KEYWORD = new HashMap<>();

    static {
        for (NodeType type : values()) {
            BY_KEYWORD.put(type.keyword, type);
        }
    }

    private final String keyword;
    private final boolean scope;

    NodeType(String keyword, boolean scope) {
        this.keyword = keyword;
        this.scope = scope;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    /**
     * Whether nodes of this type hold child data nodes.
     */
    public boolean isScope() {
        return scope;
    }

    public static NodeType fromKeyword(String keyword) {
        NodeType type = BY_KEYWORD.get(keyword);
        return type != null ? type : UNKNOWN;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
