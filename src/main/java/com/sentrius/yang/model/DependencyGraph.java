package com.sentrius.yang.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One-hop dependency graph between documents and the modules they reference.
 */
@JsonPropertyOrder({"nodes", "edges"})
public class DependencyGraph {
    private final List<Node> nodes;
    private final List<Edge> edges;

    public DependencyGraph(List<Node> nodes, List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public boolean hasNode(String id) {
        return nodes.stream().anyMatch(node -> Objects.equals(node.getId(), id));
    }

    public enum EdgeKind {
        IMPORT;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @JsonPropertyOrder({"id", "label"})
    public static class Node {
        private final String id;
        private final String label;

        public Node(String id, String label) {
            this.id = id;
            this.label = label;
        }

        public String getId() {
            return id;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Node)) {
                return false;
            }
            Node node = (Node) o;
            return Objects.equals(id, node.id) && Objects.equals(label, node.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, label);
        }

        @Override
        public String toString() {
            return "Node{id='" + id + "'}";
        }
    }

    @JsonPropertyOrder({"source", "target", "kind"})
    public static class Edge {
        private final String source;
        private final String target;
        private final EdgeKind kind;

        public Edge(String source, String target, EdgeKind kind) {
            this.source = source;
            this.target = target;
            this.kind = kind;
        }

        public String getSource() {
            return source;
        }

        public String getTarget() {
            return target;
        }

        public EdgeKind getKind() {
            return kind;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge edge = (Edge) o;
            return Objects.equals(source, edge.source) && Objects.equals(target, edge.target) && kind == edge.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target, kind);
        }

        @Override
        public String toString() {
            return "Edge{" + source + " -" + kind.getValue() + "-> " + target + "}";
        }
    }
}
