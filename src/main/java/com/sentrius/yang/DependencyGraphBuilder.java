package com.sentrius.yang;

import com.sentrius.yang.model.DependencyGraph;
import com.sentrius.yang.model.DependencyGraph.Edge;
import com.sentrius.yang.model.DependencyGraph.EdgeKind;
import com.sentrius.yang.model.DependencyGraph.Node;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a one-hop graph from the modules each file imports. Every import
 * statement yields one edge, so a module imported twice by the same file gives
 * two edges. No cycle detection or transitive closure is done.
 */
public class DependencyGraphBuilder {

    /**
     * @param perFileImports filename to imported module names, in iteration order
     * @return graph with a node per file and per imported module
     */
    public DependencyGraph build(Map<String, List<String>> perFileImports) {
        List<Node> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Map.Entry<String, List<String>> entry : perFileImports.entrySet()) {
            addEdges(entry.getKey(), entry.getValue(), nodes, edges, seen);
        }
        return new DependencyGraph(nodes, edges);
    }

    private void addEdges(String filename, List<String> targets,
                          List<Node> nodes, List<Edge> edges, Set<String> seen) {
        addNode(filename, nodes, seen);
        if (targets == null) {
            return;
        }
        for (String target : targets) {
            addNode(target, nodes, seen);
            edges.add(new Edge(filename, target, EdgeKind.IMPORT));
        }
    }

    private void addNode(String id, List<Node> nodes, Set<String> seen) {
        if (seen.add(id)) {
            nodes.add(new Node(id, id));
        }
    }
}
