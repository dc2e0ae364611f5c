package com.opstranslate.core.graph;

import com.opstranslate.core.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders workflow graph nodes so that every edge's source precedes its target.
 *
 * <p>Kahn's algorithm. When several nodes are ready at once, the one with the lowest
 * document position goes first, so the result is fully determined by the input.
 */
public final class DependencyOrderer {

    private static final Logger log = LoggerFactory.getLogger(DependencyOrderer.class);

    /**
     * Produces a dependency-respecting linear order of the nodes.
     *
     * @param sourceName document name, used for the cycle error
     * @param nodes graph nodes, identified by {@link SourceUnit#location()}
     * @param edges dependencies between node locations
     * @return nodes in execution order
     * @throws DependencyCycleException if the edges form a cycle
     * @throws IllegalArgumentException if node locations repeat or an edge names an unknown node
     */
    public List<SourceUnit> order(String sourceName, List<SourceUnit> nodes, List<GraphEdge> edges)
            throws DependencyCycleException {
        Map<String, SourceUnit> byLocation = new LinkedHashMap<>();
        for (SourceUnit node : nodes) {
            if (byLocation.put(node.location(), node) != null) {
                throw new IllegalArgumentException("duplicate graph node: " + node.location());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        byLocation.keySet().forEach(location -> {
            inDegree.put(location, 0);
            successors.put(location, new ArrayList<>());
        });
        for (GraphEdge edge : edges) {
            if (!byLocation.containsKey(edge.from()) || !byLocation.containsKey(edge.to())) {
                throw new IllegalArgumentException("edge references unknown node: " + edge);
            }
            successors.get(edge.from()).add(edge.to());
            inDegree.merge(edge.to(), 1, Integer::sum);
        }

        PriorityQueue<SourceUnit> ready = new PriorityQueue<>(
            Comparator.comparingInt(SourceUnit::position).thenComparing(SourceUnit::location));
        byLocation.values().stream()
            .filter(node -> inDegree.get(node.location()) == 0)
            .forEach(ready::add);

        List<SourceUnit> ordered = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            SourceUnit node = ready.poll();
            ordered.add(node);
            for (String next : successors.get(node.location())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(byLocation.get(next));
                }
            }
        }

        if (ordered.size() < byLocation.size()) {
            List<String> remaining = byLocation.values().stream()
                .filter(node -> inDegree.get(node.location()) > 0)
                .sorted(Comparator.comparingInt(SourceUnit::position))
                .map(SourceUnit::location)
                .toList();
            log.error("Dependency cycle in {}: {}", sourceName, remaining);
            throw new DependencyCycleException(sourceName, remaining);
        }

        log.debug("Ordered {} nodes of {} over {} edges", ordered.size(), sourceName, edges.size());
        return ordered;
    }
}
