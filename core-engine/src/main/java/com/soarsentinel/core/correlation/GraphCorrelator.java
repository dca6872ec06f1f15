package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.CorrelationPattern;
import com.soarsentinel.core.model.CorrelationTechnique;
import com.soarsentinel.core.model.PatternEntity;
import com.soarsentinel.core.model.ThreatIntel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds groups of alerts and threat-intel entries linked by shared
 * indicators or a common source.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Build an {@link EntityGraph}.</li>
 * <li>Take its connected components of two or more nodes as communities.
 * This is plain connected-component search; a large, loosely connected graph
 * stays one community.</li>
 * <li>Score each: {@code density = min(1, edges / (n(n-1)/2))},
 * {@code confidence = 0.6 * density + 0.4 * meanEdgeWeight}. Keep communities
 * with density above {@value #DENSITY_THRESHOLD}.</li>
 * <li>Name each community after its most connected node, and report the top
 * three nodes by degree as central nodes.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class GraphCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(GraphCorrelator.class);

    static final double DENSITY_THRESHOLD = 0.5;
    private static final int CENTRAL_NODES = 3;
    private static final int NAME_TITLE_LENGTH = 30;

    private final CorrelationOptions options;

    public GraphCorrelator(CorrelationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public List<CorrelationPattern> findPatterns(List<Alert> alerts, List<ThreatIntel> threatIntel) {
        Objects.requireNonNull(alerts, "alerts must not be null");
        if (alerts.size() < 2) {
            return List.of();
        }
        EntityGraph graph = EntityGraph.build(alerts, threatIntel != null ? threatIntel : List.of(),
                Duration.ofMillis(options.timeWindowMillis()));

        List<CorrelationPattern> patterns = new ArrayList<>();
        int index = 0;
        for (Set<String> component : graph.components()) {
            if (component.size() < 2) {
                continue;
            }
            index++;
            List<EntityGraph.Edge> edges = graph.edgesWithin(component);
            double maxEdges = component.size() * (component.size() - 1) / 2.0;
            double density = Math.min(1.0, edges.size() / maxEdges);
            if (density <= DENSITY_THRESHOLD) {
                LOG.trace("Discarding community of {} node(s) with density {}", component.size(), density);
                continue;
            }
            double meanWeight = edges.stream().mapToDouble(e -> e.weight).average().orElse(0.0);
            double confidence = 0.6 * density + 0.4 * meanWeight;
            patterns.add(toPattern(graph, component, edges, density, confidence, index));
        }

        patterns.sort(Comparator.comparingDouble(CorrelationPattern::getConfidence).reversed()
                .thenComparing(CorrelationPattern::getId));
        LOG.debug("Graph correlation over {} alert(s) and {} intel entr(ies) produced {} pattern(s)",
                alerts.size(), threatIntel != null ? threatIntel.size() : 0, patterns.size());
        return patterns;
    }

    private CorrelationPattern toPattern(EntityGraph graph, Set<String> component, List<EntityGraph.Edge> edges,
            double density, double confidence, int index) {
        List<String> central = centralNodes(edges);
        String name = communityName(graph, central, index);

        Set<String> primaryIocs = new LinkedHashSet<>();
        for (EntityGraph.Edge edge : edges) {
            if (EntityGraph.SHARES_IOC.equals(edge.relation) && edge.ioc != null) {
                primaryIocs.add(edge.ioc);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("communityName", name);
        metadata.put("communitySize", component.size());
        metadata.put("density", density);
        metadata.put("connections", edges.size());
        metadata.put("centralNodes", central);
        metadata.put("primaryIocs", List.copyOf(primaryIocs));

        List<PatternEntity> entities = component.stream()
                .map(graph::node)
                .map(n -> new PatternEntity(n.type, n.id, central.contains(n.key()) ? "central" : "member"))
                .toList();

        return CorrelationPattern.builder()
                .id("graph:" + (central.isEmpty() ? component.iterator().next() : central.get(0)))
                .name("Related entity group: " + name)
                .description(String.format(Locale.ROOT,
                        "Network of %d related entities with a connection density of %.1f%%. %d connections identified.",
                        component.size(), density * 100, edges.size()))
                .confidence(confidence)
                .entities(entities)
                .technique(CorrelationTechnique.GRAPH_BASED)
                .rules(List.of("entity_relationship", "graph_community_detection", "centrality_analysis"))
                .metadata(metadata)
                .build();
    }

    /**
     * @return node keys of the highest-degree nodes, ties broken by key
     */
    static List<String> centralNodes(List<EntityGraph.Edge> edges) {
        Map<String, Integer> degree = new LinkedHashMap<>();
        for (EntityGraph.Edge edge : edges) {
            degree.merge(edge.source, 1, Integer::sum);
            degree.merge(edge.target, 1, Integer::sum);
        }
        return degree.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(CENTRAL_NODES)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String communityName(EntityGraph graph, List<String> central, int index) {
        if (!central.isEmpty()) {
            EntityGraph.Node node = graph.node(central.get(0));
            if (node != null && node.title != null && !node.title.isBlank()) {
                String title = node.title.length() > NAME_TITLE_LENGTH
                        ? node.title.substring(0, NAME_TITLE_LENGTH)
                        : node.title;
                return "Group based on " + title;
            }
        }
        return "Activity group " + index;
    }
}
