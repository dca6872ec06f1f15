package com.soarsentinel.core.correlation;

import com.soarsentinel.core.model.Alert;
import com.soarsentinel.core.model.IocSet;
import com.soarsentinel.core.model.PatternEntity;
import com.soarsentinel.core.model.ThreatIntel;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Undirected graph of alerts and threat-intel entries for one correlation
 * run.
 *
 * <h3>Edges</h3>
 * <ul>
 * <li>{@code shares_ioc}: both nodes carry the same IP (weight 1.0), domain
 * (0.8) or hash (1.0). Alert IPs include the source and destination IP.</li>
 * <li>{@code same_source}: two alerts from the same source whose timestamps
 * differ by at most the time window (0.6).</li>
 * </ul>
 * <p>
 * A node pair gets at most one edge per relation; the first IOC found, in
 * the order IP, domain, hash, determines the weight. The IOC indices are
 * built once per graph.
 * </p>
 */
final class EntityGraph {

    static final String SHARES_IOC = "shares_ioc";
    static final String SAME_SOURCE = "same_source";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Set<String> edgeIds = new HashSet<>();
    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

    private EntityGraph() {
    }

    static EntityGraph build(Collection<Alert> alerts, Collection<ThreatIntel> intel, Duration sameSourceWindow) {
        EntityGraph graph = new EntityGraph();
        Map<String, List<String>> byIp = new LinkedHashMap<>();
        Map<String, List<String>> byDomain = new LinkedHashMap<>();
        Map<String, List<String>> byHash = new LinkedHashMap<>();

        for (Alert alert : alerts) {
            String key = graph.addNode(PatternEntity.ALERT, alert.getId(), alert.getTitle());
            Set<String> ips = new LinkedHashSet<>();
            addIfPresent(ips, alert.getSourceIp());
            addIfPresent(ips, alert.getDestinationIp());
            ips.addAll(alert.getIocs().getIps());
            index(byIp, ips, key);
            index(byDomain, alert.getIocs().getDomains(), key);
            index(byHash, alert.getIocs().getHashes(), key);
        }
        for (ThreatIntel entry : intel) {
            String key = graph.addNode(PatternEntity.INTEL, entry.getId(), entry.getTitle());
            IocSet iocs = entry.getIocs();
            index(byIp, iocs.getIps(), key);
            index(byDomain, iocs.getDomains(), key);
            index(byHash, iocs.getHashes(), key);
        }

        graph.connectShared(byIp, 1.0, "ip");
        graph.connectShared(byDomain, 0.8, "domain");
        graph.connectShared(byHash, 1.0, "hash");
        graph.connectSameSource(alerts, sameSourceWindow);
        return graph;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    Collection<Node> nodes() {
        return nodes.values();
    }

    Node node(String key) {
        return nodes.get(key);
    }

    List<Edge> edges() {
        return edges;
    }

    /**
     * Connected components in node insertion order, found by breadth-first
     * search over the adjacency map.
     */
    List<Set<String>> components() {
        Set<String> visited = new HashSet<>();
        List<Set<String>> components = new ArrayList<>();
        for (String start : nodes.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            Set<String> component = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            component.add(start);
            queue.add(start);
            while (!queue.isEmpty()) {
                for (String neighbour : adjacency.getOrDefault(queue.poll(), Set.of())) {
                    if (visited.add(neighbour)) {
                        component.add(neighbour);
                        queue.add(neighbour);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    List<Edge> edgesWithin(Set<String> component) {
        return edges.stream()
                .filter(e -> component.contains(e.source) && component.contains(e.target))
                .toList();
    }

    // ---------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------

    private String addNode(String type, long id, String title) {
        Node node = new Node(type, id, title);
        nodes.putIfAbsent(node.key(), node);
        adjacency.putIfAbsent(node.key(), new LinkedHashSet<>());
        return node.key();
    }

    private void connectShared(Map<String, List<String>> index, double weight, String iocType) {
        for (Map.Entry<String, List<String>> entry : index.entrySet()) {
            List<String> holders = entry.getValue();
            for (int i = 0; i < holders.size(); i++) {
                for (int j = i + 1; j < holders.size(); j++) {
                    addEdge(holders.get(i), holders.get(j), SHARES_IOC, weight, entry.getKey(), iocType);
                }
            }
        }
    }

    private void connectSameSource(Collection<Alert> alerts, Duration window) {
        Map<String, List<Alert>> bySource = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            bySource.computeIfAbsent(alert.getSource(), k -> new ArrayList<>()).add(alert);
        }
        for (List<Alert> group : bySource.values()) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    Alert a = group.get(i);
                    Alert b = group.get(j);
                    if (Duration.between(a.getTimestamp(), b.getTimestamp()).abs().compareTo(window) <= 0) {
                        addEdge(keyOf(PatternEntity.ALERT, a.getId()), keyOf(PatternEntity.ALERT, b.getId()),
                                SAME_SOURCE, 0.6, null, null);
                    }
                }
            }
        }
    }

    private void addEdge(String source, String target, String relation, double weight, String ioc, String iocType) {
        if (source.equals(target)) {
            return;
        }
        String id = source.compareTo(target) < 0
                ? source + "|" + target + "|" + relation
                : target + "|" + source + "|" + relation;
        if (!edgeIds.add(id)) {
            return;
        }
        edges.add(new Edge(source, target, relation, weight, ioc, iocType));
        adjacency.get(source).add(target);
        adjacency.get(target).add(source);
    }

    private static void index(Map<String, List<String>> index, Collection<String> values, String key) {
        for (String value : values) {
            List<String> holders = index.computeIfAbsent(value, k -> new ArrayList<>());
            if (!holders.contains(key)) {
                holders.add(key);
            }
        }
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.trim());
        }
    }

    static String keyOf(String type, long id) {
        return type + ":" + id;
    }

    // ---------------------------------------------------------------
    // Elements
    // ---------------------------------------------------------------

    static final class Node {
        final String type;
        final long id;
        final String title;

        Node(String type, long id, String title) {
            this.type = Objects.requireNonNull(type);
            this.id = id;
            this.title = title;
        }

        String key() {
            return keyOf(type, id);
        }
    }

    static final class Edge {
        final String source;
        final String target;
        final String relation;
        final double weight;
        final String ioc;
        final String iocType;

        Edge(String source, String target, String relation, double weight, String ioc, String iocType) {
            this.source = source;
            this.target = target;
            this.relation = relation;
            this.weight = weight;
            this.ioc = ioc;
            this.iocType = iocType;
        }
    }
}
