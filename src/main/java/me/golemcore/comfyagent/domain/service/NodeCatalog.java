package me.golemcore.comfyagent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory index of the backend's installed node classes, built from
 * {@code object_info} and refreshed after a TTL.
 *
 * <p>
 * Search scores every node per query term: exact class name 10, class name
 * contains 5, display name 4, category 2, description 1. Results are ordered by
 * score, then by class name.
 */
@Service
@Slf4j
public class NodeCatalog {

    private static final String UNCATEGORIZED = "uncategorized";

    private final WorkflowBackendPort backend;
    private final Clock clock;
    private final Duration ttl;

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    @Autowired
    public NodeCatalog(WorkflowBackendPort backend, Clock clock, AgentProperties properties) {
        this(backend, clock, Duration.ofSeconds(properties.getComfyui().getCatalogTtlSeconds()));
    }

    // Visible for testing
    NodeCatalog(WorkflowBackendPort backend, Clock clock, Duration ttl) {
        this.backend = backend;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * A single node class as reported by the backend.
     */
    public record CatalogNode(String className, String displayName, String category, String description,
            Map<String, Object> info) {
    }

    /**
     * Rebuilds the index. Keeps the previous snapshot when the backend cannot be
     * reached.
     *
     * @return whether the index is usable afterwards
     */
    public synchronized boolean refresh() {
        Map<String, Object> objectInfo;
        try {
            objectInfo = backend.queryObjectInfo();
        } catch (WorkflowBackendPort.WorkflowBackendException e) {
            log.warn("[Catalog] Failed to fetch object_info: {}", e.getMessage());
            return snapshot.built();
        }

        Map<String, CatalogNode> nodes = new TreeMap<>();
        Map<String, Integer> categories = new TreeMap<>();
        for (Map.Entry<String, Object> entry : objectInfo.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> raw)) {
                continue;
            }
            Map<String, Object> info = toStringKeyed(raw);
            String className = entry.getKey();
            String category = textOr(info.get("category"), UNCATEGORIZED);
            nodes.put(className, new CatalogNode(className,
                    textOr(info.get("display_name"), className),
                    category,
                    textOr(info.get("description"), ""),
                    info));
            categories.merge(category, 1, Integer::sum);
        }

        snapshot = new Snapshot(true, Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(categories),
                clock.instant());
        log.info("[Catalog] Node index built: {} nodes in {} categories", nodes.size(), categories.size());
        return true;
    }

    public boolean isBuilt() {
        return snapshot.built();
    }

    public int nodeCount() {
        return snapshot.nodes().size();
    }

    /**
     * Category name to node count, sorted by name.
     */
    public Map<String, Integer> categories() {
        ensureFresh();
        return snapshot.categories();
    }

    public Optional<CatalogNode> find(String className) {
        ensureFresh();
        if (className == null) {
            return Optional.empty();
        }
        Map<String, CatalogNode> nodes = snapshot.nodes();
        CatalogNode exact = nodes.get(className);
        if (exact != null) {
            return Optional.of(exact);
        }
        return nodes.values().stream()
                .filter(node -> node.className().equalsIgnoreCase(className))
                .findFirst();
    }

    /**
     * Nodes whose category matches, exactly (ignoring case) or else by substring.
     */
    public List<CatalogNode> inCategory(String category) {
        ensureFresh();
        String wanted = category.toLowerCase(Locale.ROOT);
        String matched = snapshot.categories().keySet().stream()
                .filter(candidate -> candidate.equalsIgnoreCase(category))
                .findFirst()
                .orElseGet(() -> snapshot.categories().keySet().stream()
                        .filter(candidate -> candidate.toLowerCase(Locale.ROOT).contains(wanted))
                        .findFirst()
                        .orElse(null));
        if (matched == null) {
            return List.of();
        }
        return snapshot.nodes().values().stream()
                .filter(node -> node.category().equals(matched))
                .toList();
    }

    /**
     * Weighted keyword search, optionally restricted to a category substring.
     */
    public List<CatalogNode> search(String query, String category) {
        ensureFresh();
        String[] terms = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        String categoryFilter = category != null && !category.isBlank() ? category.toLowerCase(Locale.ROOT) : null;

        List<Map.Entry<CatalogNode, Integer>> ranked = new ArrayList<>();
        for (CatalogNode node : snapshot.nodes().values()) {
            if (categoryFilter != null && !node.category().toLowerCase(Locale.ROOT).contains(categoryFilter)) {
                continue;
            }
            int score = score(node, terms);
            if (score > 0) {
                ranked.add(Map.entry(node, score));
            }
        }

        ranked.sort(Comparator.<Map.Entry<CatalogNode, Integer>>comparingInt(Map.Entry::getValue).reversed()
                .thenComparing(e -> e.getKey().className()));
        return ranked.stream().map(Map.Entry::getKey).toList();
    }

    private static int score(CatalogNode node, String[] terms) {
        String className = node.className().toLowerCase(Locale.ROOT);
        String display = node.displayName().toLowerCase(Locale.ROOT);
        String category = node.category().toLowerCase(Locale.ROOT);
        String description = node.description().toLowerCase(Locale.ROOT);

        int score = 0;
        for (String term : terms) {
            if (term.isEmpty()) {
                continue;
            }
            if (term.equals(className)) {
                score += 10;
            } else if (className.contains(term)) {
                score += 5;
            }
            if (display.contains(term)) {
                score += 4;
            }
            if (category.contains(term)) {
                score += 2;
            }
            if (description.contains(term)) {
                score += 1;
            }
        }
        return score;
    }

    private void ensureFresh() {
        Snapshot current = snapshot;
        if (!current.built() || current.builtAt().plus(ttl).isBefore(clock.instant())) {
            refresh();
        }
    }

    private static Map<String, Object> toStringKeyed(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static String textOr(Object value, String fallback) {
        return value instanceof String text && !text.isBlank() ? text : fallback;
    }

    private record Snapshot(boolean built, Map<String, CatalogNode> nodes, Map<String, Integer> categories,
            Instant builtAt) {

        static final Snapshot EMPTY = new Snapshot(false, Map.of(), Map.of(), Instant.EPOCH);
    }
}
