package me.golemcore.comfyagent.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.domain.service.NodeCatalog.CatalogNode;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Browses and searches the installed node classes.
 *
 * <p>
 * Without arguments it lists categories with node counts. With {@code category}
 * it lists the nodes of that category, and with {@code query} it runs a
 * weighted keyword search (optionally restricted to the category).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ListNodesTool implements ToolComponent {

    static final String NAME = "list_nodes";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_CATEGORY = "category";
    private static final int MAX_RESULTS = 20;

    private final NodeCatalog catalog;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List or search installed ComfyUI nodes. Call without arguments to see categories, "
                        + "with 'category' to browse one category, or with 'query' to search by keyword "
                        + "(class name, display name, category, description).")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "Search keywords, e.g. 'sampler' or 'load checkpoint'"),
                                PARAM_CATEGORY, Map.of(
                                        "type", "string",
                                        "description", "Category name or part of it, e.g. 'sampling'"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Integer> categories = catalog.categories();
            if (!catalog.isBuilt()) {
                return ToolResult.failure("Node index not available: ComfyUI may not be connected.");
            }

            String query = stringParam(parameters, PARAM_QUERY);
            String category = stringParam(parameters, PARAM_CATEGORY);
            if (query != null) {
                return search(query, category);
            }
            if (category != null) {
                return browse(category);
            }

            List<String> lines = new ArrayList<>();
            lines.add("Node categories (" + categories.size() + "):");
            categories.forEach((name, count) -> lines.add("  [" + name + "] (" + count + " nodes)"));
            return ToolResult.success(String.join("\n", lines),
                    Map.of("categories", List.copyOf(categories.keySet())));
        });
    }

    private ToolResult search(String query, String category) {
        List<CatalogNode> matches = catalog.search(query, category);
        if (matches.isEmpty()) {
            return ToolResult.success("No nodes found matching '" + query + "'.");
        }

        List<CatalogNode> shown = matches.subList(0, Math.min(MAX_RESULTS, matches.size()));
        List<String> lines = new ArrayList<>();
        lines.add("Search results for '" + query + "' (" + matches.size() + " matches, showing "
                + shown.size() + "):");
        for (CatalogNode node : shown) {
            lines.add("  - " + node.className() + " [" + node.category() + "] (" + node.displayName() + ") "
                    + NodeFormatter.ioSummary(node.info()));
        }
        if (matches.size() > shown.size()) {
            lines.add("  ... " + (matches.size() - shown.size()) + " more results. Refine your search.");
        }
        log.debug("[Tools] list_nodes query='{}' matched {}", query, matches.size());
        return ToolResult.success(String.join("\n", lines), Map.of("nodes", classNames(shown)));
    }

    private ToolResult browse(String category) {
        List<CatalogNode> nodes = catalog.inCategory(category);
        if (nodes.isEmpty()) {
            return ToolResult.success("Category '" + category + "' not found. Use 'query' to search nodes.");
        }
        List<String> lines = new ArrayList<>();
        lines.add("Nodes in [" + nodes.get(0).category() + "] (" + nodes.size() + "):");
        for (CatalogNode node : nodes) {
            lines.add("  - " + node.className() + " (" + node.displayName() + ")");
        }
        return ToolResult.success(String.join("\n", lines), Map.of("nodes", classNames(nodes)));
    }

    private static List<String> classNames(List<CatalogNode> nodes) {
        return nodes.stream().map(CatalogNode::className).toList();
    }

    private static String stringParam(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        return value instanceof String text && !text.isBlank() ? text.trim() : null;
    }
}
