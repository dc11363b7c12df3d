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
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import me.golemcore.comfyagent.domain.model.ToolResult;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.domain.service.NodeCatalog.CatalogNode;
import me.golemcore.comfyagent.domain.tools.ToolComponent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Checks an API-format workflow against the node catalog before it is queued.
 *
 * <p>
 * Errors: missing or unknown {@code class_type}, missing required inputs, links
 * to nodes that are not in the graph or to output slots the source node does
 * not have. Warnings: inputs the node class does not declare.
 */
@Component
@RequiredArgsConstructor
public class ValidateWorkflowTool implements ToolComponent {

    private static final String PARAM_WORKFLOW = "workflow";
    private static final String KEY_INPUT = "input";

    private final NodeCatalog catalog;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("validate_workflow")
                .description("Validate a ComfyUI workflow before submitting it. Checks that every node class "
                        + "exists, required inputs are provided and links point at existing node outputs. "
                        + "Always validate before submit_workflow.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_WORKFLOW, Map.of(
                                        "type", "object",
                                        "description", "Workflow in API format (node_id -> {class_type, inputs})")),
                        "required", List.of(PARAM_WORKFLOW)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> workflow = (Map<String, Object>) parameters.get(PARAM_WORKFLOW);
            if (workflow == null || workflow.isEmpty()) {
                return ToolResult.failure("workflow must contain at least one node");
            }
            catalog.categories();
            if (!catalog.isBuilt()) {
                return ToolResult.failure("Node index not available: cannot validate without ComfyUI.");
            }

            List<String> errors = new ArrayList<>();
            List<String> warnings = new ArrayList<>();
            for (Map.Entry<String, Object> entry : workflow.entrySet()) {
                validateNode(entry.getKey(), entry.getValue(), workflow, errors, warnings);
            }

            Map<String, Object> data = Map.of("valid", errors.isEmpty(), "errors", errors, "warnings", warnings);
            if (errors.isEmpty() && warnings.isEmpty()) {
                return ToolResult.success("Workflow valid: " + workflow.size() + " nodes, all checks passed.", data);
            }
            List<String> lines = new ArrayList<>();
            if (!errors.isEmpty()) {
                lines.add("Errors (" + errors.size() + "):");
                errors.forEach(error -> lines.add("  - " + error));
            }
            if (!warnings.isEmpty()) {
                lines.add("Warnings (" + warnings.size() + "):");
                warnings.forEach(warning -> lines.add("  - " + warning));
            }
            return ToolResult.success(String.join("\n", lines), data);
        });
    }

    private void validateNode(String nodeId, Object rawNode, Map<String, Object> workflow, List<String> errors,
            List<String> warnings) {
        if (!(rawNode instanceof Map<?, ?> node)) {
            errors.add("Node " + nodeId + ": expected an object with class_type and inputs");
            return;
        }
        Object classType = node.get("class_type");
        if (!(classType instanceof String className) || className.isBlank()) {
            errors.add("Node " + nodeId + ": missing class_type");
            return;
        }

        Optional<CatalogNode> match = catalog.find(className);
        if (match.isEmpty()) {
            errors.add("Node " + nodeId + ": unknown class_type '" + className + "'");
            return;
        }
        CatalogNode known = match.get();
        if (!known.className().equals(className)) {
            errors.add("Node " + nodeId + ": unknown class_type '" + className + "' (did you mean '"
                    + known.className() + "'?)");
            return;
        }

        String label = "Node " + nodeId + " (" + className + ")";
        Map<?, ?> inputs = node.get("inputs") instanceof Map<?, ?> provided ? provided : Map.of();
        Set<String> required = section(known, "required");
        Set<String> declared = new LinkedHashSet<>(required);
        declared.addAll(section(known, "optional"));
        declared.addAll(section(known, "hidden"));

        for (String name : required) {
            if (!inputs.containsKey(name)) {
                errors.add(label + ": missing required input '" + name + "'");
            }
        }
        for (Map.Entry<?, ?> input : inputs.entrySet()) {
            String name = String.valueOf(input.getKey());
            if (!declared.contains(name)) {
                warnings.add(label + ": unknown input '" + name + "'");
            }
            if (input.getValue() instanceof List<?> link && isLink(link)) {
                validateLink(label, name, link, workflow, errors);
            }
        }
    }

    private void validateLink(String label, String inputName, List<?> link, Map<String, Object> workflow,
            List<String> errors) {
        String sourceId = String.valueOf(link.get(0));
        int slot = ((Number) link.get(1)).intValue();
        if (!(workflow.get(sourceId) instanceof Map<?, ?> source)) {
            errors.add(label + ": input '" + inputName + "' links to missing node " + sourceId);
            return;
        }
        if (!(source.get("class_type") instanceof String sourceClass)) {
            return;
        }
        catalog.find(sourceClass)
                .filter(node -> node.className().equals(sourceClass))
                .filter(node -> node.info().get("output") instanceof List<?> outputs && slot >= outputs.size())
                .ifPresent(node -> errors.add(label + ": input '" + inputName + "' links to output " + slot
                        + " of node " + sourceId + " (" + sourceClass + "), which has "
                        + ((List<?>) node.info().get("output")).size() + " outputs"));
    }

    private static boolean isLink(List<?> value) {
        return value.size() == 2 && (value.get(0) instanceof String || value.get(0) instanceof Number)
                && value.get(1) instanceof Number;
    }

    private static Set<String> section(CatalogNode node, String name) {
        if (node.info().get(KEY_INPUT) instanceof Map<?, ?> input && input.get(name) instanceof Map<?, ?> params) {
            Set<String> names = new LinkedHashSet<>();
            params.keySet().forEach(key -> names.add(String.valueOf(key)));
            return names;
        }
        return Set.of();
    }
}
