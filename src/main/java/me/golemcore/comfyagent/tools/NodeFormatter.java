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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Condensed text rendering of ComfyUI {@code object_info} entries.
 */
final class NodeFormatter {

    private static final int MAX_INLINE_OPTIONS = 5;

    private NodeFormatter() {
    }

    /**
     * Typed connections only, e.g.
     * {@code IN: model(MODEL), latent_image(LATENT) -> OUT: LATENT}.
     */
    static String ioSummary(Map<String, Object> info) {
        List<String> typedInputs = new ArrayList<>();
        for (Map.Entry<String, Object> input : inputs(info, "required").entrySet()) {
            connectionType(input.getValue()).ifPresent(type -> typedInputs.add(input.getKey() + "(" + type + ")"));
        }
        for (Map.Entry<String, Object> input : inputs(info, "optional").entrySet()) {
            connectionType(input.getValue()).ifPresent(type -> typedInputs.add(input.getKey() + "(" + type + ")"));
        }

        List<?> outputs = info.get("output") instanceof List<?> list ? list : List.of();
        String out = outputs.isEmpty() ? "none"
                : outputs.stream().map(String::valueOf).collect(Collectors.joining(", "));
        if (typedInputs.isEmpty()) {
            return "OUT: " + out;
        }
        return "IN: " + String.join(", ", typedInputs) + " -> OUT: " + out;
    }

    static String detail(String className, Map<String, Object> info) {
        List<String> lines = new ArrayList<>();
        lines.add("Node: " + className);
        lines.add("  Display: " + textOr(info.get("display_name"), className));
        lines.add("  Category: " + textOr(info.get("category"), "unknown"));
        String description = textOr(info.get("description"), "");
        if (!description.isEmpty()) {
            lines.add("  Description: " + description);
        }

        appendInputs(lines, "  Required inputs:", inputs(info, "required"));
        appendInputs(lines, "  Optional inputs:", inputs(info, "optional"));

        List<?> outputTypes = info.get("output") instanceof List<?> list ? list : List.of();
        List<?> outputNames = info.get("output_name") instanceof List<?> list ? list : List.of();
        if (!outputTypes.isEmpty()) {
            lines.add("  Outputs:");
            for (int i = 0; i < outputTypes.size(); i++) {
                String name = i < outputNames.size() ? String.valueOf(outputNames.get(i)) : "output_" + i;
                lines.add("    [" + i + "] " + name + ": " + outputTypes.get(i));
            }
        }
        return String.join("\n", lines);
    }

    private static void appendInputs(List<String> lines, String header, Map<String, Object> inputs) {
        if (inputs.isEmpty()) {
            return;
        }
        lines.add(header);
        inputs.forEach((name, spec) -> lines.add("    " + name + ": " + formatParam(spec)));
    }

    static String formatParam(Object spec) {
        if (!(spec instanceof List<?> parts) || parts.isEmpty()) {
            return String.valueOf(spec);
        }
        Object head = parts.get(0);
        if (head instanceof List<?> options) {
            if (options.size() <= MAX_INLINE_OPTIONS) {
                return "enum[" + options.stream().map(String::valueOf).collect(Collectors.joining(", ")) + "]";
            }
            return "enum[" + options.stream().limit(3).map(String::valueOf).collect(Collectors.joining(", "))
                    + ", ... (" + options.size() + " options)]";
        }

        StringBuilder sb = new StringBuilder(String.valueOf(head));
        if (parts.size() > 1 && parts.get(1) instanceof Map<?, ?> constraints) {
            for (String key : List.of("default", "min", "max")) {
                if (constraints.containsKey(key)) {
                    sb.append(' ').append(key).append('=').append(constraints.get(key));
                }
            }
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> inputs(Map<String, Object> info, String section) {
        if (info.get("input") instanceof Map<?, ?> input && input.get(section) instanceof Map<?, ?> params) {
            return (Map<String, Object>) params;
        }
        return Map.of();
    }

    private static Optional<String> connectionType(Object spec) {
        if (spec instanceof List<?> parts && !parts.isEmpty() && parts.get(0) instanceof String type
                && type.equals(type.toUpperCase(Locale.ROOT)) && !type.isBlank()) {
            return Optional.of(type);
        }
        return Optional.empty();
    }

    private static String textOr(Object value, String fallback) {
        return value instanceof String text && !text.isBlank() ? text : fallback;
    }
}
