package me.golemcore.comfyagent.domain.tools;

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
import me.golemcore.comfyagent.domain.model.ToolDefinition;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named tool handlers in a stable, name-sorted order.
 *
 * <p>
 * The application registry holds every enabled tool bean. Sub-agents get a
 * narrowed copy through {@link #subset(Collection)}.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new TreeMap<>();

    @Autowired
    public ToolRegistry(List<ToolComponent> components) {
        for (ToolComponent component : components) {
            if (component.isEnabled()) {
                register(component);
            } else {
                log.info("[Tools] Tool disabled: {}", component.getToolName());
            }
        }
    }

    private ToolRegistry(Map<String, ToolComponent> tools) {
        this.tools.putAll(tools);
    }

    public static ToolRegistry of(ToolComponent... components) {
        return new ToolRegistry(List.of(components));
    }

    public final void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank: " + tool.getClass().getName());
        }
        if (tools.containsKey(name)) {
            throw new IllegalStateException("Duplicate tool name: " + name);
        }
        tools.put(name, tool);
    }

    public Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    public List<String> getToolNames() {
        return new ArrayList<>(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    /**
     * Copy restricted to the given names. Names that are not registered are
     * skipped.
     */
    public ToolRegistry subset(Collection<String> names) {
        Map<String, ToolComponent> selected = new TreeMap<>();
        for (String name : names) {
            ToolComponent tool = tools.get(name);
            if (tool != null) {
                selected.put(name, tool);
            }
        }
        return new ToolRegistry(selected);
    }
}
