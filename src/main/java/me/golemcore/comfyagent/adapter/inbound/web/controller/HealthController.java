package me.golemcore.comfyagent.adapter.inbound.web.controller;

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
import me.golemcore.comfyagent.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.comfyagent.domain.service.NodeCatalog;
import me.golemcore.comfyagent.domain.tools.ToolRegistry;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Reachability of the workflow backend, the configured model and the node
 * index.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final WorkflowBackendPort backend;
    private final ModelPort modelPort;
    private final NodeCatalog nodeCatalog;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    @GetMapping
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(this::collect)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    HealthResponse collect() {
        Map<String, Object> stats = null;
        boolean connected;
        try {
            stats = backend.systemStats();
            connected = true;
        } catch (WorkflowBackendPort.WorkflowBackendException e) {
            log.debug("[API] Backend health check failed: {}", e.getMessage());
            connected = false;
        }
        if (connected && !nodeCatalog.isBuilt()) {
            nodeCatalog.refresh();
        }

        return HealthResponse.builder()
                .status(connected ? "ok" : "degraded")
                .comfyui(HealthResponse.BackendStatus.builder()
                        .connected(connected)
                        .url(properties.getComfyui().getBaseUrl())
                        .stats(stats)
                        .build())
                .llm(HealthResponse.ModelStatus.builder()
                        .model(modelPort.getModelName())
                        .configured(modelPort.isAvailable())
                        .build())
                .nodeIndex(HealthResponse.NodeIndexStatus.builder()
                        .built(nodeCatalog.isBuilt())
                        .nodeCount(nodeCatalog.nodeCount())
                        .categories(nodeCatalog.isBuilt() ? nodeCatalog.categories().size() : 0)
                        .build())
                .tools(toolRegistry.getToolNames())
                .build();
    }
}
