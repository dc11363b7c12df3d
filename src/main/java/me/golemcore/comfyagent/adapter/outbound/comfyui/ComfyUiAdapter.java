package me.golemcore.comfyagent.adapter.outbound.comfyui;

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

import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.infrastructure.http.FeignClientFactory;
import me.golemcore.comfyagent.port.outbound.WorkflowBackendPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link WorkflowBackendPort} over the ComfyUI HTTP API.
 *
 * <p>
 * Every Feign failure, including connection refusals, is rethrown as
 * {@link WorkflowBackendPort.WorkflowBackendException} carrying the HTTP status
 * and a short body excerpt so that tools can report it to the model verbatim.
 */
@Component
@Slf4j
public class ComfyUiAdapter implements WorkflowBackendPort {

    private static final int BODY_EXCERPT_CHARS = 300;

    private final ComfyUiApi api;
    private final String clientId;
    private final int historyMaxItems;

    @Autowired
    public ComfyUiAdapter(FeignClientFactory feignClientFactory, AgentProperties properties) {
        this(feignClientFactory.create(ComfyUiApi.class, properties.getComfyui().getBaseUrl()), properties);
        log.info("[ComfyUI] Client targeting {}", properties.getComfyui().getBaseUrl());
    }

    // Visible for testing
    ComfyUiAdapter(ComfyUiApi api, AgentProperties properties) {
        this.api = api;
        this.clientId = properties.getComfyui().getClientId();
        this.historyMaxItems = properties.getComfyui().getHistoryMaxItems();
    }

    @Override
    public String submit(Map<String, Object> workflow) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", workflow);
        body.put("client_id", clientId);
        Map<String, Object> response = call("queue prompt", () -> api.queuePrompt(body));

        Object promptId = response != null ? response.get("prompt_id") : null;
        if (promptId == null) {
            throw new WorkflowBackendException("ComfyUI accepted the workflow but returned no prompt_id: " + response);
        }
        log.info("[ComfyUI] Queued prompt: {}", promptId);
        return promptId.toString();
    }

    @Override
    public Map<String, Object> queryObjectInfo() {
        return orEmpty(call("object_info", api::objectInfo));
    }

    @Override
    public Map<String, Object> queryNodeInfo(String nodeClass) {
        return orEmpty(call("object_info/" + nodeClass, () -> api.objectInfo(nodeClass)));
    }

    @Override
    public Map<String, Object> queryHistory(String promptId) {
        if (promptId == null || promptId.isBlank()) {
            return orEmpty(call("history", () -> api.history(historyMaxItems)));
        }
        return orEmpty(call("history/" + promptId, () -> api.history(promptId)));
    }

    @Override
    public Map<String, Object> queryQueue() {
        return orEmpty(call("queue", api::queue));
    }

    @Override
    public void interrupt() {
        call("interrupt", () -> {
            api.interrupt();
            return null;
        });
        log.info("[ComfyUI] Interrupted current execution");
    }

    @Override
    public List<String> listModels(String folder) {
        List<String> models = call("models/" + folder, () -> api.models(folder));
        return models != null ? models : List.of();
    }

    @Override
    public Map<String, Object> systemStats() {
        return orEmpty(call("system_stats", api::systemStats));
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (FeignException e) {
            String message = describe(operation, e);
            log.debug("[ComfyUI] {}", message);
            throw new WorkflowBackendException(message, e);
        }
    }

    private static String describe(String operation, FeignException e) {
        if (e.status() <= 0) {
            return "ComfyUI unreachable (" + operation + "): " + e.getMessage();
        }
        String body = e.contentUTF8();
        if (body != null && body.length() > BODY_EXCERPT_CHARS) {
            body = body.substring(0, BODY_EXCERPT_CHARS) + "...";
        }
        return "ComfyUI " + operation + " failed with HTTP " + e.status()
                + (body != null && !body.isBlank() ? ": " + body : "");
    }

    private static Map<String, Object> orEmpty(Map<String, Object> value) {
        return value != null ? value : Map.of();
    }
}
