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

import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.List;
import java.util.Map;

/**
 * Feign binding for the ComfyUI HTTP API.
 */
@Headers("Accept: application/json")
interface ComfyUiApi {

    @RequestLine("POST /api/prompt")
    @Headers("Content-Type: application/json")
    Map<String, Object> queuePrompt(Map<String, Object> body);

    @RequestLine("GET /api/object_info")
    Map<String, Object> objectInfo();

    @RequestLine("GET /api/object_info/{nodeClass}")
    Map<String, Object> objectInfo(@Param("nodeClass") String nodeClass);

    @RequestLine("GET /api/history?max_items={maxItems}")
    Map<String, Object> history(@Param("maxItems") int maxItems);

    @RequestLine("GET /api/history/{promptId}")
    Map<String, Object> history(@Param("promptId") String promptId);

    @RequestLine("GET /api/queue")
    Map<String, Object> queue();

    @RequestLine("POST /api/interrupt")
    void interrupt();

    @RequestLine("GET /api/models/{folder}")
    List<String> models(@Param("folder") String folder);

    @RequestLine("GET /api/system_stats")
    Map<String, Object> systemStats();
}
