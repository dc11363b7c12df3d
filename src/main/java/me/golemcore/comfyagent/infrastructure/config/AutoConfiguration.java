package me.golemcore.comfyagent.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.domain.tools.ToolRegistry;
import me.golemcore.comfyagent.port.outbound.ModelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans and the startup summary.
 *
 * <p>
 * Provides the shared {@link Clock}, the Jackson {@link ObjectMapper} used for
 * persistence and the wire protocol, and the {@code agentExecutor} on which
 * turns and tool invocations run.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final ModelPort modelPort;
    private final ToolRegistry toolRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService agentExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "agent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @PostConstruct
    public void init() {
        log.info("ComfyUI agent starting...");
        log.info("LLM Provider: {} ({})", properties.getLlm().getProvider(), modelPort.getModelName());
        log.info("Workflow backend: {}", properties.getComfyui().getBaseUrl());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Tools: {}", toolRegistry.getToolNames());
        if (!modelPort.isAvailable()) {
            log.warn("LLM provider is not configured, chat requests will fail until an API key is set");
        }
    }
}
