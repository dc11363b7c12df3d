package me.golemcore.comfyagent.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Factory for Feign HTTP clients with OkHttp transport and Jackson JSON
 * encoding.
 *
 * <pre>{@code
 * ComfyUiApi api = factory.create(ComfyUiApi.class, "http://127.0.0.1:8188");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client for the given API interface. Feign's own retryer is
     * disabled: callers decide whether a failed backend call is worth repeating.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        return create(apiType, baseUrl, Feign.builder().retryer(Retryer.NEVER_RETRY));
    }

    /**
     * Create a Feign client with custom options.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Feign.Builder builder) {
        return builder
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
