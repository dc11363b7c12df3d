package me.golemcore.comfyagent.port.outbound;

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

import java.util.List;
import java.util.Map;

/**
 * Port for the generative-graph backend. Calls are blocking and throw
 * {@link WorkflowBackendException} on transport or protocol failures.
 */
public interface WorkflowBackendPort {

    /**
     * Queues a workflow graph for execution.
     *
     * @return the backend's prompt id
     */
    String submit(Map<String, Object> workflow);

    /**
     * Metadata of every installed node class, keyed by class name.
     */
    Map<String, Object> queryObjectInfo();

    Map<String, Object> queryNodeInfo(String nodeClass);

    /**
     * Execution history, either of one prompt or of the most recent entries.
     */
    Map<String, Object> queryHistory(String promptId);

    Map<String, Object> queryQueue();

    void interrupt();

    List<String> listModels(String folder);

    Map<String, Object> systemStats();

    /**
     * Failure talking to the backend.
     */
    class WorkflowBackendException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public WorkflowBackendException(String message) {
            super(message);
        }

        public WorkflowBackendException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
