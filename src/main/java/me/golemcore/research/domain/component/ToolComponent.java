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

package me.golemcore.research.domain.component;

import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.ToolResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool adapter invocable by the model through function calling. A tool exposes
 * its JSON Schema definition and completes its future with a
 * {@link ToolResult}; failures are reported as failed results, never as
 * exceptions past this boundary.
 */
public interface ToolComponent {

    Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Checks whether this tool is enabled and usable. Tools with missing
     * configuration return false and are not registered.
     *
     * @return true if the tool is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Parameters have already been checked against the
     * required fields and types of the definition.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Executes the tool within a research run. Tools that spawn work of their
     * own override this to inherit the run's cancellation and metrics.
     */
    default CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolInvocationContext context) {
        return execute(parameters);
    }

    /**
     * Upper bound for one call; the registry completes the call with a TIMEOUT
     * failure when it is exceeded.
     */
    default Duration getTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
