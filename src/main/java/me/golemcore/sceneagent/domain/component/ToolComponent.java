package me.golemcore.sceneagent.domain.component;

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

import me.golemcore.sceneagent.domain.model.ToolDefinition;
import me.golemcore.sceneagent.domain.model.ToolKind;
import me.golemcore.sceneagent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for a single-purpose tool the refinement loop can
 * invoke.
 *
 * <p>
 * Every tool is one variant of the closed {@link ToolKind} set. It accepts a
 * single JSON-shaped argument map and completes with a {@link ToolResult};
 * expected failures are returned as {@code ToolResult.failure(...)} rather than
 * thrown. Only environment failures such as missing configuration escape as
 * exceptions.
 */
public interface ToolComponent extends Component {

    /**
     * Argument the loop injects so session-scoped tools know which session they
     * act for.
     */
    String SESSION_ID_PARAM = "sessionId";

    String DEFAULT_SESSION_ID = "default";

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * The variant this component implements.
     */
    ToolKind getKind();

    /**
     * Returns the tool definition (name, description, input schema) that is
     * advertised to the planning model.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the given parameters.
     *
     * @param parameters
     *            JSON-shaped argument object
     * @return future completing with the tool result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Whether this invocation may be answered from the tool cache. Tools whose
     * result depends on state outside {@code parameters} return false for
     * those calls.
     */
    default boolean isCacheable(Map<String, Object> parameters) {
        return getKind().isCacheable();
    }

    default String getToolName() {
        return getKind().getToolName();
    }
}
