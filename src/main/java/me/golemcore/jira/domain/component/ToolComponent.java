package me.golemcore.jira.domain.component;

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

import me.golemcore.jira.domain.model.ToolDefinition;
import me.golemcore.jira.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing one tracker operation callable by an agent. Tools
 * expose a JSON Schema definition and implement the execution.
 */
public interface ToolComponent extends Component {

    /**
     * Returns the tool name, description and input JSON Schema.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Tracker failures complete the future normally with a
     * failed {@link ToolResult}.
     *
     * @param parameters
     *            call arguments as decoded from JSON
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
