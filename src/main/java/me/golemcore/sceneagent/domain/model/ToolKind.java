package me.golemcore.sceneagent.domain.model;

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
import java.util.Optional;

/**
 * Closed set of tools known to the scene agent. Adding a tool means adding a
 * constant here and a {@link me.golemcore.sceneagent.domain.component.ToolComponent}
 * implementing it.
 */
public enum ToolKind {

    GENERATE_FIX_CODE("generate_fix_code", ToolCategory.CODE, true, true),
    APPLY_PATCH("apply_patch", ToolCategory.CODE, false, false),
    GENERATE_3D_MODEL("generate_3d_model", ToolCategory.MODEL, true, false),
    ANALYZE_SCREENSHOT("analyze_screenshot", ToolCategory.UTILITY, true, true),
    RETRIEVE_OBJECTS("retrieve_objects", ToolCategory.UTILITY, false, true),
    WRITE_OBJECTS("write_objects", ToolCategory.UTILITY, false, false);

    private final String toolName;
    private final ToolCategory category;
    private final boolean costly;
    private final boolean cacheable;

    ToolKind(String toolName, ToolCategory category, boolean costly, boolean cacheable) {
        this.toolName = toolName;
        this.category = category;
        this.costly = costly;
        this.cacheable = cacheable;
    }

    public String getToolName() {
        return toolName;
    }

    public ToolCategory getCategory() {
        return category;
    }

    /**
     * Costly tools get the long cache TTL.
     */
    public boolean isCostly() {
        return costly;
    }

    /**
     * Asset generation is never cached: its output is not a pure function of
     * its input. Tools that mutate server-side state (the per-session code base,
     * the object store) are not cached either.
     */
    public boolean isCacheable() {
        return cacheable;
    }

    /**
     * Kinds whose cached results go stale once this kind succeeds.
     */
    public List<ToolKind> getInvalidates() {
        return this == WRITE_OBJECTS ? List.of(RETRIEVE_OBJECTS) : List.of();
    }

    public static Optional<ToolKind> fromToolName(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        for (ToolKind kind : values()) {
            if (kind.toolName.equals(toolName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
