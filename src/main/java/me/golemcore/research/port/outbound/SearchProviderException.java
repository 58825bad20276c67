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

package me.golemcore.research.port.outbound;

import me.golemcore.research.domain.model.ToolFailureKind;

import java.io.IOException;

/**
 * Search provider failure, already classified for the tool result.
 */
public class SearchProviderException extends IOException {

    private static final long serialVersionUID = 1L;

    private final ToolFailureKind kind;

    public SearchProviderException(ToolFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SearchProviderException(ToolFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ToolFailureKind getKind() {
        return kind;
    }
}
