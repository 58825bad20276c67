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

package me.golemcore.research.adapter.outbound.storage;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.ResearchMode;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.ReportStoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Local filesystem implementation of ReportStoragePort.
 *
 * <p>
 * Reports land in {@code <base-path>/reports/<mode>-<runId>.md}. Base path
 * configured via {@code research.storage.base-path}, defaults to
 * {@code ${user.home}/.golemcore/research}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalReportStorageAdapter implements ReportStoragePort {

    static final String REPORTS_DIR = "reports";

    private final ResearchProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        if (!properties.getStorage().isEnabled()) {
            log.info("Report storage disabled");
            return;
        }
        try {
            Files.createDirectories(basePath.resolve(REPORTS_DIR));
            log.info("Report storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create report directory", e);
        }
    }

    @Override
    public Path save(ResearchMode mode, String runId, String title, String query, String body) throws IOException {
        Path target = resolvePath(mode.fileStem() + "-" + runId + ".md");
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tempPath, render(title, query, body), StandardCharsets.UTF_8);
        try {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("[Storage] Report saved: {}", target);
        return target;
    }

    static String render(String title, String query, String body) {
        return "# " + title + "\n\n"
                + "**Query:** " + query + "\n\n"
                + (body != null ? body : "") + "\n";
    }

    private Path resolvePath(String fileName) {
        Path reports = basePath.resolve(REPORTS_DIR);
        Path resolved = reports.resolve(fileName).normalize();
        if (!resolved.startsWith(reports)) {
            throw new IllegalArgumentException("Path traversal blocked: " + fileName);
        }
        return resolved;
    }
}
