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

package me.golemcore.research.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.model.CancellationToken;
import me.golemcore.research.domain.model.ResearchRequest;
import me.golemcore.research.domain.model.ResearchRun;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Starts research runs in the background, tracks them by run id and cancels
 * them on request. Cancelling flips the run's {@link CancellationToken}, which
 * stops the engine, its in-flight tool calls and every claim validation the
 * run spawned.
 *
 * <p>
 * Finished runs stay queryable for {@code research.runs.retention-minutes};
 * above {@code research.runs.max-finished} the oldest finished runs are
 * evicted first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchRunCoordinator {

    private final ResearchService researchService;
    private final ExecutorService researchExecutor;
    private final Clock clock;
    private final ResearchProperties properties;

    private final Map<String, ResearchRun> runs = new ConcurrentHashMap<>();

    public ResearchRun start(ResearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw new IllegalArgumentException("Research query must not be blank");
        }
        evictFinished();
        String runId = UUID.randomUUID().toString();
        CancellationToken cancellation = CancellationToken.create();
        ResearchRun run = new ResearchRun(runId, request, cancellation, clock.instant());
        runs.put(runId, run);

        CompletableFuture
                .supplyAsync(() -> researchService.research(runId, request, cancellation), researchExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        log.error("[Research] Run {} failed: {}", runId, cause.getMessage());
                        run.fail(cause.getMessage(), clock.instant());
                    } else {
                        run.complete(result, clock.instant());
                    }
                    evictFinished();
                });
        log.info("[Research] Run {} started", runId);
        return run;
    }

    public Optional<ResearchRun> get(String runId) {
        evictFinished();
        return Optional.ofNullable(runs.get(runId));
    }

    public Collection<ResearchRun> list() {
        evictFinished();
        return Collections.unmodifiableCollection(runs.values());
    }

    /**
     * Requests cancellation of a run. The run finishes with whatever report its
     * conversation holds at that point.
     *
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String runId) {
        ResearchRun run = runs.get(runId);
        if (run == null || run.isFinished()) {
            return false;
        }
        boolean flipped = run.getCancellation().cancel();
        if (flipped) {
            log.info("[Research] Run {} cancellation requested", runId);
        }
        return flipped;
    }

    void evictFinished() {
        ResearchProperties.RunsProperties retention = properties.getRuns();
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(retention.getRetentionMinutes()));
        List<ResearchRun> kept = new ArrayList<>();
        for (ResearchRun run : runs.values()) {
            if (!run.isFinished()) {
                continue;
            }
            if (run.getFinishedAt().isBefore(cutoff)) {
                evict(run);
            } else {
                kept.add(run);
            }
        }
        int excess = kept.size() - Math.max(0, retention.getMaxFinished());
        if (excess > 0) {
            kept.sort(Comparator.comparing(ResearchRun::getFinishedAt));
            kept.subList(0, excess).forEach(this::evict);
        }
    }

    private void evict(ResearchRun run) {
        if (runs.remove(run.getId(), run)) {
            log.debug("[Research] Evicted finished run {}", run.getId());
        }
    }
}
