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

package me.golemcore.research.domain.model;

import lombok.Getter;

import java.time.Instant;

/**
 * A research run tracked by the coordinator. Status transitions happen once:
 * RUNNING to COMPLETED, FAILED or CANCELLED.
 */
@Getter
public class ResearchRun {

    public enum Status {
        RUNNING, COMPLETED, FAILED, CANCELLED
    }

    private final String id;
    private final ResearchRequest request;
    private final CancellationToken cancellation;
    private final Instant startedAt;

    private volatile Status status = Status.RUNNING;
    private volatile ResearchResult result;
    private volatile String error;
    private volatile Instant finishedAt;

    public ResearchRun(String id, ResearchRequest request, CancellationToken cancellation, Instant startedAt) {
        this.id = id;
        this.request = request;
        this.cancellation = cancellation;
        this.startedAt = startedAt;
    }

    public synchronized void complete(ResearchResult result, Instant now) {
        if (status != Status.RUNNING) {
            return;
        }
        this.result = result;
        this.finishedAt = now;
        this.status = result.getStopReason() == StopReason.CANCELLED ? Status.CANCELLED : Status.COMPLETED;
    }

    public synchronized void fail(String error, Instant now) {
        if (status != Status.RUNNING) {
            return;
        }
        this.error = error;
        this.finishedAt = now;
        this.status = cancellation.isCancelled() ? Status.CANCELLED : Status.FAILED;
    }

    public boolean isFinished() {
        return status != Status.RUNNING;
    }
}
