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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal shared by one research run and everything it
 * spawns (model calls, tool futures, claim-validation sub-conversations).
 */
@Slf4j
public final class CancellationToken {

    private final Object lock = new Object();
    private volatile boolean cancelled;
    private final List<Runnable> callbacks = new ArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * A token that is never cancelled by anyone but its holder.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels the token and runs every registered callback once.
     *
     * @return true if this call flipped the token
     */
    public boolean cancel() {
        List<Runnable> pending;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            pending = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : pending) {
            runSafely(callback);
        }
        return true;
    }

    /**
     * Registers a callback. Runs it immediately when the token is already
     * cancelled.
     *
     * @return handle that removes the callback again
     */
    public Runnable onCancel(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runSafely(callback);
        return () -> {
        };
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] Cancellation callback failed: {}", e.getMessage());
        }
    }
}
