/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */


package org.elasticsoftware.authcmd.kafka;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed size pool that runs message handlers. Closing it stops accepting work and waits up to the
 * drain timeout for the running handlers, so their outcomes are published before the producers close.
 */
public class WorkerPool implements Executor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);
    private final String name;
    private final ExecutorService executorService;
    private final Duration drainTimeout;

    public WorkerPool(String name, int threads, Duration drainTimeout) {
        this(name, Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("authcmd-" + name + "-")), drainTimeout);
    }

    WorkerPool(String name, ExecutorService executorService, Duration drainTimeout) {
        this.name = name;
        this.executorService = executorService;
        this.drainTimeout = drainTimeout;
    }

    @Override
    public void execute(Runnable command) {
        executorService.execute(command);
    }

    public boolean isShutdown() {
        return executorService.isShutdown();
    }

    @Override
    public void close() {
        logger.info("Draining {} pool", name);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = executorService.shutdownNow();
                logger.warn("{} pool did not drain within {}, interrupted running tasks and dropped {} queued",
                        name, drainTimeout, dropped.size());
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
