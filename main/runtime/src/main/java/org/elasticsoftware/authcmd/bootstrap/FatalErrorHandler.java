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

package org.elasticsoftware.authcmd.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.event.EventListener;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Terminates the process when a component reports {@link LivenessState#BROKEN}. The context is
 * closed on a separate thread, the reporting thread is usually one of the threads the shutdown
 * waits for.
 */
public class FatalErrorHandler implements ApplicationContextAware {
    public static final int EXIT_STATUS = 1;
    private static final Logger logger = LoggerFactory.getLogger(FatalErrorHandler.class);
    private final IntConsumer exitFunction;
    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private ApplicationContext applicationContext;

    public FatalErrorHandler() {
        this(System::exit);
    }

    public FatalErrorHandler(IntConsumer exitFunction) {
        this.exitFunction = exitFunction;
    }

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @EventListener
    public void onLivenessChange(AvailabilityChangeEvent<LivenessState> event) {
        if (event.getState() != LivenessState.BROKEN || !triggered.compareAndSet(false, true)) {
            return;
        }
        logger.error("Fatal error reported by {}, shutting down", event.getSource());
        Thread shutdownThread = new Thread(() -> {
            int exitStatus = SpringApplication.exit(applicationContext, () -> EXIT_STATUS);
            exitFunction.accept(exitStatus);
        }, "fatal-error-shutdown");
        shutdownThread.start();
    }
}
