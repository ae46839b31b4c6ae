package io.facsforge.gating.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.facsforge.gating.events.EventMatrix;
import io.facsforge.gating.model.GateHierarchy;
import io.facsforge.transforms.ChannelTransforms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gates several samples against one hierarchy in parallel, one task per sample.
 *
 * <p>Each sample is independent; results come back in input order and equal what
 * serial evaluation would produce.
 */
public final class BatchGatingRunner {

    private static final Logger logger = LogManager.getLogger(BatchGatingRunner.class);

    private final GatingEngine engine;
    private final int threads;

    /**
     * @param engine  the engine to run
     * @param threads worker count, at least 1
     */
    public BatchGatingRunner(GatingEngine engine, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, was " + threads);
        }
        this.engine = engine;
        this.threads = threads;
    }

    /**
     * @param hierarchy  gates to evaluate
     * @param transforms channel transforms
     * @param samples    sample id to events, in the order results should come back
     * @return sample id to result, in input order
     * @throws ChannelNotFoundException or another unchecked exception from the first failed sample
     */
    public Map<String, GatingResult> run(GateHierarchy hierarchy, ChannelTransforms transforms,
                                         Map<String, EventMatrix> samples) {
        int poolSize = Math.max(1, Math.min(threads, samples.size()));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "gating-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        try {
            List<String> ids = new ArrayList<>(samples.keySet());
            List<Future<GatingResult>> futures = new ArrayList<>();
            for (String id : ids) {
                EventMatrix events = samples.get(id);
                futures.add(executor.submit(() -> {
                    logger.debug("Gating sample {} ({} events)", id, events.rowCount());
                    return engine.evaluate(hierarchy, transforms, events);
                }));
            }
            Map<String, GatingResult> results = new LinkedHashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                results.put(ids.get(i), await(ids.get(i), futures.get(i)));
            }
            logger.info("Gated {} sample(s) on {} thread(s)", results.size(), poolSize);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static GatingResult await(String sampleId, Future<GatingResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while gating sample " + sampleId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Gating sample " + sampleId + " failed", cause);
        }
    }
}
