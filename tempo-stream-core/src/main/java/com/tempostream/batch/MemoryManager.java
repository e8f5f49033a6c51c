/*
 * Copyright (c) 2008-2017, Hazelcast, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tempostream.batch;

import com.hazelcast.logging.ILogger;
import com.hazelcast.logging.Logger;

import javax.annotation.Nonnull;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide registry of batch pools, one per storage layout and batch
 * size.
 */
public final class MemoryManager {

    /**
     * Maximum number of idle batches kept by each pool.
     */
    public static final int MAX_RETAINED_BATCHES = 64;

    private static final ILogger LOGGER = Logger.getLogger(MemoryManager.class);
    private static final ConcurrentMap<PoolKey, BatchPool<?, ?>> POOLS = new ConcurrentHashMap<>();

    private MemoryManager() {
    }

    /**
     * Returns the shared pool for the given layout and batch size.
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static <K, P> BatchPool<K, P> getBatchPool(boolean columnar, int batchSize) {
        return (BatchPool<K, P>) POOLS.computeIfAbsent(new PoolKey(columnar, batchSize), key -> {
            LOGGER.info("Creating " + (columnar ? "columnar" : "row-oriented")
                    + " batch pool, batchSize=" + batchSize);
            return new ConcurrentBatchPool<>(batchSize, MAX_RETAINED_BATCHES, columnar);
        });
    }

    private static final class PoolKey {
        final boolean columnar;
        final int batchSize;

        PoolKey(boolean columnar, int batchSize) {
            this.columnar = columnar;
            this.batchSize = batchSize;
        }

        @Override
        public boolean equals(Object o) {
            PoolKey that;
            return this == o
                    || o instanceof PoolKey
                        && this.columnar == (that = (PoolKey) o).columnar
                        && this.batchSize == that.batchSize;
        }

        @Override
        public int hashCode() {
            return 31 * Boolean.hashCode(columnar) + batchSize;
        }
    }
}
