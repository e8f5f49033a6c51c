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

import com.tempostream.StreamException;

import javax.annotation.Nonnull;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.hazelcast.util.Preconditions.checkNotNegative;
import static com.hazelcast.util.Preconditions.checkPositive;

/**
 * {@link BatchPool} implemented in terms of a lock-free queue of released
 * batches. At most {@code maxRetained} released batches are kept; the
 * surplus is left to the garbage collector.
 */
public class ConcurrentBatchPool<K, P> implements BatchPool<K, P> {

    private final Queue<EventBatch<K, P>> released = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retainedCount = new AtomicInteger();
    private final AtomicLong createdCount = new AtomicLong();
    private final int batchSize;
    private final int maxRetained;
    private final boolean columnar;

    public ConcurrentBatchPool(int batchSize, int maxRetained, boolean columnar) {
        checkPositive(batchSize, "batchSize must be positive");
        checkNotNegative(maxRetained, "maxRetained must not be negative");
        this.batchSize = batchSize;
        this.maxRetained = maxRetained;
        this.columnar = columnar;
    }

    @Nonnull
    @Override
    public EventBatch<K, P> get() {
        EventBatch<K, P> batch = released.poll();
        if (batch != null) {
            retainedCount.decrementAndGet();
        } else {
            batch = new EventBatch<>(this, batchSize);
            createdCount.incrementAndGet();
        }
        batch.allocate();
        return batch;
    }

    @Override
    public void release(@Nonnull EventBatch<K, P> batch) {
        if (batch.pool() != this) {
            throw new StreamException("Batch " + batch + " doesn't belong to this pool");
        }
        if (!batch.markReleased()) {
            throw new StreamException("Batch " + batch + " was already released");
        }
        if (retainedCount.incrementAndGet() <= maxRetained) {
            released.offer(batch);
        } else {
            retainedCount.decrementAndGet();
        }
    }

    @Override
    public int batchSize() {
        return batchSize;
    }

    @Override
    public boolean isColumnar() {
        return columnar;
    }

    /**
     * Returns the number of batches this pool ever had to allocate.
     */
    public long createdCount() {
        return createdCount.get();
    }

    /**
     * Returns the number of released batches ready for reuse.
     */
    public int retainedCount() {
        return retainedCount.get();
    }

    @Override
    public String toString() {
        return "ConcurrentBatchPool{batchSize=" + batchSize + ", columnar=" + columnar
                + ", created=" + createdCount + ", retained=" + retainedCount + '}';
    }
}
