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

package com.tempostream.union;

import com.tempostream.StreamConfig;
import com.tempostream.StreamObserver;
import com.tempostream.StreamProperties;
import com.tempostream.batch.BatchPool;
import com.tempostream.batch.MemoryManager;

import javax.annotation.Nonnull;

import static com.hazelcast.util.Preconditions.checkNotNull;
import static com.hazelcast.util.Preconditions.checkTrue;

/**
 * Factory of the operators that merge streams by time.
 */
public final class UnionOperators {

    private UnionOperators() {
    }

    /**
     * Returns an operator that merges two streams of the same shape into one.
     * <p>
     * Each input must deliver its visible rows in non-decreasing order of
     * {@code syncTime}; this is assumed, not checked. The output contains
     * every visible row of both inputs, also in non-decreasing order of
     * {@code syncTime}. Of two rows with the same time, the left one is
     * emitted first, except that when {@link
     * StreamConfig#isDeterministicWithinTimestamp()} is off, a whole right
     * batch whose rows are all at the time of the next left row may be
     * emitted before that left row.
     * <p>
     * Punctuations of both inputs are merged into one strictly increasing
     * sequence: a punctuation not above the last emitted one is dropped, or,
     * when it arrives inside a batch forwarded as a whole, rewritten into a
     * deleted data event.
     * <p>
     * The operator takes its batches from the process-wide pool for the
     * stream's storage layout and reads its settings from {@link
     * StreamConfig#getDefault()}.
     *
     * @param properties shape of both inputs and of the output
     * @param observer   receives the merged batches
     */
    @Nonnull
    public static <K, P> UnionPipe<K, P> union(
            @Nonnull StreamProperties<K, P> properties, @Nonnull StreamObserver<K, P> observer
    ) {
        return union(properties, observer, StreamConfig.getDefault());
    }

    /**
     * Variant of {@link #union(StreamProperties, StreamObserver)} bound to
     * the given configuration instead of the process-wide one.
     */
    @Nonnull
    public static <K, P> UnionPipe<K, P> union(
            @Nonnull StreamProperties<K, P> properties, @Nonnull StreamObserver<K, P> observer,
            @Nonnull StreamConfig config
    ) {
        checkNotNull(properties, "properties");
        checkNotNull(config, "config");
        BatchPool<K, P> pool = MemoryManager.getBatchPool(properties.isColumnar(), config.getDataBatchSize());
        return new UnionPipe<>(properties, observer, pool, config);
    }

    /**
     * Variant of {@link #union(StreamProperties, StreamObserver, StreamConfig)}
     * taking its batches from the given pool.
     */
    @Nonnull
    public static <K, P> UnionPipe<K, P> union(
            @Nonnull StreamProperties<K, P> properties, @Nonnull StreamObserver<K, P> observer,
            @Nonnull BatchPool<K, P> pool, @Nonnull StreamConfig config
    ) {
        checkTrue(pool.isColumnar() == properties.isColumnar(),
                "pool layout doesn't match the stream's layout");
        return new UnionPipe<>(properties, observer, pool, config);
    }
}
