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

import javax.annotation.Nonnull;

/**
 * Source of reusable {@link EventBatch} instances. Implementations must
 * allow concurrent {@link #get()} and {@link #release(EventBatch)} calls
 * from independently scheduled operators.
 *
 * @param <K> type of the grouping key
 * @param <P> type of the payload
 */
public interface BatchPool<K, P> {

    /**
     * Returns an empty, writable batch owned by the caller.
     */
    @Nonnull
    EventBatch<K, P> get();

    /**
     * Takes back a batch previously obtained from this pool.
     *
     * @throws com.tempostream.StreamException if the batch belongs to another
     *         pool or was already released
     */
    void release(@Nonnull EventBatch<K, P> batch);

    /**
     * Returns the capacity of the batches handed out by this pool.
     */
    int batchSize();

    /**
     * Tells whether the pool serves columnar streams.
     */
    boolean isColumnar();
}
