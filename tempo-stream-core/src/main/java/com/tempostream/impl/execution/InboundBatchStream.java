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

package com.tempostream.impl.execution;

import com.tempostream.batch.EventBatch;
import com.tempostream.impl.util.ProgressState;

import javax.annotation.Nonnull;
import java.util.Queue;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static com.hazelcast.util.Preconditions.checkNotNull;
import static com.hazelcast.util.Preconditions.checkPositive;
import static com.tempostream.impl.execution.DoneItem.DONE_ITEM;

/**
 * One input of a {@link BinaryPipeTasklet}: a concurrent queue filled by the
 * upstream with {@link EventBatch}es and closed with the {@link
 * DoneItem#DONE_ITEM}. Each {@link #drainTo(Consumer) drainTo()} call hands
 * at most {@code maxBatchesPerDrain} batches to the consumer.
 */
public class InboundBatchStream<K, P> {

    private final Queue<Object> queue;
    private final int maxBatchesPerDrain;
    private final BatchDoneDetector<K, P> doneDetector = new BatchDoneDetector<>();

    public InboundBatchStream(@Nonnull Queue<Object> queue, int maxBatchesPerDrain) {
        this.queue = checkNotNull(queue, "queue");
        checkPositive(maxBatchesPerDrain, "maxBatchesPerDrain must be positive");
        this.maxBatchesPerDrain = maxBatchesPerDrain;
    }

    /**
     * Passes the queued batches to {@code dest} until the queue is empty,
     * the per-call limit is reached or the {@code DONE_ITEM} is met.
     */
    @Nonnull
    public ProgressState drainTo(@Nonnull Consumer<EventBatch<K, P>> dest) {
        if (doneDetector.done) {
            return ProgressState.WAS_ALREADY_DONE;
        }
        doneDetector.dest = dest;
        try {
            int drainedCount = 0;
            for (Object item; drainedCount < maxBatchesPerDrain && (item = queue.poll()) != null; ) {
                drainedCount++;
                if (!doneDetector.test(item)) {
                    break;
                }
            }
            // progress is reported even if only the DONE_ITEM was drained
            return ProgressState.valueOf(drainedCount > 0, doneDetector.done);
        } finally {
            doneDetector.dest = null;
        }
    }

    public boolean isDone() {
        return doneDetector.done;
    }

    /**
     * Hands batches to the destination and stops at the {@code DONE_ITEM}.
     * It is an error to meet any item after it.
     */
    private static final class BatchDoneDetector<K, P> implements Predicate<Object> {
        Consumer<EventBatch<K, P>> dest;
        boolean done;

        @Override
        @SuppressWarnings("unchecked")
        public boolean test(Object o) {
            assert !done : "Received an item after the DONE_ITEM: " + o;
            if (o == DONE_ITEM) {
                done = true;
                return false;
            }
            dest.accept((EventBatch<K, P>) o);
            return true;
        }
    }
}
