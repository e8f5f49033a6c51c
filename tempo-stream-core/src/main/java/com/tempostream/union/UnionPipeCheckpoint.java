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

import com.tempostream.batch.EventBatch;

import javax.annotation.Nonnull;

import static com.hazelcast.util.Preconditions.checkNotNull;

/**
 * Snapshot of the state of a {@link UnionPipe}: the rows buffered for
 * output, where each input stands and the last emitted punctuation.
 * <p>
 * The snapshot owns its copy of the buffered rows; call {@link #release()}
 * when it is no longer needed.
 */
public final class UnionPipeCheckpoint<K, P> {

    private final EventBatch<K, P> output;
    private final long nextLeftTime;
    private final long nextRightTime;
    private final long lastEmittedPunctuation;

    public UnionPipeCheckpoint(@Nonnull EventBatch<K, P> output,
                               long nextLeftTime, long nextRightTime, long lastEmittedPunctuation) {
        this.output = checkNotNull(output, "output");
        this.nextLeftTime = nextLeftTime;
        this.nextRightTime = nextRightTime;
        this.lastEmittedPunctuation = lastEmittedPunctuation;
    }

    @Nonnull
    public EventBatch<K, P> output() {
        return output;
    }

    public long nextLeftTime() {
        return nextLeftTime;
    }

    public long nextRightTime() {
        return nextRightTime;
    }

    public long lastEmittedPunctuation() {
        return lastEmittedPunctuation;
    }

    /**
     * Returns the buffered rows to their pool.
     */
    public void release() {
        output.free();
    }

    @Override
    public String toString() {
        return "UnionPipeCheckpoint{bufferedRows=" + output.count()
                + ", nextLeftTime=" + nextLeftTime
                + ", nextRightTime=" + nextRightTime
                + ", lastEmittedPunctuation=" + lastEmittedPunctuation + '}';
    }
}
