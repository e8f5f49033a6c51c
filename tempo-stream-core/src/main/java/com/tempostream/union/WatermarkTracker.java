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

import static com.tempostream.StreamEvent.DATA_OTHER_TIME;

/**
 * Keeps the time of the last punctuation emitted downstream and makes sure
 * every further emitted punctuation is strictly above it.
 */
public class WatermarkTracker {

    private long lastEmitted = Long.MIN_VALUE;

    /**
     * Returns the time of the last emitted punctuation, or {@code
     * Long.MIN_VALUE} if none was emitted yet.
     */
    public long lastEmitted() {
        return lastEmitted;
    }

    void reset(long lastEmitted) {
        this.lastEmitted = lastEmitted;
    }

    /**
     * Called before emitting a single punctuation. Returns {@code false} if
     * the punctuation is redundant and must be dropped; otherwise records it
     * as the last emitted one and returns {@code true}.
     */
    public boolean tryAdvance(long punctuationTime) {
        if (punctuationTime <= lastEmitted) {
            return false;
        }
        lastEmitted = punctuationTime;
        return true;
    }

    /**
     * Called before emitting a whole batch. Rewrites in place every
     * punctuation that is not above the punctuations preceding it (in this
     * batch or earlier) into a deleted data event, and advances the
     * watermark to the highest remaining one. Scans all rows, deleted or not.
     *
     * @return the number of rewritten rows
     */
    public int rewriteRedundant(EventBatch<?, ?> batch) {
        long updated = lastEmitted;
        int rewritten = 0;
        for (int i = 0; i < batch.count(); i++) {
            if (!batch.isPunctuation(i)) {
                continue;
            }
            if (batch.syncTime(i) <= updated) {
                batch.setOtherTime(i, DATA_OTHER_TIME);
                batch.markDeleted(i);
                rewritten++;
            } else {
                updated = batch.syncTime(i);
            }
        }
        lastEmitted = updated;
        return rewritten;
    }

    @Override
    public String toString() {
        return "WatermarkTracker{lastEmitted=" + lastEmitted + '}';
    }
}
