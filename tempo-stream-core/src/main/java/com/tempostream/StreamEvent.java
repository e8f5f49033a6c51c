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

package com.tempostream;

/**
 * Reserved values of the {@code syncTime} and {@code otherTime} columns.
 * <p>
 * A row whose {@code otherTime} equals {@link #PUNCTUATION_OTHER_TIME} is a
 * <em>punctuation</em>: it asserts that no further data event with a
 * {@code syncTime} at or before its own will arrive on the same input. Any
 * row with a non-negative {@code otherTime} is a data event.
 */
public final class StreamEvent {

    /**
     * Marks a row as a punctuation.
     */
    public static final long PUNCTUATION_OTHER_TIME = Long.MIN_VALUE;

    /**
     * The {@code otherTime} of an ordinary data event that carries no end
     * time. Redundant punctuations are rewritten to this value.
     */
    public static final long DATA_OTHER_TIME = 0L;

    /**
     * The time after all other times. A punctuation at this time closes the
     * stream.
     */
    public static final long INFINITY_SYNC_TIME = Long.MAX_VALUE;

    private StreamEvent() {
    }

    public static boolean isPunctuation(long otherTime) {
        return otherTime == PUNCTUATION_OTHER_TIME;
    }

    public static boolean isData(long otherTime) {
        return otherTime >= 0;
    }
}
