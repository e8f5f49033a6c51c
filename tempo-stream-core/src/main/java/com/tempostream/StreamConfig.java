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

import com.hazelcast.logging.ILogger;
import com.hazelcast.logging.Logger;

import javax.annotation.Nonnull;

import static com.hazelcast.util.Preconditions.checkNotNull;
import static com.hazelcast.util.Preconditions.checkPositive;

/**
 * Configuration shared by the stream operators of a process. Operators read
 * the values on every decision, so changing them on a live instance affects
 * batches handed in afterwards.
 * <p>
 * The process-wide instance returned by {@link #getDefault()} is initialized
 * from the system properties {@value #DETERMINISTIC_PROPERTY} and
 * {@value #BATCH_SIZE_PROPERTY}.
 */
public class StreamConfig {

    /**
     * Default number of rows in an output batch.
     */
    public static final int DEFAULT_DATA_BATCH_SIZE = 80_000;

    public static final String DETERMINISTIC_PROPERTY = "tempo.stream.deterministicWithinTimestamp";
    public static final String BATCH_SIZE_PROPERTY = "tempo.stream.dataBatchSize";

    private static final ILogger LOGGER = Logger.getLogger(StreamConfig.class);

    private static volatile StreamConfig defaultConfig = fromSystemProperties();

    private volatile boolean deterministicWithinTimestamp;
    private volatile int dataBatchSize = DEFAULT_DATA_BATCH_SIZE;

    /**
     * Returns the process-wide configuration.
     */
    @Nonnull
    public static StreamConfig getDefault() {
        return defaultConfig;
    }

    /**
     * Replaces the process-wide configuration. Operators created before this
     * call keep the instance they were bound to.
     */
    public static void setDefault(@Nonnull StreamConfig config) {
        defaultConfig = checkNotNull(config, "config");
    }

    static StreamConfig fromSystemProperties() {
        int dataBatchSize = Integer.getInteger(BATCH_SIZE_PROPERTY, DEFAULT_DATA_BATCH_SIZE);
        if (dataBatchSize <= 0) {
            LOGGER.warning("Ignoring " + BATCH_SIZE_PROPERTY + '=' + dataBatchSize
                    + ", it must be positive. Using " + DEFAULT_DATA_BATCH_SIZE);
            dataBatchSize = DEFAULT_DATA_BATCH_SIZE;
        }
        return new StreamConfig()
                .setDeterministicWithinTimestamp(Boolean.getBoolean(DETERMINISTIC_PROPERTY))
                .setDataBatchSize(dataBatchSize);
    }

    /**
     * Tells whether events of equal {@code syncTime} coming from different
     * inputs must always appear left before right, even when a whole input
     * batch could otherwise be forwarded at a batch boundary.
     */
    public boolean isDeterministicWithinTimestamp() {
        return deterministicWithinTimestamp;
    }

    /**
     * Sets the flag described in {@link #isDeterministicWithinTimestamp()}.
     * Default is {@code false}.
     */
    public StreamConfig setDeterministicWithinTimestamp(boolean deterministicWithinTimestamp) {
        this.deterministicWithinTimestamp = deterministicWithinTimestamp;
        return this;
    }

    /**
     * Returns the capacity of a batch; an operator's output batch is flushed
     * downstream as soon as it holds this many rows.
     */
    public int getDataBatchSize() {
        return dataBatchSize;
    }

    /**
     * Sets the batch capacity. Default is {@value #DEFAULT_DATA_BATCH_SIZE}.
     */
    public StreamConfig setDataBatchSize(int dataBatchSize) {
        checkPositive(dataBatchSize, "dataBatchSize must be positive");
        this.dataBatchSize = dataBatchSize;
        return this;
    }

    @Override
    public String toString() {
        return "StreamConfig{deterministicWithinTimestamp=" + deterministicWithinTimestamp
                + ", dataBatchSize=" + dataBatchSize + '}';
    }
}
