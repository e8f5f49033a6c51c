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
import com.tempostream.batch.EventBatch;
import com.tempostream.impl.execution.BatchState;
import com.tempostream.impl.execution.BinaryPipe;
import com.tempostream.impl.execution.BinaryResult;
import com.tempostream.plan.PlanNode;
import com.tempostream.plan.UnionPlanNode;

import javax.annotation.Nonnull;

import static com.hazelcast.util.Preconditions.checkNotNull;
import static com.tempostream.StreamEvent.INFINITY_SYNC_TIME;
import static com.tempostream.impl.execution.BatchState.CONSUMED;
import static com.tempostream.impl.execution.BatchState.FORWARDED;
import static com.tempostream.impl.execution.BatchState.PENDING;

/**
 * Temporal union of two streams. See {@link UnionOperators#union(
 * StreamProperties, StreamObserver) UnionOperators.union()} for
 * documentation.
 * <p>
 * Whenever a whole input batch provably precedes everything still pending
 * on the other input, the batch itself is forwarded downstream. Otherwise
 * the rows of the two inputs are interleaved one by one into an output
 * batch, the left row going first when {@code syncTime}s are equal.
 */
public class UnionPipe<K, P> extends BinaryPipe<K, P> {

    private final StreamProperties<K, P> properties;
    private final BatchPool<K, P> pool;
    private final StreamConfig config;
    private final WatermarkTracker watermark = new WatermarkTracker();

    private EventBatch<K, P> output;
    private long nextLeftTime = Long.MIN_VALUE;
    private long nextRightTime = Long.MIN_VALUE;

    // package-visible for tests
    boolean forwardWholeBatches = true;

    private long forwardedBatchCount;
    private long copiedRowCount;

    UnionPipe(@Nonnull StreamProperties<K, P> properties, @Nonnull StreamObserver<K, P> observer,
              @Nonnull BatchPool<K, P> pool, @Nonnull StreamConfig config) {
        super(observer);
        this.properties = checkNotNull(properties, "properties");
        this.pool = checkNotNull(pool, "pool");
        this.config = checkNotNull(config, "config");
        this.output = pool.get();
        if (logger.isFineEnabled()) {
            logger.fine("Created union of " + properties + " with " + config);
        }
    }

    @Override
    protected void processBothBatches(@Nonnull EventBatch<K, P> leftBatch, @Nonnull EventBatch<K, P> rightBatch,
                                      @Nonnull BinaryResult result) {
        boolean leftFirst = leftBatch.iter() == 0;
        if (!goToVisibleRow(leftBatch)) {
            result.set(CONSUMED, PENDING);
            return;
        }
        nextLeftTime = leftBatch.syncTime(leftBatch.iter());

        boolean rightFirst = rightBatch.iter() == 0;
        if (!goToVisibleRow(rightBatch)) {
            result.set(PENDING, CONSUMED);
            return;
        }
        nextRightTime = rightBatch.syncTime(rightBatch.iter());

        if (leftFirst && rightFirst && forwardWholeBatches) {
            BatchState leftState = PENDING;
            BatchState rightState = PENDING;
            // Both bounds are taken before forwarding anything, since
            // forwarding rewrites redundant punctuations in place.
            long leftBound = maxBatchSyncTime(leftBatch);
            long rightBound = maxBatchSyncTime(rightBatch);
            if (leftBound <= nextRightTime) {
                outputBatch(leftBatch);
                leftState = FORWARDED;
            }
            if (rightPrecedesLeft(rightBound, nextLeftTime)) {
                outputBatch(rightBatch);
                rightState = FORWARDED;
            }
            if (leftState != PENDING || rightState != PENDING) {
                result.set(leftState, rightState);
                return;
            }
        }

        while (true) {
            if (nextLeftTime <= nextRightTime) {
                outputCurrentTuple(leftBatch);
                leftBatch.advance();
                if (!goToVisibleRow(leftBatch)) {
                    result.set(CONSUMED, PENDING);
                    return;
                }
                nextLeftTime = leftBatch.syncTime(leftBatch.iter());
            } else {
                outputCurrentTuple(rightBatch);
                rightBatch.advance();
                if (!goToVisibleRow(rightBatch)) {
                    result.set(PENDING, CONSUMED);
                    return;
                }
                nextRightTime = rightBatch.syncTime(rightBatch.iter());
            }
        }
    }

    @Nonnull
    @Override
    protected BatchState processLeftBatch(@Nonnull EventBatch<K, P> batch) {
        if (batch.iter() == 0 && forwardWholeBatches && maxBatchSyncTime(batch) <= nextRightTime) {
            outputBatch(batch);
            return FORWARDED;
        }
        while (true) {
            if (!goToVisibleRow(batch)) {
                return CONSUMED;
            }
            nextLeftTime = batch.syncTime(batch.iter());
            if (nextLeftTime > nextRightTime) {
                return PENDING;
            }
            outputCurrentTuple(batch);
            batch.advance();
        }
    }

    @Nonnull
    @Override
    protected BatchState processRightBatch(@Nonnull EventBatch<K, P> batch) {
        if (batch.iter() == 0 && forwardWholeBatches && rightPrecedesLeft(maxBatchSyncTime(batch), nextLeftTime)) {
            outputBatch(batch);
            return FORWARDED;
        }
        while (true) {
            if (!goToVisibleRow(batch)) {
                return CONSUMED;
            }
            nextRightTime = batch.syncTime(batch.iter());
            // a left row at the same time may still arrive and must go first
            if (nextRightTime >= nextLeftTime) {
                return PENDING;
            }
            outputCurrentTuple(batch);
            batch.advance();
        }
    }

    @Override
    protected void drainRemaining(@Nonnull EventBatch<K, P> batch) {
        while (goToVisibleRow(batch)) {
            outputCurrentTuple(batch);
            batch.advance();
        }
    }

    @Override
    protected void leftCompleted() {
        nextLeftTime = INFINITY_SYNC_TIME;
    }

    @Override
    protected void rightCompleted() {
        nextRightTime = INFINITY_SYNC_TIME;
    }

    @Override
    protected void flushContents() {
        if (output.isEmpty()) {
            return;
        }
        if (logger.isFinestEnabled()) {
            logger.finest("Flushing " + output.count() + " rows");
        }
        output.seal();
        observer().onNext(output);
        output = pool.get();
    }

    @Override
    protected void disposeState() {
        output.free();
        if (logger.isFineEnabled()) {
            logger.fine("Disposed union, forwarded " + forwardedBatchCount + " batches and copied "
                    + copiedRowCount + " rows");
        }
    }

    @Override
    protected void produceBinaryQueryPlan(PlanNode left, PlanNode right) {
        observer().produceQueryPlan(new UnionPlanNode(left, right,
                properties.keyType(), properties.payloadType(), properties.errorMessages()));
    }

    @Override
    public int currentlyBufferedOutputCount() {
        return output.count();
    }

    /**
     * Returns the time of the last punctuation emitted downstream.
     */
    public long lastEmittedPunctuation() {
        return watermark.lastEmitted();
    }

    public long nextLeftTime() {
        return nextLeftTime;
    }

    public long nextRightTime() {
        return nextRightTime;
    }

    /**
     * Returns the number of input batches handed downstream as a whole.
     */
    public long forwardedBatchCount() {
        return forwardedBatchCount;
    }

    /**
     * Returns the number of rows copied one by one into output batches.
     */
    public long copiedRowCount() {
        return copiedRowCount;
    }

    /**
     * Takes a snapshot of this pipe's state. Batches still queued in the
     * pipe are not part of it; they are expected to be replayed by the
     * upstream after {@link #restore restore()}.
     */
    @Nonnull
    public UnionPipeCheckpoint<K, P> checkpoint() {
        EventBatch<K, P> copy = pool.get();
        for (int i = 0; i < output.count(); i++) {
            copy.copyRowFrom(output, i);
        }
        return new UnionPipeCheckpoint<>(copy, nextLeftTime, nextRightTime, watermark.lastEmitted());
    }

    /**
     * Replaces this pipe's state with the one captured in the checkpoint.
     * The checkpoint remains owned by the caller. If the buffered rows don't
     * fit into a batch of this pipe's pool, the state is left unchanged.
     */
    public void restore(@Nonnull UnionPipeCheckpoint<K, P> checkpoint) {
        EventBatch<K, P> restored = pool.get();
        EventBatch<K, P> saved = checkpoint.output();
        try {
            for (int i = 0; i < saved.count(); i++) {
                restored.copyRowFrom(saved, i);
            }
        } catch (RuntimeException e) {
            restored.free();
            throw e;
        }
        output.free();
        output = restored;
        nextLeftTime = checkpoint.nextLeftTime();
        nextRightTime = checkpoint.nextRightTime();
        watermark.reset(checkpoint.lastEmittedPunctuation());
    }

    private boolean rightPrecedesLeft(long rightTime, long leftTime) {
        return config.isDeterministicWithinTimestamp() ? rightTime < leftTime : rightTime <= leftTime;
    }

    private void outputCurrentTuple(EventBatch<K, P> batch) {
        int index = batch.iter();
        if (batch.isPunctuation(index) && !watermark.tryAdvance(batch.syncTime(index))) {
            return;
        }
        output.copyRowFrom(batch, index);
        copiedRowCount++;
        if (output.count() >= config.getDataBatchSize() || output.isFull()) {
            flushContents();
        }
    }

    private void outputBatch(EventBatch<K, P> batch) {
        int rewritten = watermark.rewriteRedundant(batch);
        flushContents();
        batch.seal();
        forwardedBatchCount++;
        if (logger.isFinestEnabled()) {
            logger.finest("Forwarding " + batch + " as a whole, rewrote " + rewritten + " punctuations");
        }
        observer().onNext(batch);
    }

    /**
     * Moves the batch's cursor past deleted data events. Punctuations are
     * never skipped.
     *
     * @return {@code true} if the cursor now points at a visible row
     */
    static boolean goToVisibleRow(EventBatch<?, ?> batch) {
        int count = batch.count();
        int i = batch.iter();
        while (i < count && batch.isFilteredOut(i)) {
            i++;
        }
        batch.setIter(i);
        return i != count;
    }

    /**
     * Returns the highest {@code syncTime} that the batch can contain. A
     * punctuation may follow a data event of a higher time, so the scan
     * covers the last visible row and all punctuations directly before it.
     * Returns {@code Long.MIN_VALUE} if the batch has no visible row.
     */
    static long maxBatchSyncTime(EventBatch<?, ?> batch) {
        long max = Long.MIN_VALUE;
        for (int i = batch.count() - 1; i >= 0; i--) {
            if (batch.isFilteredOut(i)) {
                continue;
            }
            max = Math.max(max, batch.syncTime(i));
            if (!batch.isPunctuation(i)) {
                break;
            }
        }
        return max;
    }
}
