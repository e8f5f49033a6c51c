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

import com.hazelcast.logging.ILogger;
import com.hazelcast.logging.Logger;
import com.tempostream.StreamException;
import com.tempostream.StreamObserver;
import com.tempostream.batch.EventBatch;
import com.tempostream.plan.PlanNode;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Queue;

import static com.hazelcast.util.Preconditions.checkNotNull;

/**
 * Base class of operators with two inputs. Queues the batches arriving on
 * each input and decides which of the processing methods to call with them:
 * <ul><li>
 *     {@link #processBothBatches processBothBatches()} when both inputs have
 *     a pending batch,
 * </li><li>
 *     {@link #processLeftBatch processLeftBatch()} or {@link
 *     #processRightBatch processRightBatch()} when only one of them does.
 * </li></ul>
 * After each call the batches reported as done are dequeued, and those
 * reported as free are returned to their pool. A batch reported as
 * {@link BatchState#FORWARDED forwarded} now belongs to the downstream
 * observer and is left alone.
 * <p>
 * Instances are not thread-safe; all calls must come from the same thread
 * or be otherwise serialized.
 *
 * @param <K> type of the grouping key
 * @param <P> type of the payload
 */
public abstract class BinaryPipe<K, P> {

    protected final ILogger logger = Logger.getLogger(getClass());

    private final StreamObserver<K, P> observer;
    private final Queue<EventBatch<K, P>> leftQueue = new ArrayDeque<>();
    private final Queue<EventBatch<K, P>> rightQueue = new ArrayDeque<>();
    private final BinaryResult result = new BinaryResult();

    private boolean leftCompleted;
    private boolean rightCompleted;
    private boolean completed;
    private boolean disposed;

    protected BinaryPipe(@Nonnull StreamObserver<K, P> observer) {
        this.observer = checkNotNull(observer, "observer");
    }

    /**
     * Called with a batch of rows in non-decreasing order of visible
     * {@code syncTime}, continuing the order of the previous left batches.
     * The pipe takes ownership of the batch.
     */
    public void onLeftNext(@Nonnull EventBatch<K, P> batch) {
        checkAccepting(leftCompleted, "left");
        batch.claim();
        leftQueue.add(batch);
        processPendingBatches();
    }

    /**
     * Right-side counterpart of {@link #onLeftNext(EventBatch)}.
     */
    public void onRightNext(@Nonnull EventBatch<K, P> batch) {
        checkAccepting(rightCompleted, "right");
        batch.claim();
        rightQueue.add(batch);
        processPendingBatches();
    }

    /**
     * Called when the left input has no more batches.
     */
    public void onLeftCompleted() {
        checkAccepting(leftCompleted, "left");
        leftCompleted = true;
        processPendingBatches();
    }

    /**
     * Called when the right input has no more batches.
     */
    public void onRightCompleted() {
        checkAccepting(rightCompleted, "right");
        rightCompleted = true;
        processPendingBatches();
    }

    /**
     * Called when either input failed. Releases all pending batches and
     * propagates the error downstream.
     */
    public void onError(@Nonnull Throwable error) {
        logger.warning("Input failed, propagating the error downstream", error);
        completed = true;
        freeQueued();
        observer.onError(error);
    }

    /**
     * Reports this operator into the query plan, given the plans of its
     * inputs.
     */
    public void produceQueryPlan(PlanNode left, PlanNode right) {
        produceBinaryQueryPlan(left, right);
    }

    /**
     * Releases every batch held by this pipe. No other method may be called
     * afterwards.
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        freeQueued();
        disposeState();
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Returns the number of rows buffered in the output batch under
     * construction.
     */
    public abstract int currentlyBufferedOutputCount();

    @Nonnull
    protected StreamObserver<K, P> observer() {
        return observer;
    }

    /**
     * Called with the head batch of each input. Must consume at least one of
     * them and report the outcome for both into {@code result}.
     */
    protected abstract void processBothBatches(
            @Nonnull EventBatch<K, P> leftBatch, @Nonnull EventBatch<K, P> rightBatch, @Nonnull BinaryResult result);

    /**
     * Called with the head left batch when the right input has nothing
     * pending.
     */
    @Nonnull
    protected abstract BatchState processLeftBatch(@Nonnull EventBatch<K, P> batch);

    /**
     * Called with the head right batch when the left input has nothing
     * pending.
     */
    @Nonnull
    protected abstract BatchState processRightBatch(@Nonnull EventBatch<K, P> batch);

    /**
     * Consumes the rest of a batch left over after both inputs completed.
     */
    protected abstract void drainRemaining(@Nonnull EventBatch<K, P> batch);

    /**
     * Hands the buffered output downstream.
     */
    protected abstract void flushContents();

    /**
     * Releases the operator's own batches.
     */
    protected abstract void disposeState();

    protected abstract void produceBinaryQueryPlan(PlanNode left, PlanNode right);

    /**
     * Called whenever the left input is completed and none of its batches
     * is queued, that is, whenever no more left rows can arrive. May be
     * called repeatedly.
     */
    protected void leftCompleted() {
    }

    /**
     * Right-side counterpart of {@link #leftCompleted()}.
     */
    protected void rightCompleted() {
    }

    private void processPendingBatches() {
        while (true) {
            EventBatch<K, P> leftBatch = leftQueue.peek();
            EventBatch<K, P> rightBatch = rightQueue.peek();
            // the exhausted side's next time must not hold back the other one
            if (leftCompleted && leftBatch == null) {
                leftCompleted();
            }
            if (rightCompleted && rightBatch == null) {
                rightCompleted();
            }
            if (leftBatch != null && rightBatch != null) {
                processBothBatches(leftBatch, rightBatch, result);
                boolean leftSettled = settle(leftQueue, result.left);
                boolean rightSettled = settle(rightQueue, result.right);
                assert leftSettled || rightSettled : "processBothBatches() consumed neither batch";
            } else if (leftBatch != null) {
                if (!settle(leftQueue, processLeftBatch(leftBatch))) {
                    break;
                }
            } else if (rightBatch != null) {
                if (!settle(rightQueue, processRightBatch(rightBatch))) {
                    break;
                }
            } else {
                break;
            }
        }
        if (leftCompleted && rightCompleted && !completed) {
            complete();
        }
    }

    private void complete() {
        drainQueue(leftQueue);
        drainQueue(rightQueue);
        flushContents();
        completed = true;
        logger.fine("Both inputs completed");
        observer.onCompleted();
    }

    private void drainQueue(Queue<EventBatch<K, P>> queue) {
        for (EventBatch<K, P> batch; (batch = queue.poll()) != null; ) {
            drainRemaining(batch);
            batch.free();
        }
    }

    private static <K, P> boolean settle(Queue<EventBatch<K, P>> queue, BatchState state) {
        if (!state.isDone()) {
            return false;
        }
        EventBatch<K, P> batch = queue.remove();
        if (state.isFree()) {
            batch.free();
        }
        return true;
    }

    private void freeQueued() {
        for (EventBatch<K, P> batch; (batch = leftQueue.poll()) != null; ) {
            batch.free();
        }
        for (EventBatch<K, P> batch; (batch = rightQueue.poll()) != null; ) {
            batch.free();
        }
    }

    private void checkAccepting(boolean sideCompleted, String side) {
        if (disposed) {
            throw new StreamException("Pipe is disposed");
        }
        if (sideCompleted || completed) {
            throw new StreamException("The " + side + " input is already completed");
        }
    }
}
