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

import com.tempostream.batch.EventBatch;
import com.tempostream.plan.PlanNode;

import javax.annotation.Nonnull;

/**
 * Downstream consumer of the batches emitted by an operator.
 * <p>
 * Every batch passed to {@link #onNext(EventBatch) onNext()} is sealed and
 * its ownership moves to the observer, which is responsible for eventually
 * calling {@link EventBatch#free()} on it.
 *
 * @param <K> type of the grouping key
 * @param <P> type of the payload
 */
public interface StreamObserver<K, P> {

    /**
     * Receives the next batch, in non-decreasing {@code syncTime} order with
     * respect to all previously received batches.
     */
    void onNext(@Nonnull EventBatch<K, P> batch);

    /**
     * Called after the last batch.
     */
    default void onCompleted() {
    }

    /**
     * Called when the upstream failed; no more batches follow.
     */
    default void onError(@Nonnull Throwable error) {
    }

    /**
     * Receives the description of the operator feeding this observer.
     * The default implementation does nothing.
     */
    default void produceQueryPlan(@Nonnull PlanNode node) {
    }
}
