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

import com.hazelcast.test.annotation.ParallelTest;
import com.hazelcast.test.annotation.QuickTest;
import com.tempostream.CollectingObserver;
import com.tempostream.StreamConfig;
import com.tempostream.StreamException;
import com.tempostream.StreamObserver;
import com.tempostream.StreamProperties;
import com.tempostream.batch.ConcurrentBatchPool;
import com.tempostream.batch.EventBatch;
import com.tempostream.impl.execution.BatchState;
import com.tempostream.plan.PlanNode;
import com.tempostream.plan.UnionPlanNode;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.ExpectedException;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.Collections;

import static com.tempostream.StreamEvent.INFINITY_SYNC_TIME;
import static com.tempostream.TestBatches.batch;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Category({QuickTest.class, ParallelTest.class})
public class UnionPipeTest {

    @Rule
    public ExpectedException exception = ExpectedException.none();

    private final StreamProperties<String, String> properties =
            StreamProperties.columnar(String.class, String.class, "union at line 1");

    private ConcurrentBatchPool<String, String> pool;
    private StreamConfig config;
    private CollectingObserver observer;
    private UnionPipe<String, String> pipe;

    @Before
    public void setUp() {
        pool = new ConcurrentBatchPool<>(16, 16, true);
        config = new StreamConfig().setDataBatchSize(16);
        observer = new CollectingObserver();
        pipe = UnionOperators.union(properties, observer, pool, config);
    }

    @Test
    public void when_bothInputsEndWithSamePunctuation_then_secondOneDropped() {
        pipe.onLeftNext(batch(pool, "1:a", "5:punc"));
        pipe.onRightNext(batch(pool, "3:b", "5:punc"));
        pipe.onLeftCompleted();
        pipe.onRightCompleted();

        assertEquals(Arrays.asList("1:a", "3:b", "5:punc"), observer.rows());
        assertEquals(5, pipe.lastEmittedPunctuation());
        assertTrue(observer.completed);
    }

    @Test
    public void when_equalTimes_then_leftFirst() {
        pipe.onLeftNext(batch(pool, "2:x"));
        pipe.onRightNext(batch(pool, "2:y"));
        pipe.onLeftCompleted();
        pipe.onRightCompleted();

        assertEquals(Arrays.asList("2:x", "2:y"), observer.rows());
    }

    @Test
    public void when_equalTimesAndDeterministic_then_leftFirst() {
        config.setDeterministicWithinTimestamp(true);

        pipe.onLeftNext(batch(pool, "2:x"));
        pipe.onRightNext(batch(pool, "2:y"));
        // the right batch must wait for the left input to move past time 2
        assertEquals(Collections.singletonList(Collections.singletonList("2:x")), observer.batches);

        pipe.onLeftCompleted();
        pipe.onRightCompleted();
        assertEquals(Arrays.asList("2:x", "2:y"), observer.rows());
    }

    @Test
    public void when_leftBatchNotAfterNextRightTime_then_forwardedWithoutCopying() {
        EventBatch<String, String> left = batch(pool, "1:a", "5:b", "10:c");

        pipe.onLeftNext(left);
        pipe.onRightNext(batch(pool, "10:d", "12:e"));

        assertEquals(1, observer.received.size());
        assertSame(left, observer.received.get(0));
        assertEquals(Arrays.asList("1:a", "5:b", "10:c"), observer.batches.get(0));
        assertEquals(1, pipe.forwardedBatchCount());
        assertEquals(0, pipe.copiedRowCount());
    }

    @Test
    public void when_deletedDataRows_then_skipped() {
        config.setDeterministicWithinTimestamp(true);

        pipe.onLeftNext(batch(pool, "1:a", "2:b:deleted", "3:c"));
        pipe.onRightNext(batch(pool, "2:d:deleted", "4:e"));
        pipe.onLeftCompleted();
        pipe.onRightCompleted();

        assertEquals(Arrays.asList("1:a", "3:c", "4:e"), observer.rows());
    }

    @Test
    public void when_punctuationHasDeletedBit_then_stillEmitted() {
        pipe.onRightCompleted();
        pipe.onLeftNext(batch(pool, "3:punc:deleted"));

        assertEquals(Collections.singletonList("3:punc"), observer.rows());
        assertEquals(3, pipe.lastEmittedPunctuation());
    }

    @Test
    public void when_redundantPunctuations_then_droppedOnBothPaths() {
        config.setDeterministicWithinTimestamp(true);

        pipe.onLeftNext(batch(pool, "1:a", "5:punc"));
        pipe.onRightNext(batch(pool, "2:b", "3:punc", "4:c"));
        pipe.onRightNext(batch(pool, "5:punc", "6:d"));
        // the right batch is forwarded as a whole once the left input is gone
        pipe.onLeftCompleted();
        pipe.onRightCompleted();

        assertEquals(Arrays.asList(
                Arrays.asList("1:a", "2:b", "3:punc", "4:c", "5:punc"),
                Collections.singletonList("6:d")
        ), observer.batches);
        assertEquals(5, pipe.lastEmittedPunctuation());
    }

    @Test
    public void when_rightBatchEndsAtNextLeftTime_then_forwardedOnlyIfNotDeterministic() {
        pipe.onLeftNext(batch(pool, "5:a"));
        assertEquals(5, pipe.nextLeftTime());

        EventBatch<String, String> right = batch(pool, "1:b", "5:c");
        assertEquals(BatchState.FORWARDED, pipe.processRightBatch(right));

        config.setDeterministicWithinTimestamp(true);
        EventBatch<String, String> right2 = batch(pool, "1:b", "5:c");
        assertEquals(BatchState.PENDING, pipe.processRightBatch(right2));
        assertEquals(1, right2.iter());
        assertEquals(1, pipe.currentlyBufferedOutputCount());
    }

    @Test
    public void when_leftOnly_then_copiesUpToAndIncludingNextRightTime() {
        pipe.onRightNext(batch(pool, "5:x"));
        assertEquals(5, pipe.nextRightTime());

        EventBatch<String, String> left = batch(pool, "1:a", "5:b", "6:c");
        assertEquals(BatchState.PENDING, pipe.processLeftBatch(left));

        assertEquals(2, left.iter());
        assertEquals(6, pipe.nextLeftTime());
        assertEquals(2, pipe.currentlyBufferedOutputCount());
    }

    @Test
    public void when_resumedMidBatch_then_noFastPath() {
        config.setDeterministicWithinTimestamp(true);
        pipe.onLeftNext(batch(pool, "1:a", "3:c", "7:g"));
        pipe.onRightNext(batch(pool, "2:b"));
        pipe.onRightNext(batch(pool, "8:h"));

        // left resumed at "3:c": even though its bound 7 <= 8, it is copied row by row
        assertEquals(0, pipe.forwardedBatchCount());
        assertEquals(4, pipe.copiedRowCount());
    }

    @Test
    public void when_outputReachesBatchSize_then_flushed() {
        config.setDataBatchSize(2).setDeterministicWithinTimestamp(true);

        pipe.onLeftNext(batch(pool, "1:a", "3:c", "5:e"));
        pipe.onRightNext(batch(pool, "2:b", "4:d", "6:f"));
        assertEquals(2, observer.batches.size());
        assertEquals(1, pipe.currentlyBufferedOutputCount());

        pipe.onLeftCompleted();
        pipe.onRightCompleted();
        assertEquals(Arrays.asList(
                Arrays.asList("1:a", "2:b"),
                Arrays.asList("3:c", "4:d"),
                Arrays.asList("5:e", "6:f")
        ), observer.batches);
    }

    @Test
    public void when_flushEmptyOutput_then_noEmissionNoAllocation() {
        @SuppressWarnings("unchecked")
        StreamObserver<String, String> mockObserver = mock(StreamObserver.class);
        UnionPipe<String, String> p = UnionOperators.union(properties, mockObserver, pool, config);
        long created = pool.createdCount();

        p.flushContents();
        p.flushContents();

        verify(mockObserver, never()).onNext(any());
        assertEquals(created, pool.createdCount());
    }

    @Test
    public void when_bothInputsCloseWithInfinityPunctuation_then_emittedOnce() {
        config.setDeterministicWithinTimestamp(true);

        pipe.onLeftNext(batch(pool, "1:a", INFINITY_SYNC_TIME + ":punc"));
        pipe.onRightNext(batch(pool, "2:b", INFINITY_SYNC_TIME + ":punc"));
        pipe.onLeftCompleted();
        assertFalse(pipe.isCompleted());
        pipe.onRightCompleted();

        assertEquals(Arrays.asList("1:a", "2:b", INFINITY_SYNC_TIME + ":punc"), observer.rows());
        assertTrue(pipe.isCompleted());
    }

    @Test
    public void when_leftCompletesWithQueuedBatch_then_laterRightBatchesStillEmitted() {
        pipe.onRightNext(batch(pool, "5:r1"));
        pipe.onLeftNext(batch(pool, "10:l1"));
        // the left batch is still queued, waiting for the right input to pass time 10
        pipe.onLeftCompleted();

        pipe.onRightNext(batch(pool, "20:r2"));
        pipe.onRightNext(batch(pool, "30:r3"));
        pipe.onRightNext(batch(pool, "40:r4"));

        assertEquals(Arrays.asList("5:r1", "10:l1", "20:r2", "30:r3", "40:r4"), observer.rows());
        assertEquals(INFINITY_SYNC_TIME, pipe.nextLeftTime());
        assertFalse(observer.completed);
    }

    @Test
    public void when_rightCompletesWithQueuedBatch_then_laterLeftBatchesStillEmitted() {
        config.setDeterministicWithinTimestamp(true);
        pipe.onLeftNext(batch(pool, "5:l1"));
        pipe.onRightNext(batch(pool, "10:r1"));
        pipe.onRightCompleted();

        pipe.onLeftNext(batch(pool, "20:l2"));
        pipe.onLeftNext(batch(pool, "30:l3"));

        assertEquals(Arrays.asList("5:l1", "10:r1", "20:l2", "30:l3"), observer.rows());
        assertEquals(INFINITY_SYNC_TIME, pipe.nextRightTime());
        assertFalse(observer.completed);
    }

    @Test
    public void when_restoreDoesNotFitPool_then_stateUnchangedAndNothingLeaked() {
        ConcurrentBatchPool<String, String> bigPool = new ConcurrentBatchPool<>(16, 16, true);
        ConcurrentBatchPool<String, String> smallPool = new ConcurrentBatchPool<>(2, 16, true);
        UnionPipe<String, String> p = UnionOperators.union(properties, observer, smallPool, config);
        UnionPipeCheckpoint<String, String> checkpoint =
                new UnionPipeCheckpoint<>(batch(bigPool, "1:a", "2:b", "3:c"), 3, 2, 1);
        long outstanding = smallPool.createdCount() - smallPool.retainedCount();

        try {
            p.restore(checkpoint);
            fail("restore() should have failed");
        } catch (StreamException expected) {
            assertEquals(outstanding, smallPool.createdCount() - smallPool.retainedCount());
        }
        assertEquals(Long.MIN_VALUE, p.nextLeftTime());
        assertEquals(Long.MIN_VALUE, p.lastEmittedPunctuation());
        assertEquals(0, p.currentlyBufferedOutputCount());
    }

    @Test
    public void when_disposed_then_batchesReturnedToPool() {
        pipe.onLeftNext(batch(pool, "1:a"));
        int retained = pool.retainedCount();

        pipe.dispose();

        // the pending left batch and the output batch
        assertEquals(retained + 2, pool.retainedCount());
        exception.expect(StreamException.class);
        pipe.onLeftNext(batch(pool, "2:b"));
    }

    @Test
    public void when_error_then_propagatedAndPendingFreed() {
        pipe.onLeftNext(batch(pool, "1:a"));
        int retained = pool.retainedCount();
        RuntimeException error = new RuntimeException("upstream failed");

        pipe.onError(error);

        assertSame(error, observer.error);
        assertEquals(retained + 1, pool.retainedCount());
    }

    @Test
    public void when_inputFedAfterCompletion_then_exception() {
        pipe.onLeftCompleted();

        exception.expect(StreamException.class);
        exception.expectMessage("left input is already completed");
        pipe.onLeftNext(batch(pool, "1:a"));
    }

    @Test
    public void when_produceQueryPlan_then_unionNodeOverInputs() {
        UnionPlanNode leftPlan = new UnionPlanNode(null, null, String.class, String.class, "left");
        UnionPlanNode rightPlan = new UnionPlanNode(null, null, String.class, String.class, "right");
        @SuppressWarnings("unchecked")
        StreamObserver<String, String> mockObserver = mock(StreamObserver.class);
        UnionPipe<String, String> p = UnionOperators.union(properties, mockObserver, pool, config);

        p.produceQueryPlan(leftPlan, rightPlan);

        ArgumentCaptor<PlanNode> captor = ArgumentCaptor.forClass(PlanNode.class);
        verify(mockObserver).produceQueryPlan(captor.capture());
        UnionPlanNode node = (UnionPlanNode) captor.getValue();
        assertSame(leftPlan, node.left());
        assertSame(rightPlan, node.right());
        assertEquals("union at line 1", node.errorMessages());
        assertEquals("Union<String, String>\n  Union<String, String>\n  Union<String, String>\n", node.explain());
    }

    @Test
    public void goToVisibleRow_skipsDeletedDataOnly() {
        EventBatch<String, String> b = batch(pool, "1:a:deleted", "2:punc:deleted", "3:b");

        assertTrue(UnionPipe.goToVisibleRow(b));
        assertEquals(1, b.iter());

        b.setIter(2);
        assertTrue(UnionPipe.goToVisibleRow(b));
        assertEquals(2, b.iter());

        EventBatch<String, String> allDeleted = batch(pool, "1:a:deleted", "2:b:deleted");
        assertFalse(UnionPipe.goToVisibleRow(allDeleted));
        assertEquals(2, allDeleted.iter());
    }

    @Test
    public void maxBatchSyncTime_coversTrailingPunctuations() {
        assertEquals(9, UnionPipe.maxBatchSyncTime(
                batch(pool, "1:a", "7:punc", "5:b", "9:punc", "8:punc", "6:c:deleted")));
        assertEquals(4, UnionPipe.maxBatchSyncTime(batch(pool, "4:a", "2:punc")));
        assertEquals(Long.MIN_VALUE, UnionPipe.maxBatchSyncTime(batch(pool, "1:a:deleted")));
        assertEquals(Long.MIN_VALUE, UnionPipe.maxBatchSyncTime(batch(pool)));
    }

    @Test
    public void when_createdWithDefaults_then_usesSharedPool() {
        UnionPipe<String, String> p = UnionOperators.union(properties, observer);

        p.onLeftCompleted();
        p.onRightCompleted();

        assertTrue(observer.completed);
        p.dispose();
    }

    @Test
    public void when_poolLayoutDiffers_then_fails() {
        StreamProperties<String, String> rowOriented =
                StreamProperties.rowOriented(String.class, String.class, null);

        exception.expect(IllegalArgumentException.class);
        UnionOperators.union(rowOriented, observer, pool, config);
    }
}
