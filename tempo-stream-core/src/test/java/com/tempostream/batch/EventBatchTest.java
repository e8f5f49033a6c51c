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

import com.tempostream.StreamException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static com.tempostream.StreamEvent.DATA_OTHER_TIME;
import static com.tempostream.StreamEvent.PUNCTUATION_OTHER_TIME;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EventBatchTest {

    @Rule
    public ExpectedException exception = ExpectedException.none();

    private final ConcurrentBatchPool<String, String> pool = new ConcurrentBatchPool<>(100, 4, true);

    @Test
    public void when_rowsAdded_then_columnsReadBack() {
        EventBatch<String, String> batch = pool.get();
        batch.add(10, DATA_OTHER_TIME, "k", "v", 42);
        batch.addPunctuation(12);

        assertEquals(2, batch.count());
        assertEquals(10, batch.syncTime(0));
        assertEquals("k", batch.key(0));
        assertEquals("v", batch.payload(0));
        assertEquals(42, batch.hash(0));
        assertFalse(batch.isPunctuation(0));
        assertTrue(batch.isPunctuation(1));
        assertEquals(PUNCTUATION_OTHER_TIME, batch.otherTime(1));
        assertNull(batch.payload(1));
    }

    @Test
    public void when_deletedBitSet_then_onlyThatRowDeleted() {
        EventBatch<String, String> batch = pool.get();
        for (int i = 0; i < 70; i++) {
            batch.add(i, DATA_OTHER_TIME, null, "p" + i, i);
        }
        batch.markDeleted(65);

        assertTrue(batch.isDeleted(65));
        assertTrue(batch.isFilteredOut(65));
        assertFalse(batch.isDeleted(64));
        assertFalse(batch.isDeleted(1));
    }

    @Test
    public void when_deletedPunctuation_then_notFilteredOut() {
        EventBatch<String, String> batch = pool.get();
        batch.markDeleted(batch.addPunctuation(3));

        assertTrue(batch.isDeleted(0));
        assertFalse(batch.isFilteredOut(0));
    }

    @Test
    public void when_copyRow_then_deletedBitCopied() {
        EventBatch<String, String> source = pool.get();
        source.add(1, DATA_OTHER_TIME, null, "a", 1);
        source.markDeleted(0);
        EventBatch<String, String> target = pool.get();

        target.copyRowFrom(source, 0);

        assertEquals("a", target.payload(0));
        assertTrue(target.isDeleted(0));
    }

    @Test
    public void when_reallocated_then_emptyWithClearedBits() {
        EventBatch<String, String> batch = pool.get();
        batch.add(1, DATA_OTHER_TIME, null, "a", 1);
        batch.markDeleted(0);
        batch.setIter(1);
        batch.seal();
        batch.free();

        EventBatch<String, String> reused = pool.get();

        assertEquals(0, reused.count());
        assertEquals(0, reused.iter());
        assertFalse(reused.isSealed());
        reused.add(1, DATA_OTHER_TIME, null, "b", 1);
        assertFalse(reused.isDeleted(0));
    }

    @Test
    public void when_full_then_addFails() {
        EventBatch<String, String> batch = new ConcurrentBatchPool<String, String>(1, 1, true).get();
        batch.add(1, DATA_OTHER_TIME, null, "a", 1);
        assertTrue(batch.isFull());

        exception.expect(StreamException.class);
        batch.addPunctuation(2);
    }

    @Test
    public void when_sealed_then_mutationFails() {
        EventBatch<String, String> batch = pool.get();
        batch.add(1, DATA_OTHER_TIME, null, "a", 1);
        batch.seal();

        exception.expect(StreamException.class);
        batch.markDeleted(0);
    }

    @Test
    public void when_claimed_then_mutable() {
        EventBatch<String, String> batch = pool.get();
        batch.add(1, DATA_OTHER_TIME, null, "a", 1);
        batch.seal();

        batch.claim();
        batch.setOtherTime(0, 5);

        assertEquals(5, batch.otherTime(0));
    }

    @Test
    public void when_claimReleasedBatch_then_fails() {
        EventBatch<String, String> batch = pool.get();
        batch.free();

        exception.expect(StreamException.class);
        batch.claim();
    }
}
