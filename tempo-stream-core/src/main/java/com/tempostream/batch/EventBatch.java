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

import com.tempostream.StreamEvent;
import com.tempostream.StreamException;

import java.util.Arrays;

import static com.tempostream.StreamEvent.PUNCTUATION_OTHER_TIME;

/**
 * Fixed-capacity batch of events stored column by column. Row {@code i} is
 * made of {@code syncTime(i)}, {@code otherTime(i)}, {@code key(i)},
 * {@code payload(i)}, {@code hash(i)} and the deleted bit {@code
 * isDeleted(i)}.
 * <p>
 * A batch also carries a consumption cursor, {@link #iter()}, used by
 * operators that consume it over several calls.
 * <p>
 * <strong>Ownership.</strong> A batch has one owner at a time. Handing it
 * downstream {@linkplain #seal() seals} it; a sealed batch rejects every
 * mutation of its rows until the next owner {@linkplain #claim() claims} it.
 * Only the current owner may {@linkplain #free() free} it.
 *
 * @param <K> type of the grouping key
 * @param <P> type of the payload
 */
public final class EventBatch<K, P> {

    private final BatchPool<K, P> pool;
    private final int capacity;

    private final long[] syncTimes;
    private final long[] otherTimes;
    private final Object[] keys;
    private final Object[] payloads;
    private final int[] hashes;
    private final long[] bitvector;

    private int count;
    private int iter;
    private boolean sealed;
    private boolean released;

    EventBatch(BatchPool<K, P> pool, int capacity) {
        this.pool = pool;
        this.capacity = capacity;
        this.syncTimes = new long[capacity];
        this.otherTimes = new long[capacity];
        this.keys = new Object[capacity];
        this.payloads = new Object[capacity];
        this.hashes = new int[capacity];
        this.bitvector = new long[(capacity + 63) >> 6];
    }

    /**
     * Resets the batch to an empty, writable state. Called on every batch
     * acquired from a pool.
     */
    public void allocate() {
        count = 0;
        iter = 0;
        sealed = false;
        released = false;
        Arrays.fill(bitvector, 0L);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns the number of valid rows.
     */
    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean isFull() {
        return count == capacity;
    }

    /**
     * Returns the index of the next row to consume.
     */
    public int iter() {
        return iter;
    }

    public void setIter(int iter) {
        assert iter >= 0 && iter <= count : "iter out of range: " + iter;
        this.iter = iter;
    }

    /**
     * Moves the cursor to the next row.
     */
    public void advance() {
        iter++;
    }

    public long syncTime(int index) {
        return syncTimes[index];
    }

    public long otherTime(int index) {
        return otherTimes[index];
    }

    @SuppressWarnings("unchecked")
    public K key(int index) {
        return (K) keys[index];
    }

    @SuppressWarnings("unchecked")
    public P payload(int index) {
        return (P) payloads[index];
    }

    public int hash(int index) {
        return hashes[index];
    }

    public boolean isDeleted(int index) {
        return (bitvector[index >> 6] & (1L << (index & 0x3f))) != 0;
    }

    public boolean isPunctuation(int index) {
        return StreamEvent.isPunctuation(otherTimes[index]);
    }

    /**
     * Tells whether the row is a deleted data event. Punctuations are never
     * filtered, whatever the value of their deleted bit.
     */
    public boolean isFilteredOut(int index) {
        return isDeleted(index) && StreamEvent.isData(otherTimes[index]);
    }

    /**
     * Appends a row and returns its index.
     */
    public int add(long syncTime, long otherTime, K key, P payload, int hash) {
        checkWritable();
        if (count == capacity) {
            throw new StreamException("Batch is full, capacity=" + capacity);
        }
        int index = count++;
        syncTimes[index] = syncTime;
        otherTimes[index] = otherTime;
        keys[index] = key;
        payloads[index] = payload;
        hashes[index] = hash;
        return index;
    }

    /**
     * Appends a punctuation at the given time and returns its index.
     */
    public int addPunctuation(long syncTime) {
        return add(syncTime, PUNCTUATION_OTHER_TIME, null, null, 0);
    }

    /**
     * Appends a copy of a row of another batch, including its deleted bit,
     * and returns its index.
     */
    public int copyRowFrom(EventBatch<K, P> source, int sourceIndex) {
        int index = add(source.syncTimes[sourceIndex], source.otherTimes[sourceIndex],
                source.key(sourceIndex), source.payload(sourceIndex), source.hashes[sourceIndex]);
        if (source.isDeleted(sourceIndex)) {
            bitvector[index >> 6] |= 1L << (index & 0x3f);
        }
        return index;
    }

    public void markDeleted(int index) {
        checkWritable();
        bitvector[index >> 6] |= 1L << (index & 0x3f);
    }

    public void setOtherTime(int index, long otherTime) {
        checkWritable();
        otherTimes[index] = otherTime;
    }

    /**
     * Makes the rows immutable. Called when the batch is handed downstream.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Takes exclusive ownership of a batch received from upstream, making its
     * rows mutable again.
     */
    public void claim() {
        if (released) {
            throw new StreamException("Attempt to claim a batch that was returned to its pool");
        }
        sealed = false;
    }

    /**
     * Returns this batch to the pool it came from. The caller must not use
     * the batch afterwards.
     */
    public void free() {
        pool.release(this);
    }

    BatchPool<K, P> pool() {
        return pool;
    }

    boolean markReleased() {
        if (released) {
            return false;
        }
        released = true;
        Arrays.fill(keys, 0, count, null);
        Arrays.fill(payloads, 0, count, null);
        return true;
    }

    private void checkWritable() {
        if (sealed) {
            throw new StreamException("Attempt to modify a sealed batch");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EventBatch{count=").append(count).append(", iter=").append(iter);
        if (sealed) {
            sb.append(", sealed");
        }
        return sb.append('}').toString();
    }
}
