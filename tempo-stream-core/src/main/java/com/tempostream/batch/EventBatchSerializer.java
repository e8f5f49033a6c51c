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

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import com.tempostream.StreamException;
import com.tempostream.impl.SerializerIds;

import java.io.IOException;

import static com.hazelcast.util.Preconditions.checkNotNull;

/**
 * Hazelcast serializer of {@link EventBatch}. Writes the valid rows and the
 * cursor; deserialized batches are acquired from the pool supplied at
 * construction.
 */
public final class EventBatchSerializer<K, P> implements StreamSerializer<EventBatch<K, P>> {

    private final BatchPool<K, P> pool;

    public EventBatchSerializer(BatchPool<K, P> pool) {
        this.pool = checkNotNull(pool, "pool");
    }

    @Override
    public void write(ObjectDataOutput out, EventBatch<K, P> batch) throws IOException {
        int count = batch.count();
        out.writeInt(count);
        out.writeInt(batch.iter());
        out.writeBoolean(batch.isSealed());
        for (int i = 0; i < count; i++) {
            out.writeLong(batch.syncTime(i));
            out.writeLong(batch.otherTime(i));
            out.writeObject(batch.key(i));
            out.writeObject(batch.payload(i));
            out.writeInt(batch.hash(i));
            out.writeBoolean(batch.isDeleted(i));
        }
    }

    @Override
    public EventBatch<K, P> read(ObjectDataInput in) throws IOException {
        int count = in.readInt();
        int iter = in.readInt();
        boolean sealed = in.readBoolean();
        EventBatch<K, P> batch = pool.get();
        try {
            if (count > batch.capacity()) {
                throw new StreamException("Serialized batch holds " + count
                        + " rows, more than the pool's batch size " + batch.capacity());
            }
            for (int i = 0; i < count; i++) {
                long syncTime = in.readLong();
                long otherTime = in.readLong();
                K key = in.readObject();
                P payload = in.readObject();
                int hash = in.readInt();
                int index = batch.add(syncTime, otherTime, key, payload, hash);
                if (in.readBoolean()) {
                    batch.markDeleted(index);
                }
            }
            if (iter < 0 || iter > count) {
                throw new StreamException("Serialized batch has cursor " + iter + " outside of its " + count + " rows");
            }
        } catch (IOException | RuntimeException e) {
            batch.free();
            throw e;
        }
        batch.setIter(iter);
        if (sealed) {
            batch.seal();
        }
        return batch;
    }

    @Override
    public int getTypeId() {
        return SerializerIds.EVENT_BATCH;
    }

    @Override
    public void destroy() {
    }
}
