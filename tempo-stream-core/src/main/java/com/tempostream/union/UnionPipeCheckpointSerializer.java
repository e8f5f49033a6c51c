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

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import com.tempostream.batch.BatchPool;
import com.tempostream.batch.EventBatch;
import com.tempostream.batch.EventBatchSerializer;
import com.tempostream.impl.SerializerIds;

import java.io.IOException;

/**
 * Hazelcast serializer of {@link UnionPipeCheckpoint}.
 */
public final class UnionPipeCheckpointSerializer<K, P> implements StreamSerializer<UnionPipeCheckpoint<K, P>> {

    private final EventBatchSerializer<K, P> batchSerializer;

    public UnionPipeCheckpointSerializer(BatchPool<K, P> pool) {
        this.batchSerializer = new EventBatchSerializer<>(pool);
    }

    @Override
    public void write(ObjectDataOutput out, UnionPipeCheckpoint<K, P> checkpoint) throws IOException {
        out.writeLong(checkpoint.nextLeftTime());
        out.writeLong(checkpoint.nextRightTime());
        out.writeLong(checkpoint.lastEmittedPunctuation());
        batchSerializer.write(out, checkpoint.output());
    }

    @Override
    public UnionPipeCheckpoint<K, P> read(ObjectDataInput in) throws IOException {
        long nextLeftTime = in.readLong();
        long nextRightTime = in.readLong();
        long lastEmittedPunctuation = in.readLong();
        EventBatch<K, P> output = batchSerializer.read(in);
        return new UnionPipeCheckpoint<>(output, nextLeftTime, nextRightTime, lastEmittedPunctuation);
    }

    @Override
    public int getTypeId() {
        return SerializerIds.UNION_CHECKPOINT;
    }

    @Override
    public void destroy() {
    }
}
