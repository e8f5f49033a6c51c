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

import javax.annotation.Nonnull;
import java.io.Serializable;

import static com.hazelcast.util.Preconditions.checkNotNull;

/**
 * Static shape of a stream: its key and payload types, the storage layout
 * of its batches and the error context reported in query plans.
 *
 * @param <K> type of the grouping key
 * @param <P> type of the payload
 */
public final class StreamProperties<K, P> implements Serializable {

    private final Class<K> keyType;
    private final Class<P> payloadType;
    private final boolean columnar;
    private final String errorMessages;

    private StreamProperties(Class<K> keyType, Class<P> payloadType, boolean columnar, String errorMessages) {
        this.keyType = checkNotNull(keyType, "keyType");
        this.payloadType = checkNotNull(payloadType, "payloadType");
        this.columnar = columnar;
        this.errorMessages = errorMessages == null ? "" : errorMessages;
    }

    /**
     * Returns the properties of a stream with columnar batch storage.
     */
    @Nonnull
    public static <K, P> StreamProperties<K, P> columnar(
            @Nonnull Class<K> keyType, @Nonnull Class<P> payloadType, String errorMessages
    ) {
        return new StreamProperties<>(keyType, payloadType, true, errorMessages);
    }

    /**
     * Returns the properties of a stream with row-oriented batch storage.
     */
    @Nonnull
    public static <K, P> StreamProperties<K, P> rowOriented(
            @Nonnull Class<K> keyType, @Nonnull Class<P> payloadType, String errorMessages
    ) {
        return new StreamProperties<>(keyType, payloadType, false, errorMessages);
    }

    @Nonnull
    public Class<K> keyType() {
        return keyType;
    }

    @Nonnull
    public Class<P> payloadType() {
        return payloadType;
    }

    public boolean isColumnar() {
        return columnar;
    }

    /**
     * Text attached to diagnostics to locate the stream in the user's query.
     */
    @Nonnull
    public String errorMessages() {
        return errorMessages;
    }

    @Override
    public String toString() {
        return "StreamProperties{key=" + keyType.getSimpleName()
                + ", payload=" + payloadType.getSimpleName()
                + ", columnar=" + columnar + '}';
    }
}
