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

/**
 * What became of an input batch after an operator was called with it.
 */
public enum BatchState {

    /**
     * The batch still has unconsumed rows; its cursor marks where to resume.
     */
    PENDING(false, true),

    /**
     * All rows were consumed; the caller may return the batch to its pool.
     */
    CONSUMED(true, true),

    /**
     * The batch itself was handed downstream. The caller must neither modify
     * nor free it.
     */
    FORWARDED(true, false);

    private final boolean isDone;
    private final boolean isFree;

    BatchState(boolean isDone, boolean isFree) {
        this.isDone = isDone;
        this.isFree = isFree;
    }

    public boolean isDone() {
        return isDone;
    }

    public boolean isFree() {
        return isFree;
    }

    public static BatchState valueOf(boolean isDone, boolean isFree) {
        return !isDone ? PENDING
                : isFree ? CONSUMED : FORWARDED;
    }
}
