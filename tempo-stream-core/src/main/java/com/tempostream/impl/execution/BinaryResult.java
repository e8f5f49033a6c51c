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
 * Reusable holder of the outcome of {@link BinaryPipe#processBothBatches}
 * for each of the two input batches.
 */
public final class BinaryResult {

    BatchState left = BatchState.PENDING;
    BatchState right = BatchState.PENDING;

    public void set(BatchState left, BatchState right) {
        this.left = left;
        this.right = right;
    }

    public BatchState left() {
        return left;
    }

    public BatchState right() {
        return right;
    }

    @Override
    public String toString() {
        return "BinaryResult{left=" + left + ", right=" + right + '}';
    }
}
