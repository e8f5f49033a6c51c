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

import com.tempostream.impl.util.ProgressState;

import javax.annotation.Nonnull;
import java.util.concurrent.Callable;

/**
 * A unit of work scheduled on an execution thread. Each {@link #call()}
 * performs a bounded amount of work and reports its {@link ProgressState}.
 */
public interface Tasklet extends Callable<ProgressState> {

    @Override @Nonnull
    ProgressState call();

    /**
     * Tells whether each {@code call()} returns quickly enough for the
     * tasklet to share a thread with other tasklets.
     */
    default boolean isCooperative() {
        return true;
    }
}
