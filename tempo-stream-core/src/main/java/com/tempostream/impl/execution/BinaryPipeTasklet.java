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

import com.tempostream.batch.EventBatch;
import com.tempostream.impl.util.ProgressState;
import com.tempostream.impl.util.ProgressTracker;

import javax.annotation.Nonnull;
import java.util.function.Consumer;

import static com.hazelcast.util.Preconditions.checkNotNull;

/**
 * Drives a {@link BinaryPipe} from two {@link InboundBatchStream}s. Each
 * {@link #call()} drains what is available on both inputs into the pipe and
 * completes the pipe's inputs when their streams deliver the {@code
 * DONE_ITEM}.
 */
public class BinaryPipeTasklet<K, P> implements Tasklet {

    private final ProgressTracker progTracker = new ProgressTracker();
    private final String name;
    private final BinaryPipe<K, P> pipe;
    private final InboundBatchStream<K, P> leftStream;
    private final InboundBatchStream<K, P> rightStream;
    private final Consumer<EventBatch<K, P>> leftHandler;
    private final Consumer<EventBatch<K, P>> rightHandler;

    public BinaryPipeTasklet(String name, @Nonnull BinaryPipe<K, P> pipe,
                             @Nonnull InboundBatchStream<K, P> leftStream,
                             @Nonnull InboundBatchStream<K, P> rightStream) {
        this.name = name;
        this.pipe = checkNotNull(pipe, "pipe");
        this.leftStream = checkNotNull(leftStream, "leftStream");
        this.rightStream = checkNotNull(rightStream, "rightStream");
        this.leftHandler = pipe::onLeftNext;
        this.rightHandler = pipe::onRightNext;
    }

    @Override @Nonnull
    public ProgressState call() {
        if (pipe.isCompleted()) {
            return ProgressState.WAS_ALREADY_DONE;
        }
        progTracker.reset();
        drain(leftStream, leftHandler, true);
        drain(rightStream, rightHandler, false);
        if (!pipe.isCompleted()) {
            progTracker.notDone();
        }
        return progTracker.toProgressState();
    }

    private void drain(InboundBatchStream<K, P> stream, Consumer<EventBatch<K, P>> handler, boolean isLeft) {
        if (stream.isDone()) {
            return;
        }
        ProgressState state = stream.drainTo(handler);
        progTracker.madeProgress(state.isMadeProgress());
        if (state.isDone()) {
            if (isLeft) {
                pipe.onLeftCompleted();
            } else {
                pipe.onRightCompleted();
            }
        }
    }

    @Override
    public String toString() {
        return "BinaryPipeTasklet{name=" + name + ", pipe=" + pipe.getClass().getSimpleName() + '}';
    }
}
