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

package com.tempostream.impl.util;

/**
 * Describes the outcome of one step of a cooperative task: whether it made
 * progress and whether it is done.
 */
public enum ProgressState {

    /**
     * No progress was made, but the task is not done.
     */
    NO_PROGRESS(false, false),

    /**
     * Progress was made and the task is not done.
     */
    MADE_PROGRESS(true, false),

    /**
     * The task made progress and is now done.
     */
    DONE(true, true),

    /**
     * The task was already done before this step.
     */
    WAS_ALREADY_DONE(false, true);

    private final boolean isMadeProgress;
    private final boolean isDone;

    ProgressState(boolean isMadeProgress, boolean isDone) {
        this.isMadeProgress = isMadeProgress;
        this.isDone = isDone;
    }

    public boolean isMadeProgress() {
        return isMadeProgress;
    }

    public boolean isDone() {
        return isDone;
    }

    public static ProgressState valueOf(boolean isMadeProgress, boolean isDone) {
        return isDone
                ? isMadeProgress ? DONE : WAS_ALREADY_DONE
                : isMadeProgress ? MADE_PROGRESS : NO_PROGRESS;
    }
}
