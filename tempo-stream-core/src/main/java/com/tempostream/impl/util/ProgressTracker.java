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
 * Mutable counterpart of {@link ProgressState}, used to accumulate the
 * outcome of several sub-steps. After {@link #reset()} the tracker reports
 * "done, no progress"; each sub-step can then only lower "done" and raise
 * "made progress".
 */
public class ProgressTracker {

    private boolean isMadeProgress;
    private boolean isDone;

    public ProgressTracker() {
        reset();
    }

    public void reset() {
        isMadeProgress = false;
        isDone = true;
    }

    public void notDone() {
        isDone = false;
    }

    public void madeProgress() {
        isMadeProgress = true;
    }

    public void madeProgress(boolean isMadeProgress) {
        this.isMadeProgress |= isMadeProgress;
    }

    public void mergeWith(ProgressState state) {
        isMadeProgress |= state.isMadeProgress();
        isDone &= state.isDone();
    }

    public boolean isMadeProgress() {
        return isMadeProgress;
    }

    public boolean isDone() {
        return isDone;
    }

    public ProgressState toProgressState() {
        return ProgressState.valueOf(isMadeProgress, isDone);
    }
}
