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
 * Item put into an inbound queue after the last batch, to signal that the
 * input is complete.
 */
public final class DoneItem {

    public static final DoneItem DONE_ITEM = new DoneItem();

    private DoneItem() {
    }

    @Override
    public String toString() {
        return "DONE_ITEM";
    }
}
