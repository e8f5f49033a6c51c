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

package com.tempostream.plan;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Plan node of the temporal union of two streams.
 */
public final class UnionPlanNode extends PlanNode {

    private final PlanNode left;
    private final PlanNode right;

    public UnionPlanNode(PlanNode left, PlanNode right,
                         @Nonnull Class<?> keyType, @Nonnull Class<?> payloadType, String errorMessages) {
        super(keyType, payloadType, errorMessages);
        this.left = left;
        this.right = right;
    }

    @Nonnull
    @Override
    public String operatorName() {
        return "Union";
    }

    /**
     * The plan of the left input; may be {@code null} if unknown.
     */
    public PlanNode left() {
        return left;
    }

    /**
     * The plan of the right input; may be {@code null} if unknown.
     */
    public PlanNode right() {
        return right;
    }

    @Nonnull
    @Override
    public List<PlanNode> children() {
        if (left == null && right == null) {
            return Collections.emptyList();
        }
        if (left == null || right == null) {
            return Collections.singletonList(left != null ? left : right);
        }
        return Arrays.asList(left, right);
    }
}
