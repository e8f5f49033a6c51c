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
import java.util.List;

/**
 * A node of the query plan tree reported by operators for introspection.
 */
public abstract class PlanNode {

    private final Class<?> keyType;
    private final Class<?> payloadType;
    private final String errorMessages;

    protected PlanNode(@Nonnull Class<?> keyType, @Nonnull Class<?> payloadType, String errorMessages) {
        this.keyType = keyType;
        this.payloadType = payloadType;
        this.errorMessages = errorMessages == null ? "" : errorMessages;
    }

    /**
     * Short name of the operator this node describes.
     */
    @Nonnull
    public abstract String operatorName();

    /**
     * The nodes feeding this one, in input order.
     */
    @Nonnull
    public abstract List<PlanNode> children();

    @Nonnull
    public Class<?> keyType() {
        return keyType;
    }

    @Nonnull
    public Class<?> payloadType() {
        return payloadType;
    }

    @Nonnull
    public String errorMessages() {
        return errorMessages;
    }

    /**
     * Renders this node and its subtree, one node per line, children
     * indented below their parent.
     */
    @Nonnull
    public String explain() {
        StringBuilder sb = new StringBuilder();
        explain(sb, 0);
        return sb.toString();
    }

    private void explain(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(this).append('\n');
        for (PlanNode child : children()) {
            child.explain(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        return operatorName() + "<" + keyType.getSimpleName() + ", " + payloadType.getSimpleName() + ">";
    }
}
