/* Copyright (C) 2022 The DFA-Identify Authors
 * This file is part of DFA-Identify.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.dfaidentify.algorithm.satidentify;

import java.util.Objects;

/**
 * The semantic meaning of a variable of a {@link Codec}.
 */
public final class EncodingVariable {

    public enum Kind {
        /**
         * APTA node {@link #getNode() node} is assigned color {@link #getColor() color}.
         */
        NODE_COLOR,
        /**
         * Color {@link #getColor() color} is accepting.
         */
        COLOR_ACCEPTING,
        /**
         * Color {@link #getColor() color} transitions on symbol {@link #getSymbolIndex() symbolIndex} to color
         * {@link #getTarget() target}.
         */
        TRANSITION
    }

    private final Kind kind;
    private final int node;
    private final int color;
    private final int symbolIndex;
    private final int target;

    private EncodingVariable(Kind kind, int node, int color, int symbolIndex, int target) {
        this.kind = kind;
        this.node = node;
        this.color = color;
        this.symbolIndex = symbolIndex;
        this.target = target;
    }

    static EncodingVariable nodeColor(int node, int color) {
        return new EncodingVariable(Kind.NODE_COLOR, node, color, -1, -1);
    }

    static EncodingVariable colorAccepting(int color) {
        return new EncodingVariable(Kind.COLOR_ACCEPTING, -1, color, -1, -1);
    }

    static EncodingVariable transition(int source, int symbolIndex, int target) {
        return new EncodingVariable(Kind.TRANSITION, -1, source, symbolIndex, target);
    }

    public Kind getKind() {
        return kind;
    }

    public int getNode() {
        return node;
    }

    public int getColor() {
        return color;
    }

    public int getSymbolIndex() {
        return symbolIndex;
    }

    public int getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodingVariable)) {
            return false;
        }
        final EncodingVariable that = (EncodingVariable) o;
        return kind == that.kind && node == that.node && color == that.color && symbolIndex == that.symbolIndex &&
               target == that.target;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, node, color, symbolIndex, target);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NODE_COLOR:
                return "color(node=" + node + ") = " + color;
            case COLOR_ACCEPTING:
                return "accepting(" + color + ")";
            default:
                return "delta(" + color + ", #" + symbolIndex + ") = " + target;
        }
    }
}
