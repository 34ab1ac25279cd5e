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
package de.dfaidentify.datastructure.apta;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of an {@link APTA}. Each node represents the prefix given by {@link #getAccessSequence()}.
 *
 * @param <I>
 *         input symbol type
 */
public final class APTANode<I> {

    private final @Nullable APTANode<I> parent;
    private final int symbolIndex;
    private final Word<I> accessSequence;
    private final SortedMap<Integer, APTANode<I>> children = new TreeMap<>();

    private NodeLabel label = NodeLabel.UNLABELED;
    private int id = -1;

    APTANode(@Nullable APTANode<I> parent, int symbolIndex, Word<I> accessSequence) {
        this.parent = parent;
        this.symbolIndex = symbolIndex;
        this.accessSequence = accessSequence;
    }

    /**
     * Returns the breadth-first index of this node. The root has id {@code 0}.
     *
     * @return the id of this node
     */
    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public NodeLabel getLabel() {
        return label;
    }

    void setLabel(NodeLabel label) {
        this.label = label;
    }

    public boolean isAccepting() {
        return label == NodeLabel.ACCEPTING;
    }

    public boolean isRejecting() {
        return label == NodeLabel.REJECTING;
    }

    public boolean isLabeled() {
        return label != NodeLabel.UNLABELED;
    }

    public @Nullable APTANode<I> getParent() {
        return parent;
    }

    /**
     * Returns the alphabet index of the symbol labeling the edge from the parent to this node, or {@code -1} for the
     * root.
     *
     * @return the incoming symbol index
     */
    public int getSymbolIndex() {
        return symbolIndex;
    }

    public Word<I> getAccessSequence() {
        return accessSequence;
    }

    public @Nullable APTANode<I> getChild(int symbolIndex) {
        return children.get(symbolIndex);
    }

    /**
     * Returns the children of this node, ordered by the alphabet index of their incoming symbol.
     *
     * @return the children of this node
     */
    public Collection<APTANode<I>> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    APTANode<I> getOrCreateChild(int symbolIndex, I symbol) {
        return children.computeIfAbsent(symbolIndex,
                                        k -> new APTANode<>(this, symbolIndex, accessSequence.append(symbol)));
    }

    @Override
    public String toString() {
        return "APTANode{" + id + ", " + accessSequence + ", " + label + '}';
    }

    // IDENTITY SEMANTICS!
}
