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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An augmented prefix tree acceptor, i.e. a tree whose nodes are the distinct prefixes of a set of labeled example
 * words. A node is {@link NodeLabel#ACCEPTING accepting} ({@link NodeLabel#REJECTING rejecting}) if its prefix is a
 * positive (negative) example, and {@link NodeLabel#UNLABELED unlabeled} otherwise.
 * <p>
 * Nodes are numbered in breadth-first order starting with {@code 0} at the root, siblings being ordered by the
 * alphabet index of their incoming symbol. Instances are immutable once constructed.
 *
 * @param <I>
 *         input symbol type
 */
public final class APTA<I> {

    private final Alphabet<I> alphabet;
    private final Map<I, Integer> symbolIndices;
    private final APTANode<I> root;
    private final List<APTANode<I>> nodes;

    private APTA(Alphabet<I> alphabet) {
        this.alphabet = alphabet;
        this.symbolIndices = new HashMap<>();
        for (int i = 0; i < alphabet.size(); i++) {
            symbolIndices.put(alphabet.getSymbol(i), i);
        }
        this.root = new APTANode<>(null, -1, Word.epsilon());
        this.nodes = new ArrayList<>();
    }

    /**
     * Builds the APTA for the given examples over the alphabet of all symbols occurring in the examples (in order of
     * their first occurrence).
     *
     * @see #fromExamples(Collection, Collection, Collection)
     */
    public static <I> APTA<I> fromExamples(Collection<? extends Word<I>> accepting,
                                           Collection<? extends Word<I>> rejecting) {
        return fromExamples(accepting, rejecting, null);
    }

    /**
     * Builds the APTA for the given examples.
     *
     * @param accepting
     *         the positive examples
     * @param rejecting
     *         the negative examples
     * @param alphabet
     *         the alphabet of the APTA, or {@code null} to infer it from the examples
     *
     * @return the APTA
     *
     * @throws IllegalArgumentException
     *         if a word is both a positive and a negative example, or if an example contains a symbol that is not
     *         contained in an explicitly given alphabet
     */
    public static <I> APTA<I> fromExamples(Collection<? extends Word<I>> accepting,
                                           Collection<? extends Word<I>> rejecting,
                                           @Nullable Collection<? extends I> alphabet) {
        final Set<I> symbols = new LinkedHashSet<>();
        if (alphabet != null) {
            symbols.addAll(alphabet);
        } else {
            accepting.forEach(w -> w.forEach(symbols::add));
            rejecting.forEach(w -> w.forEach(symbols::add));
        }

        final APTA<I> apta = new APTA<>(Alphabets.fromList(new ArrayList<>(symbols)));

        for (Word<I> w : accepting) {
            apta.insert(w, NodeLabel.ACCEPTING);
        }
        for (Word<I> w : rejecting) {
            apta.insert(w, NodeLabel.REJECTING);
        }

        apta.enumerateBreadthFirst();
        return apta;
    }

    private void insert(Word<I> word, NodeLabel label) {
        APTANode<I> node = root;
        for (I sym : word) {
            final Integer idx = symbolIndices.get(sym);
            if (idx == null) {
                throw new IllegalArgumentException("Symbol '" + sym + "' of word " + word +
                                                   " is not contained in the alphabet " + alphabet);
            }
            node = node.getOrCreateChild(idx, sym);
        }

        if (node.isLabeled() && node.getLabel() != label) {
            throw new IllegalArgumentException("Word " + word + " is both accepted and rejected");
        }
        node.setLabel(label);
    }

    private void enumerateBreadthFirst() {
        final Queue<APTANode<I>> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            final APTANode<I> node = queue.poll();
            node.setId(nodes.size());
            nodes.add(node);
            queue.addAll(node.getChildren());
        }
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public APTANode<I> getRoot() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    public APTANode<I> getNode(int id) {
        return nodes.get(id);
    }

    /**
     * Returns all nodes in breadth-first order, i.e. the node at list index {@code i} has id {@code i}.
     *
     * @return all nodes of this APTA
     */
    public List<APTANode<I>> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Returns the node representing the given word, or {@code null} if the word is not a prefix of any example.
     *
     * @param word
     *         the word to look up
     *
     * @return the node of the word
     */
    public @Nullable APTANode<I> getNode(Word<I> word) {
        APTANode<I> node = root;
        for (I sym : word) {
            final Integer idx = symbolIndices.get(sym);
            if (idx == null) {
                return null;
            }
            node = node.getChild(idx);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    public List<APTANode<I>> getAcceptingNodes() {
        return nodes.stream().filter(APTANode::isAccepting).collect(Collectors.toList());
    }

    public List<APTANode<I>> getRejectingNodes() {
        return nodes.stream().filter(APTANode::isRejecting).collect(Collectors.toList());
    }

    /**
     * Returns the alphabet index of the given symbol, or {@code -1} if the symbol is not part of the alphabet.
     *
     * @param symbol
     *         the symbol
     *
     * @return the index of the symbol
     */
    public int getSymbolIndex(I symbol) {
        return symbolIndices.getOrDefault(symbol, -1);
    }

    @Override
    public String toString() {
        return "APTA{nodes=" + nodes.size() + ", alphabet=" + alphabet + '}';
    }
}
