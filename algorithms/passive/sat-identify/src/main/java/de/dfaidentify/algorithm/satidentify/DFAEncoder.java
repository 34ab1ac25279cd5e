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

import java.util.Iterator;
import java.util.NoSuchElementException;

import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.datastructure.apta.APTA;
import de.dfaidentify.datastructure.apta.APTANode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the CNF encodings of the DFA identification problem for an {@link APTA}, one per candidate size.
 * <p>
 * An encoding for {@code k} colors consists of
 * <ol>
 * <li>the coloring constraints (every APTA node has exactly one color),</li>
 * <li>the transition constraints (every color has exactly one successor per symbol, and APTA edges between colored
 * nodes determine the successor),</li>
 * <li>the label constraints (accepting nodes are colored with accepting colors, rejecting nodes with rejecting
 * ones),</li>
 * <li>the clauses of the configured {@link SymmetryBreaking},</li>
 * <li>the clauses of the configured {@link ExtraClauseGenerator}.</li>
 * </ol>
 *
 * @param <I>
 *         input symbol type
 */
public class DFAEncoder<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DFAEncoder.class);

    private final APTA<I> apta;
    private final SymmetryBreaking symmetryBreaking;
    private final ExtraClauseGenerator<I> extraClauses;

    public DFAEncoder(APTA<I> apta) {
        this(apta, SymmetryBreakings.BFS, ExtraClauseGenerator.none());
    }

    public DFAEncoder(APTA<I> apta, SymmetryBreaking symmetryBreaking, ExtraClauseGenerator<I> extraClauses) {
        this.apta = apta;
        this.symmetryBreaking = symmetryBreaking;
        this.extraClauses = extraClauses;
    }

    public APTA<I> getAPTA() {
        return apta;
    }

    /**
     * Lazily generates the encodings for all sizes admitted by the given bounds, in increasing order. If the bounds
     * have no upper limit, the iterator is infinite.
     *
     * @param bounds
     *         the size bounds
     *
     * @return an iterator over the encodings
     */
    public Iterator<DFAEncoding<I>> encodings(Bounds bounds) {
        return new Iterator<DFAEncoding<I>>() {

            private int size = bounds.firstSize();

            @Override
            public boolean hasNext() {
                return bounds.admits(size);
            }

            @Override
            public DFAEncoding<I> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return encode(size++);
            }
        };
    }

    /**
     * Generates the encoding for exactly {@code numColors} states.
     *
     * @param numColors
     *         the number of states
     *
     * @return the encoding
     */
    public DFAEncoding<I> encode(int numColors) {
        final Codec<I> codec = new Codec<>(apta, numColors);
        final CNF cnf = new CNF();

        addColoringClauses(codec, cnf);
        addTransitionClauses(codec, cnf);
        addLabelClauses(codec, cnf);
        symmetryBreaking.addClauses(codec, cnf);
        cnf.addAll(extraClauses.apply(codec));

        LOGGER.debug("Encoded {} colors: {} variables, {} clauses", numColors, codec.maxId(), cnf.size());

        return new DFAEncoding<>(codec, cnf);
    }

    private void addColoringClauses(Codec<I> codec, CNF cnf) {
        final int k = codec.numColors();
        for (APTANode<I> node : apta.getNodes()) {
            final int n = node.getId();
            final int[] atLeastOne = new int[k];
            for (int c = 0; c < k; c++) {
                atLeastOne[c] = codec.nodeColor(n, c);
                for (int d = 0; d < c; d++) {
                    cnf.add(-codec.nodeColor(n, d), -codec.nodeColor(n, c));
                }
            }
            cnf.add(atLeastOne);
        }
    }

    private void addTransitionClauses(Codec<I> codec, CNF cnf) {
        final int k = codec.numColors();
        final int numSymbols = apta.getAlphabet().size();

        for (int c = 0; c < k; c++) {
            for (int a = 0; a < numSymbols; a++) {
                final int[] atLeastOne = new int[k];
                for (int d = 0; d < k; d++) {
                    atLeastOne[d] = codec.transition(c, a, d);
                    for (int e = 0; e < d; e++) {
                        cnf.add(-codec.transition(c, a, e), -codec.transition(c, a, d));
                    }
                }
                cnf.add(atLeastOne);
            }
        }

        for (APTANode<I> node : apta.getNodes()) {
            final APTANode<I> parent = node.getParent();
            if (parent == null) {
                continue;
            }
            final int u = parent.getId();
            final int v = node.getId();
            final int a = node.getSymbolIndex();
            for (int c1 = 0; c1 < k; c1++) {
                for (int c2 = 0; c2 < k; c2++) {
                    cnf.add(-codec.nodeColor(u, c1), -codec.nodeColor(v, c2), codec.transition(c1, a, c2));
                }
            }
        }
    }

    private void addLabelClauses(Codec<I> codec, CNF cnf) {
        final int k = codec.numColors();
        for (APTANode<I> node : apta.getNodes()) {
            if (!node.isLabeled()) {
                continue;
            }
            final int n = node.getId();
            final boolean accepting = node.isAccepting();
            for (int c = 0; c < k; c++) {
                final int z = codec.colorAccepting(c);
                cnf.add(-codec.nodeColor(n, c), accepting ? z : -z);
            }
        }
    }
}
