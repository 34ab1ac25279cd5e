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

import de.dfaidentify.api.sat.Model;
import de.dfaidentify.datastructure.apta.APTA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.words.Alphabet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The mapping between the semantic variables of the DFA identification encoding for a fixed number of colors (i.e.
 * states) and the integer ids used in the CNF formula.
 * <p>
 * The variable ids {@code 1..baseVariables()} are laid out as follows:
 * <ul>
 * <li>{@code nodeColor(n, c)}: APTA node {@code n} is colored with {@code c},</li>
 * <li>{@code colorAccepting(c)}: color {@code c} is an accepting state,</li>
 * <li>{@code transition(c, a, d)}: the transition of color {@code c} on the {@code a}-th symbol leads to color
 * {@code d}.</li>
 * </ul>
 * Further (auxiliary) variables can be allocated via {@link #nextId()}. A codec is created and filled by a single
 * encoder and should be considered read-only afterwards.
 *
 * @param <I>
 *         input symbol type
 */
public final class Codec<I> {

    private final APTA<I> apta;
    private final int numColors;
    private final int numSymbols;

    private final int acceptingOffset;
    private final int transitionOffset;
    private final int baseVariables;

    private int maxId;

    Codec(APTA<I> apta, int numColors) {
        if (numColors < 1) {
            throw new IllegalArgumentException("At least one color is required, got " + numColors);
        }
        this.apta = apta;
        this.numColors = numColors;
        this.numSymbols = apta.getAlphabet().size();

        this.acceptingOffset = apta.size() * numColors;
        this.transitionOffset = acceptingOffset + numColors;
        this.baseVariables = transitionOffset + numColors * numSymbols * numColors;
        this.maxId = baseVariables;
    }

    public APTA<I> getAPTA() {
        return apta;
    }

    public Alphabet<I> getAlphabet() {
        return apta.getAlphabet();
    }

    public int numColors() {
        return numColors;
    }

    public int nodeColor(int node, int color) {
        checkColor(color);
        if (node < 0 || node >= apta.size()) {
            throw new IndexOutOfBoundsException("Invalid APTA node " + node);
        }
        return 1 + node * numColors + color;
    }

    public int colorAccepting(int color) {
        checkColor(color);
        return 1 + acceptingOffset + color;
    }

    public int transition(int source, int symbolIndex, int target) {
        checkColor(source);
        checkColor(target);
        if (symbolIndex < 0 || symbolIndex >= numSymbols) {
            throw new IndexOutOfBoundsException("Invalid symbol index " + symbolIndex);
        }
        return 1 + transitionOffset + (source * numSymbols + symbolIndex) * numColors + target;
    }

    /**
     * Returns the transition variable for a symbol. See {@link #transition(int, int, int)} for the index-based variant.
     *
     * @param source
     *         the source color
     * @param symbol
     *         the input symbol, which must be part of the alphabet
     * @param target
     *         the target color
     *
     * @return the variable id
     */
    public int transitionOn(int source, I symbol, int target) {
        return transition(source, apta.getSymbolIndex(symbol), target);
    }

    /**
     * Returns the number of variables with a semantic meaning, i.e. the largest id not allocated by
     * {@link #nextId()}.
     *
     * @return the number of semantic variables
     */
    public int baseVariables() {
        return baseVariables;
    }

    /**
     * Returns the largest id allocated so far.
     *
     * @return the largest allocated id
     */
    public int maxId() {
        return maxId;
    }

    /**
     * Allocates a fresh variable id.
     *
     * @return the new id
     */
    public int nextId() {
        return ++maxId;
    }

    /**
     * Returns the transition variables whose source and target color differ, i.e. the transitions that are not self
     * loops.
     *
     * @return the non-stuttering transition variables
     */
    public int[] nonStutterLiterals() {
        final int[] result = new int[numColors * numSymbols * (numColors - 1)];
        int i = 0;
        for (int c = 0; c < numColors; c++) {
            for (int a = 0; a < numSymbols; a++) {
                for (int d = 0; d < numColors; d++) {
                    if (c != d) {
                        result[i++] = transition(c, a, d);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Counts the transitions of the DFA represented by the given model that are not self loops.
     *
     * @param model
     *         the model
     *
     * @return the number of non-stuttering transitions
     */
    public int nonStutterCount(Model model) {
        int count = 0;
        for (int lit : nonStutterLiterals()) {
            if (model.value(lit)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Maps a variable id back to its semantic meaning.
     *
     * @param variable
     *         the variable id (the sign is ignored)
     *
     * @return the semantic variable, or {@code null} if the id denotes an auxiliary variable
     */
    public @Nullable EncodingVariable decode(int variable) {
        final int v = Math.abs(variable) - 1;
        if (v < 0 || v >= baseVariables) {
            return null;
        }
        if (v < acceptingOffset) {
            return EncodingVariable.nodeColor(v / numColors, v % numColors);
        }
        if (v < transitionOffset) {
            return EncodingVariable.colorAccepting(v - acceptingOffset);
        }
        final int t = v - transitionOffset;
        final int target = t % numColors;
        final int sourceAndSymbol = t / numColors;
        return EncodingVariable.transition(sourceAndSymbol / numSymbols, sourceAndSymbol % numSymbols, target);
    }

    /**
     * Returns the color assigned to the given APTA node by the model.
     *
     * @param node
     *         the APTA node id
     * @param model
     *         the model
     *
     * @return the color of the node
     *
     * @throws IllegalStateException
     *         if the model does not assign a color to the node
     */
    public int colorOf(int node, Model model) {
        for (int c = 0; c < numColors; c++) {
            if (model.isTrue(nodeColor(node, c))) {
                return c;
            }
        }
        throw new IllegalStateException("Model does not assign a color to node " + node);
    }

    /**
     * Decodes a model of this codec's formula into a DFA. State {@code i} of the result corresponds to color
     * {@code i}, the initial state is the color of the APTA root.
     *
     * @param model
     *         a model of the encoding this codec belongs to
     *
     * @return the decoded DFA
     */
    public CompactDFA<I> extractDFA(Model model) {
        final Alphabet<I> alphabet = getAlphabet();
        final CompactDFA<I> dfa = new CompactDFA<>(alphabet, numColors);

        final Integer[] states = new Integer[numColors];
        for (int c = 0; c < numColors; c++) {
            states[c] = dfa.addState(model.isTrue(colorAccepting(c)));
        }
        dfa.setInitialState(states[colorOf(apta.getRoot().getId(), model)]);

        for (int c = 0; c < numColors; c++) {
            for (int a = 0; a < numSymbols; a++) {
                final Integer succ = states[successorOf(c, a, model)];
                dfa.setTransition(states[c], alphabet.getSymbol(a), succ);
            }
        }

        return dfa;
    }

    private int successorOf(int color, int symbolIndex, Model model) {
        for (int d = 0; d < numColors; d++) {
            if (model.isTrue(transition(color, symbolIndex, d))) {
                return d;
            }
        }
        throw new IllegalStateException("Model does not define a transition for color " + color + " and symbol " +
                                        getAlphabet().getSymbol(symbolIndex));
    }

    private void checkColor(int color) {
        if (color < 0 || color >= numColors) {
            throw new IndexOutOfBoundsException("Invalid color " + color);
        }
    }

    @Override
    public String toString() {
        return "Codec{colors=" + numColors + ", nodes=" + apta.size() + ", symbols=" + numSymbols + ", maxId=" +
               maxId + '}';
    }
}
