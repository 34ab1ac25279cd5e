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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import de.learnlib.api.algorithm.PassiveLearningAlgorithm.PassiveDFALearner;
import de.learnlib.api.query.DefaultQuery;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A passive DFA learner that computes a minimal DFA consistent with all samples, using a {@link SATDFAIdentifier}.
 *
 * @param <I>
 *         input symbol type
 */
public class PassiveSATDFALearner<I> implements PassiveDFALearner<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PassiveSATDFALearner.class);

    private final SATDFAIdentifier<I> identifier;

    private final List<Word<I>> accepting = new ArrayList<>();
    private final List<Word<I>> rejecting = new ArrayList<>();

    public PassiveSATDFALearner() {
        this(new SATDFAIdentifier<>());
    }

    public PassiveSATDFALearner(SATIdentificationConfig<I> config) {
        this(new SATDFAIdentifier<>(config));
    }

    public PassiveSATDFALearner(SATDFAIdentifier<I> identifier) {
        this.identifier = identifier;
    }

    @Override
    public void addSamples(Collection<? extends DefaultQuery<I, Boolean>> samples) {
        for (DefaultQuery<I, Boolean> sample : samples) {
            final Boolean output = sample.getOutput();
            if (output == null) {
                throw new IllegalArgumentException("Sample " + sample.getInput() + " has no output");
            }
            if (output) {
                accepting.add(sample.getInput());
            } else {
                rejecting.add(sample.getInput());
            }
        }
    }

    /**
     * Computes a minimal DFA consistent with the samples added so far.
     *
     * @return a minimal consistent DFA
     *
     * @throws IllegalStateException
     *         if no consistent DFA exists within the configured bounds, e.g. because the samples contradict each other
     */
    @Override
    public CompactDFA<I> computeModel() {
        LOGGER.debug("Identifying DFA from {} positive and {} negative samples", accepting.size(), rejecting.size());

        final CompactDFA<I> result = identifier.findDFA(accepting, rejecting);
        if (result == null) {
            throw new IllegalStateException("No DFA consistent with the samples within bounds " +
                                            identifier.getConfig().getBounds());
        }

        LOGGER.debug("Identified DFA with {} states", result.size());
        return result;
    }
}
