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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import de.dfaidentify.api.exception.InsufficientSpecificationException;
import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle;
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.datastructure.apta.APTA;
import de.dfaidentify.util.iterators.CloseableIterator;
import de.dfaidentify.util.iterators.Iterators;
import de.dfaidentify.util.iterators.RoundRobinIterator;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identifies minimal DFAs that accept a given set of words and reject another one, by reduction to SAT.
 * <p>
 * For increasing sizes {@code k} (within the configured {@link Bounds}), the problem "is there a DFA with {@code k}
 * states consistent with the examples" is encoded by a {@link DFAEncoder} and handed to the configured
 * {@link SatOracle}. The models of the first satisfiable encoding (or of all satisfiable encodings, if unminimized
 * DFAs are allowed) are decoded into DFAs.
 * <p>
 * All results are computed lazily: no oracle query is issued before the returned streams are consumed. The streams
 * may hold an oracle session open and should therefore be closed, e.g. via try-with-resources, if they are not
 * consumed completely.
 *
 * @param <I>
 *         input symbol type
 */
public class SATDFAIdentifier<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SATDFAIdentifier.class);

    private final SATIdentificationConfig<I> config;

    public SATDFAIdentifier() {
        this(SATIdentificationConfig.defaults());
    }

    public SATDFAIdentifier(SATIdentificationConfig<I> config) {
        this.config = Objects.requireNonNull(config);
    }

    public SATIdentificationConfig<I> getConfig() {
        return config;
    }

    /**
     * Returns all DFAs consistent with the given examples, smallest first.
     *
     * @param accepting
     *         the words to accept
     * @param rejecting
     *         the words to reject
     *
     * @return a lazy stream of consistent DFAs, empty if the examples contradict each other or the configured bounds
     * are exhausted
     *
     * @throws InsufficientSpecificationException
     *         if there are no examples and no explicit alphabet
     */
    public Stream<CompactDFA<I>> findDFAs(Collection<? extends Word<I>> accepting,
                                          Collection<? extends Word<I>> rejecting) {
        final CloseableIterator<CompactDFA<I>> dfas =
                Iterators.map(models(accepting, rejecting, config), p -> p.getFirst().extractDFA(p.getSecond()));
        return Iterators.stream(dfas);
    }

    /**
     * Returns the satisfying assignments of the DFA encodings together with their codecs. See
     * {@link #findDFAs(Collection, Collection)}.
     *
     * @param accepting
     *         the words to accept
     * @param rejecting
     *         the words to reject
     *
     * @return a lazy stream of models
     */
    public Stream<Pair<Codec<I>, Model>> findModels(Collection<? extends Word<I>> accepting,
                                                    Collection<? extends Word<I>> rejecting) {
        return Iterators.stream(models(accepting, rejecting, config));
    }

    /**
     * Returns a minimal DFA consistent with the given examples. Unminimized DFAs are never returned, regardless of the
     * configuration.
     *
     * @param accepting
     *         the words to accept
     * @param rejecting
     *         the words to reject
     *
     * @return a minimal consistent DFA, or {@code null} if none exists within the configured bounds
     */
    public @Nullable CompactDFA<I> findDFA(Collection<? extends Word<I>> accepting,
                                           Collection<? extends Word<I>> rejecting) {
        final SATIdentificationConfig<I> minimized = config.minimalOnly();
        try (CloseableIterator<Pair<Codec<I>, Model>> iter = models(accepting, rejecting, minimized)) {
            if (!iter.hasNext()) {
                return null;
            }
            final Pair<Codec<I>, Model> result = iter.next();
            return result.getFirst().extractDFA(result.getSecond());
        }
    }

    private CloseableIterator<Pair<Codec<I>, Model>> models(Collection<? extends Word<I>> accepting,
                                                            Collection<? extends Word<I>> rejecting,
                                                            SATIdentificationConfig<I> cfg) {
        final Set<Word<I>> acc = new LinkedHashSet<>(accepting);
        final Set<Word<I>> rej = new LinkedHashSet<>(rejecting);

        for (Word<I> w : acc) {
            if (rej.contains(w)) {
                LOGGER.info("Word {} is both accepted and rejected, no consistent DFA exists", w);
                return Iterators.empty();
            }
        }

        if (acc.isEmpty() && rej.isEmpty()) {
            final Collection<I> alphabet = cfg.getAlphabet();
            if (alphabet == null || alphabet.isEmpty()) {
                throw new InsufficientSpecificationException("Need examples or an alphabet");
            }
            final Set<Word<I>> epsilon = Collections.singleton(Word.epsilon());
            final Set<Word<I>> none = Collections.emptySet();
            return new RoundRobinIterator<>(new ModelSearch<>(epsilon, none, cfg),
                                            new ModelSearch<>(none, epsilon, cfg));
        }

        return new ModelSearch<>(acc, rej, cfg);
    }

    /**
     * Iterates over the encodings of increasing size and the models of the satisfiable ones. The APTA is built with
     * the first query.
     */
    private static final class ModelSearch<I> implements CloseableIterator<Pair<Codec<I>, Model>> {

        private final Collection<? extends Word<I>> accepting;
        private final Collection<? extends Word<I>> rejecting;
        private final SATIdentificationConfig<I> config;

        private @Nullable Iterator<DFAEncoding<I>> encodings;
        private @Nullable Codec<I> codec;
        private @Nullable CloseableIterator<Model> models;
        private boolean foundSatisfiable;
        private boolean closed;

        ModelSearch(Collection<? extends Word<I>> accepting,
                    Collection<? extends Word<I>> rejecting,
                    SATIdentificationConfig<I> config) {
            this.accepting = accepting;
            this.rejecting = rejecting;
            this.config = config;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            if (encodings == null) {
                final APTA<I> apta = APTA.fromExamples(accepting, rejecting, config.getAlphabet());
                final DFAEncoder<I> encoder =
                        new DFAEncoder<>(apta, config.getSymmetryBreaking(), config.getExtraClauses());
                encodings = encoder.encodings(config.getBounds());
            }

            while (models == null || !models.hasNext()) {
                closeModels();
                if (foundSatisfiable && !config.isAllowUnminimized()) {
                    close();
                    return false;
                }
                if (!encodings.hasNext()) {
                    LOGGER.debug("Size bounds {} exhausted", config.getBounds());
                    close();
                    return false;
                }
                searchNext(encodings.next());
            }
            return true;
        }

        @Override
        public Pair<Codec<I>, Model> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return Pair.of(codec, models.next());
        }

        @Override
        public void close() {
            closed = true;
            closeModels();
        }

        private void searchNext(DFAEncoding<I> encoding) {
            final SatOracle oracle = config.getOracle();
            final Session session = oracle.open(encoding.getClauses());
            boolean keepOpen = false;

            try {
                if (!session.solve()) {
                    LOGGER.debug("No DFA with {} states", encoding.numColors());
                    return;
                }

                LOGGER.debug("Found DFA with {} states", encoding.numColors());
                foundSatisfiable = true;
                codec = encoding.getCodec();

                if (config.isOrderByStutter()) {
                    final Model witness = session.getModel();
                    models = new StutterOptimizer<>(oracle, config.getCardinalityEncoder(), encoding, witness);
                } else {
                    models = Iterators.wrap(session.enumerateModels(), session::close);
                    keepOpen = true;
                }
            } finally {
                if (!keepOpen) {
                    session.close();
                }
            }
        }

        private void closeModels() {
            if (models != null) {
                models.close();
                models = null;
            }
        }
    }
}
