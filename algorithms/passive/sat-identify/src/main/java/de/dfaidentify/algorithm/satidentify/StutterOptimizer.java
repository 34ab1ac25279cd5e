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
import de.dfaidentify.api.sat.CardinalityEncoder;
import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle;
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.util.iterators.CloseableIterator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the models of a DFA encoding in non-decreasing order of their number of non-stuttering transitions (see
 * {@link Codec#nonStutterLiterals()}), starting with the models that have the fewest.
 * <p>
 * The minimum is determined by a binary search over "at most {@code bound}" queries, in which every witness tightens
 * the upper bound to its own count. Afterwards, all models with exactly {@code bound} non-stuttering transitions are
 * enumerated for increasing bounds. The search starts lazily, with the first call to {@link #hasNext()}. Every query
 * uses its own oracle session, at most one of which is open at any time.
 *
 * @param <I>
 *         input symbol type
 */
public class StutterOptimizer<I> implements CloseableIterator<Model> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StutterOptimizer.class);

    private final SatOracle oracle;
    private final CardinalityEncoder cardinalityEncoder;
    private final Codec<I> codec;
    private final CNF clauses;
    private final int[] nonStutterLiterals;
    private final int topId;

    private int candidateBound;
    private int bound;
    private boolean initialized;
    private boolean exhausted;

    private @Nullable Session session;
    private @Nullable Iterator<Model> models;

    public StutterOptimizer(SatOracle oracle,
                            CardinalityEncoder cardinalityEncoder,
                            DFAEncoding<I> encoding,
                            Model witness) {
        this.oracle = oracle;
        this.cardinalityEncoder = cardinalityEncoder;
        this.codec = encoding.getCodec();
        this.clauses = encoding.getClauses();
        this.nonStutterLiterals = codec.nonStutterLiterals();
        this.topId = Math.max(codec.maxId(), clauses.maxVariable());
        this.candidateBound = codec.nonStutterCount(witness);
    }

    @Override
    public boolean hasNext() {
        if (exhausted) {
            return false;
        }
        if (!initialized) {
            initialized = true;
            bound = findMinimum();
        }
        while (models == null || !models.hasNext()) {
            closeSession();
            if (!openNextBound()) {
                exhausted = true;
                return false;
            }
        }
        return true;
    }

    @Override
    public Model next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return models.next();
    }

    @Override
    public void close() {
        exhausted = true;
        closeSession();
    }

    private int findMinimum() {
        int lo = codec.numColors() - 1;
        int hi = candidateBound;

        while (lo < hi) {
            final int mid = (lo + hi) / 2;
            final Model witness = findAtMost(mid);
            if (witness == null) {
                lo = mid + 1;
            } else {
                hi = codec.nonStutterCount(witness);
                assert hi <= mid;
            }
        }

        LOGGER.debug("Minimal number of non-stuttering transitions for {} colors: {}", codec.numColors(), lo);
        return lo;
    }

    private boolean openNextBound() {
        if (bound > nonStutterLiterals.length) {
            return false;
        }

        if (bound > candidateBound) {
            final Model witness = findAtMost(bound);
            if (witness == null) {
                LOGGER.debug("No model with at most {} non-stuttering transitions, stopping", bound);
                return false;
            }
            candidateBound = codec.nonStutterCount(witness);
        }

        final Session newSession = open(cardinalityEncoder.exactly(nonStutterLiterals, bound, topId));
        session = newSession;
        models = newSession.solve() ? newSession.enumerateModels() : null;
        bound++;
        return true;
    }

    private @Nullable Model findAtMost(int atMost) {
        try (Session s = open(cardinalityEncoder.atMost(nonStutterLiterals, atMost, topId))) {
            return s.solve() ? s.getModel() : null;
        }
    }

    private Session open(CNF cardinalityConstraint) {
        final Session s = oracle.open(clauses);
        try {
            s.append(cardinalityConstraint);
        } catch (RuntimeException e) {
            s.close();
            throw e;
        }
        return s;
    }

    private void closeSession() {
        models = null;
        if (session != null) {
            session.close();
            session = null;
        }
    }
}
