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
package de.dfaidentify.oracle.sat;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

import de.dfaidentify.api.exception.SatOracleException;
import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;
import org.sat4j.tools.ModelIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SatOracle} backed by the Sat4j library. Each session uses a fresh solver instance obtained from the
 * configured supplier.
 * <p>
 * If loading a clause set reveals a trivial contradiction (e.g. an empty clause or two complementary unit clauses),
 * the session reports the formula as unsatisfiable.
 */
public class Sat4jOracle implements SatOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(Sat4jOracle.class);

    private final Supplier<? extends ISolver> solverSupplier;
    private final int timeout;

    /**
     * Constructor using the default Sat4j (MiniSAT-style) solver without timeout.
     */
    public Sat4jOracle() {
        this(SolverFactory::newDefault);
    }

    public Sat4jOracle(Supplier<? extends ISolver> solverSupplier) {
        this(solverSupplier, 0);
    }

    /**
     * Constructor.
     *
     * @param solverSupplier
     *         supplier for fresh solver instances
     * @param timeout
     *         the timeout (in seconds) of a single solver call, non-positive values disable the timeout
     */
    public Sat4jOracle(Supplier<? extends ISolver> solverSupplier, int timeout) {
        this.solverSupplier = solverSupplier;
        this.timeout = timeout;
    }

    @Override
    public Session open(CNF clauses) {
        final ISolver solver = solverSupplier.get();
        if (timeout > 0) {
            solver.setTimeout(timeout);
        }
        final Sat4jSession session = new Sat4jSession(solver);
        session.append(clauses);
        return session;
    }

    static final class Sat4jSession implements Session {

        private final ISolver solver;
        private boolean contradiction;
        private boolean closed;
        private @Nullable Model lastModel;

        Sat4jSession(ISolver solver) {
            this.solver = solver;
        }

        @Override
        public boolean solve() {
            checkOpen();
            lastModel = null;
            if (contradiction) {
                return false;
            }
            try {
                if (solver.isSatisfiable()) {
                    lastModel = toModel(solver.model());
                    return true;
                }
                return false;
            } catch (TimeoutException e) {
                throw new SatOracleException("Sat4j did not finish within the configured timeout", e);
            }
        }

        @Override
        public Model getModel() {
            if (lastModel == null) {
                throw new IllegalStateException("No model available, last call to solve() did not succeed");
            }
            return lastModel;
        }

        @Override
        public Iterator<Model> enumerateModels() {
            checkOpen();
            if (contradiction) {
                return new ModelEnumeration(null);
            }
            return new ModelEnumeration(new ModelIterator(solver));
        }

        @Override
        public void append(CNF clauses) {
            checkOpen();
            if (contradiction) {
                return;
            }
            solver.newVar(Math.max(solver.nVars(), clauses.maxVariable()));
            solver.setExpectedNumberOfClauses(solver.nConstraints() + clauses.size());
            try {
                for (int[] clause : clauses) {
                    solver.addClause(new VecInt(clause.clone()));
                }
            } catch (ContradictionException e) {
                LOGGER.debug("Trivial contradiction while loading clauses: {}", e.getMessage());
                contradiction = true;
            }
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                solver.reset();
            }
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Session has already been closed");
            }
        }

        private Model toModel(int[] literals) {
            return Model.fromLiterals(literals, solver.nVars());
        }

        private final class ModelEnumeration implements Iterator<Model> {

            private final @Nullable ModelIterator iterator;
            private @Nullable Model next;
            private boolean done;

            ModelEnumeration(@Nullable ModelIterator iterator) {
                this.iterator = iterator;
                this.done = iterator == null;
            }

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (done || closed) {
                    return false;
                }
                try {
                    if (iterator.isSatisfiable()) {
                        next = toModel(iterator.model());
                        return true;
                    }
                } catch (TimeoutException e) {
                    throw new SatOracleException("Sat4j did not finish within the configured timeout", e);
                }
                done = true;
                return false;
            }

            @Override
            public Model next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                final Model result = next;
                next = null;
                return result;
            }
        }
    }
}
