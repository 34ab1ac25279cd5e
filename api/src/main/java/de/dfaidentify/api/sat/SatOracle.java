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
package de.dfaidentify.api.sat;

import java.util.Iterator;

import de.dfaidentify.api.exception.SatOracleException;

/**
 * A satisfiability oracle. The oracle itself is stateless; every query is answered by a {@link Session} which is
 * opened for a specific clause set and must be closed once it is no longer needed.
 * <p>
 * Implementations signal internal failures (timeouts, native faults) by throwing a {@link SatOracleException}.
 */
@FunctionalInterface
public interface SatOracle {

    /**
     * Opens a new session whose formula initially consists of the given clauses.
     *
     * @param clauses
     *         the initial clauses
     *
     * @return the session, to be used in a try-with-resources block
     */
    Session open(CNF clauses);

    /**
     * A scoped solver instance. Sessions are not thread-safe and are not meant to be re-used after
     * {@link #close() closing}.
     */
    interface Session extends AutoCloseable {

        /**
         * Checks the current formula for satisfiability.
         *
         * @return {@code true} iff the formula is satisfiable
         */
        boolean solve();

        /**
         * Returns the model found by the last successful call to {@link #solve()}.
         *
         * @return the last model
         *
         * @throws IllegalStateException
         *         if the last call to {@link #solve()} did not succeed
         */
        Model getModel();

        /**
         * Lazily enumerates all models of the current formula. Enumeration may add blocking clauses to the session, so
         * the session should not be used for other queries afterwards.
         *
         * @return an iterator over all models
         */
        Iterator<Model> enumerateModels();

        /**
         * Adds further clauses to the formula of this session.
         *
         * @param clauses
         *         the additional clauses
         */
        void append(CNF clauses);

        @Override
        void close();
    }
}
