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
package de.dfaidentify.filter.statistic.oracle;

import java.util.Iterator;

import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SatOracle} that forwards all queries to a delegate and keeps track of the number of opened and closed
 * sessions, satisfiability checks and enumerated models.
 * <p>
 * This oracle is <b>not</b> thread-safe.
 */
public class CountingSatOracle implements SatOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(CountingSatOracle.class);

    private final SatOracle delegate;
    private final String name;

    private long openedSessions;
    private long closedSessions;
    private long solveCalls;
    private long enumeratedModels;

    public CountingSatOracle(SatOracle delegate) {
        this(delegate, "SAT oracle");
    }

    public CountingSatOracle(SatOracle delegate, String name) {
        this.delegate = delegate;
        this.name = name;
    }

    @Override
    public Session open(CNF clauses) {
        openedSessions++;
        LOGGER.trace("{}: opening session #{} with {} clauses", name, openedSessions, clauses.size());
        return new CountingSession(delegate.open(clauses));
    }

    public long getOpenedSessions() {
        return openedSessions;
    }

    public long getClosedSessions() {
        return closedSessions;
    }

    /**
     * Returns the number of sessions that have been opened but not yet closed.
     *
     * @return the number of active sessions
     */
    public long getActiveSessions() {
        return openedSessions - closedSessions;
    }

    public long getSolveCalls() {
        return solveCalls;
    }

    public long getEnumeratedModels() {
        return enumeratedModels;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + ": " + openedSessions + " sessions (" + getActiveSessions() + " active), " + solveCalls +
               " solve calls, " + enumeratedModels + " enumerated models";
    }

    private final class CountingSession implements Session {

        private final Session session;
        private boolean closed;

        CountingSession(Session session) {
            this.session = session;
        }

        @Override
        public boolean solve() {
            solveCalls++;
            return session.solve();
        }

        @Override
        public Model getModel() {
            return session.getModel();
        }

        @Override
        public Iterator<Model> enumerateModels() {
            final Iterator<Model> models = session.enumerateModels();
            return new Iterator<Model>() {

                @Override
                public boolean hasNext() {
                    return models.hasNext();
                }

                @Override
                public Model next() {
                    final Model next = models.next();
                    enumeratedModels++;
                    return next;
                }
            };
        }

        @Override
        public void append(CNF clauses) {
            session.append(clauses);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                closedSessions++;
            }
            session.close();
        }
    }
}
