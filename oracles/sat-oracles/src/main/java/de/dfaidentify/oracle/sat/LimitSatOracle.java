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

import de.dfaidentify.api.exception.OracleLimitException;
import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.SatOracle;

/**
 * A wrapper around a {@link SatOracle} that refuses to open more than a fixed number of sessions. Once the limit is
 * reached, every further call to {@link #open(CNF)} throws an {@link OracleLimitException}.
 * <p>
 * This oracle is <b>not</b> thread-safe.
 *
 * @author Falk Howar
 * @author Malte Isberner
 */
public class LimitSatOracle implements SatOracle {

    private final long sessionLimit;
    private long sessionCount;
    private final SatOracle delegate;

    public LimitSatOracle(long sessionLimit, SatOracle delegate) {
        this.sessionLimit = sessionLimit;
        this.sessionCount = 0;
        this.delegate = delegate;
    }

    @Override
    public Session open(CNF clauses) {
        if (sessionCount >= sessionLimit) {
            throw new OracleLimitException(sessionLimit);
        }
        sessionCount++;
        return delegate.open(clauses);
    }

    public long getSessionCount() {
        return sessionCount;
    }
}
