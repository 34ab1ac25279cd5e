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
package de.dfaidentify.api.exception;

// Thrown when a session is requested from a SAT oracle whose session limit has been reached.
public class OracleLimitException extends SatOracleException {

    private final long limit;

    /**
     * Constructor.
     *
     * @param limit
     *         the number of sessions that were allowed
     */
    public OracleLimitException(long limit) {
        super("SAT oracle session limit of " + limit + " reached");
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }

}
