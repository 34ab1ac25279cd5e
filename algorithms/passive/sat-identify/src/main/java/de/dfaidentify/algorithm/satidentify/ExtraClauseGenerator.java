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

import de.dfaidentify.api.sat.CNF;

/**
 * A hook for domain-specific constraints on the identified DFA. The generator is invoked once per candidate size,
 * after all built-in clauses have been generated, and its clauses are appended to the encoding. Auxiliary variables
 * must be allocated via {@link Codec#nextId()}.
 * <p>
 * Implementations should be free of side effects other than id allocation on the given codec.
 *
 * @param <I>
 *         input symbol type
 */
@FunctionalInterface
public interface ExtraClauseGenerator<I> {

    CNF apply(Codec<I> codec);

    static <I> ExtraClauseGenerator<I> none() {
        return codec -> new CNF();
    }
}
