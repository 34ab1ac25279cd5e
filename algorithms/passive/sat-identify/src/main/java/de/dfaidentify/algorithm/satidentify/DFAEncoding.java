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
 * The clauses encoding "a DFA with {@code codec.numColors()} states consistent with the examples exists", together
 * with the codec that gives meaning to their variables.
 *
 * @param <I>
 *         input symbol type
 */
public final class DFAEncoding<I> {

    private final Codec<I> codec;
    private final CNF clauses;

    DFAEncoding(Codec<I> codec, CNF clauses) {
        this.codec = codec;
        this.clauses = clauses;
    }

    public Codec<I> getCodec() {
        return codec;
    }

    public CNF getClauses() {
        return clauses;
    }

    public int numColors() {
        return codec.numColors();
    }
}
