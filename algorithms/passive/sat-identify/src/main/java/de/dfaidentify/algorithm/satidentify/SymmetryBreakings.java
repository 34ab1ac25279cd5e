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
 * The built-in {@link SymmetryBreaking} policies.
 */
public enum SymmetryBreakings implements SymmetryBreaking {

    /**
     * No symmetry breaking at all.
     */
    NONE {
        @Override
        public void addClauses(Codec<?> codec, CNF cnf) {}
    },

    /**
     * Fixes the color of the APTA root to {@code 0}.
     */
    ROOT {
        @Override
        public void addClauses(Codec<?> codec, CNF cnf) {
            cnf.add(codec.nodeColor(codec.getAPTA().getRoot().getId(), 0));
        }
    },

    /**
     * Enforces that colors are numbered in the order a breadth-first traversal of the DFA from its initial state
     * discovers them. Only DFAs whose states are all reachable admit a model.
     *
     * @see BFSSymmetryBreaking
     */
    BFS {
        @Override
        public void addClauses(Codec<?> codec, CNF cnf) {
            new BFSSymmetryBreaking(codec, cnf).addClauses();
        }
    }
}
