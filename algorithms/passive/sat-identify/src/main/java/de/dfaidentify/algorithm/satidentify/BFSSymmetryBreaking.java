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
 * Breadth-first symmetry breaking for DFA identification, after Ulyantsev et al., "BFS-Based Symmetry Breaking
 * Predicates for DFA Identification" (LATA 2015).
 * <p>
 * The APTA root is colored {@code 0}. Three families of auxiliary variables are introduced:
 * <ul>
 * <li>{@code t(i,j)}, {@code i < j}: some transition leads from color {@code i} to color {@code j},</li>
 * <li>{@code p(j,i)}, {@code i < j}: color {@code i} is the BFS parent of color {@code j}, i.e. the smallest color
 * with a transition to {@code j},</li>
 * <li>{@code m(i,a,j)}, {@code i < j}: {@code a} is the smallest symbol on which color {@code i} transitions to
 * {@code j}.</li>
 * </ul>
 * Every color {@code j > 0} must have a parent, parents must not decrease with {@code j}, and colors sharing a parent
 * are ordered by the smallest symbol leading to them.
 */
final class BFSSymmetryBreaking {

    private final Codec<?> codec;
    private final CNF cnf;

    private final int numColors;
    private final int numSymbols;

    // indexed [i][j] for t and [j][i] for p, only i < j is used
    private final int[][] t;
    private final int[][] p;
    // indexed [i][a][j]
    private final int[][][] m;

    BFSSymmetryBreaking(Codec<?> codec, CNF cnf) {
        this.codec = codec;
        this.cnf = cnf;
        this.numColors = codec.numColors();
        this.numSymbols = codec.getAlphabet().size();
        this.t = new int[numColors][numColors];
        this.p = new int[numColors][numColors];
        this.m = new int[numColors][numSymbols][numColors];
    }

    void addClauses() {
        cnf.add(codec.nodeColor(codec.getAPTA().getRoot().getId(), 0));

        allocateVariables();
        addTransitionDefinitions();
        addParentDefinitions();
        addParentOrdering();
        addMinimalSymbolDefinitions();
        addSiblingOrdering();
    }

    private void allocateVariables() {
        for (int i = 0; i < numColors; i++) {
            for (int j = i + 1; j < numColors; j++) {
                t[i][j] = codec.nextId();
            }
        }
        for (int j = 1; j < numColors; j++) {
            for (int i = 0; i < j; i++) {
                p[j][i] = codec.nextId();
            }
        }
        for (int i = 0; i < numColors; i++) {
            for (int a = 0; a < numSymbols; a++) {
                for (int j = i + 1; j < numColors; j++) {
                    m[i][a][j] = codec.nextId();
                }
            }
        }
    }

    // t(i,j) <-> OR_a y(i,a,j)
    private void addTransitionDefinitions() {
        for (int i = 0; i < numColors; i++) {
            for (int j = i + 1; j < numColors; j++) {
                final int[] clause = new int[numSymbols + 1];
                clause[0] = -t[i][j];
                for (int a = 0; a < numSymbols; a++) {
                    final int y = codec.transition(i, a, j);
                    clause[a + 1] = y;
                    cnf.add(-y, t[i][j]);
                }
                cnf.add(clause);
            }
        }
    }

    // p(j,i) <-> t(i,j) AND NOT t(k,j) for all k < i
    private void addParentDefinitions() {
        for (int j = 1; j < numColors; j++) {
            final int[] someParent = new int[j];
            for (int i = 0; i < j; i++) {
                someParent[i] = p[j][i];

                cnf.add(-p[j][i], t[i][j]);
                final int[] reverse = new int[i + 2];
                reverse[0] = p[j][i];
                reverse[1] = -t[i][j];
                for (int k = 0; k < i; k++) {
                    cnf.add(-p[j][i], -t[k][j]);
                    reverse[k + 2] = t[k][j];
                }
                cnf.add(reverse);
            }
            cnf.add(someParent);
        }
    }

    // p(j,i) -> NOT p(j+1,k) for all k < i
    private void addParentOrdering() {
        for (int j = 1; j + 1 < numColors; j++) {
            for (int i = 0; i < j; i++) {
                for (int k = 0; k < i; k++) {
                    cnf.add(-p[j][i], -p[j + 1][k]);
                }
            }
        }
    }

    // m(i,a,j) <-> y(i,a,j) AND NOT y(i,b,j) for all b < a
    private void addMinimalSymbolDefinitions() {
        for (int i = 0; i < numColors; i++) {
            for (int j = i + 1; j < numColors; j++) {
                for (int a = 0; a < numSymbols; a++) {
                    final int y = codec.transition(i, a, j);
                    cnf.add(-m[i][a][j], y);
                    final int[] reverse = new int[a + 2];
                    reverse[0] = m[i][a][j];
                    reverse[1] = -y;
                    for (int b = 0; b < a; b++) {
                        final int yb = codec.transition(i, b, j);
                        cnf.add(-m[i][a][j], -yb);
                        reverse[b + 2] = yb;
                    }
                    cnf.add(reverse);
                }
            }
        }
    }

    // p(j,i) AND p(j+1,i) AND m(i,a,j) -> NOT m(i,b,j+1) for all b < a
    private void addSiblingOrdering() {
        for (int j = 1; j + 1 < numColors; j++) {
            for (int i = 0; i < j; i++) {
                for (int a = 0; a < numSymbols; a++) {
                    for (int b = 0; b < a; b++) {
                        cnf.add(-p[j][i], -p[j + 1][i], -m[i][a][j], -m[i][b][j + 1]);
                    }
                }
            }
        }
    }
}
