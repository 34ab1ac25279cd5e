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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.datastructure.apta.APTA;
import de.dfaidentify.oracle.sat.Sat4jOracle;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DFAEncoderTest {

    private final APTA<Character> apta =
            APTA.fromExamples(Examples.scenarioAccepting(), Examples.scenarioRejecting());

    @Test
    public void testBoundedEncodings() {
        final DFAEncoder<Character> encoder = new DFAEncoder<>(apta);
        final Iterator<DFAEncoding<Character>> iter = encoder.encodings(Bounds.of(2, 4));

        final List<Integer> sizes = new ArrayList<>();
        iter.forEachRemaining(e -> sizes.add(e.numColors()));
        Assert.assertEquals(sizes, Arrays.asList(2, 3, 4));

        Assert.assertFalse(encoder.encodings(Bounds.atMost(0)).hasNext());
        Assert.assertEquals(encoder.encodings(Bounds.atMost(1)).next().numColors(), 1);
        Assert.assertEquals(encoder.encodings(Bounds.of(0, null)).next().numColors(), 1);
    }

    @Test
    public void testUnboundedEncodingsAreLazy() {
        final Iterator<DFAEncoding<Character>> iter = new DFAEncoder<>(apta).encodings(Bounds.unbounded());
        for (int k = 1; k <= 10; k++) {
            Assert.assertTrue(iter.hasNext());
            Assert.assertEquals(iter.next().numColors(), k);
        }
        Assert.assertTrue(iter.hasNext());
    }

    @Test
    public void testExtraClausesAreAppendedLast() {
        final int[] allocated = new int[1];
        final ExtraClauseGenerator<Character> extra = codec -> {
            allocated[0] = codec.nextId();
            return new CNF().add(allocated[0], -codec.colorAccepting(0));
        };

        final DFAEncoding<Character> plain = new DFAEncoder<>(apta).encode(3);
        final DFAEncoding<Character> extended =
                new DFAEncoder<>(apta, SymmetryBreakings.BFS, extra).encode(3);

        Assert.assertEquals(extended.getClauses().size(), plain.getClauses().size() + 1);
        Assert.assertEquals(allocated[0], plain.getCodec().maxId() + 1);
        Assert.assertEquals(extended.getCodec().maxId(), allocated[0]);

        final List<int[]> clauses = extended.getClauses().getClauses();
        Assert.assertEquals(clauses.get(clauses.size() - 1),
                            new int[] {allocated[0], -extended.getCodec().colorAccepting(0)});
    }

    @Test
    public void testSymmetryBreakingAuxiliaryVariables() {
        final DFAEncoding<Character> none = encode(SymmetryBreakings.NONE, 3);
        final DFAEncoding<Character> root = encode(SymmetryBreakings.ROOT, 3);
        final DFAEncoding<Character> bfs = encode(SymmetryBreakings.BFS, 3);

        Assert.assertEquals(none.getCodec().maxId(), none.getCodec().baseVariables());
        Assert.assertEquals(root.getCodec().maxId(), root.getCodec().baseVariables());
        Assert.assertEquals(root.getClauses().size(), none.getClauses().size() + 1);

        // t: 3 pairs, p: 3 pairs, m: 3 pairs * 2 symbols
        Assert.assertEquals(bfs.getCodec().maxId(), bfs.getCodec().baseVariables() + 3 + 3 + 6);
        Assert.assertTrue(bfs.getClauses().maxVariable() <= bfs.getCodec().maxId());
    }

    @Test
    public void testSymmetryModesAgreeOnSatisfiability() {
        final Sat4jOracle oracle = new Sat4jOracle();

        // the smallest consistent DFA has 3 states
        for (int k = 1; k <= 3; k++) {
            final List<Boolean> results = new ArrayList<>();
            for (SymmetryBreakings mode : SymmetryBreakings.values()) {
                final DFAEncoding<Character> encoding = encode(mode, k);
                try (Session session = oracle.open(encoding.getClauses())) {
                    results.add(session.solve());
                }
            }
            Assert.assertEquals(results.get(1), results.get(0), "k=" + k);
            Assert.assertEquals(results.get(2), results.get(0), "k=" + k);
            Assert.assertEquals(results.get(0).booleanValue(), k == 3, "k=" + k);
        }
    }

    @Test
    public void testNoLabelClausesForUnlabeledNodes() {
        final APTA<Character> unlabeled = APTA.fromExamples(Examples.words("ab"), Collections.emptyList());
        final DFAEncoding<Character> encoding =
                new DFAEncoder<>(unlabeled, SymmetryBreakings.NONE, ExtraClauseGenerator.none()).encode(2);
        final Codec<Character> codec = encoding.getCodec();

        for (int[] clause : encoding.getClauses()) {
            for (int lit : clause) {
                final EncodingVariable var = codec.decode(lit);
                if (var != null && var.getKind() == EncodingVariable.Kind.COLOR_ACCEPTING) {
                    // only the accepting leaf "ab" (node 2) may be constrained
                    Assert.assertTrue(clause.length == 2 && clause[0] == -codec.nodeColor(2, var.getColor()),
                                      "unexpected label clause " + Arrays.toString(clause));
                }
            }
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidBounds() {
        Bounds.of(3, 2);
    }

    private DFAEncoding<Character> encode(SymmetryBreaking mode, int k) {
        return new DFAEncoder<>(apta, mode, ExtraClauseGenerator.none()).encode(k);
    }
}
