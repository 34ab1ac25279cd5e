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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.datastructure.apta.APTA;
import de.dfaidentify.filter.statistic.oracle.CountingSatOracle;
import de.dfaidentify.oracle.sat.Sat4jOracle;
import de.dfaidentify.oracle.sat.SequentialCounterEncoder;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class StutterOptimizerTest {

    private static final List<Word<Character>> ACCEPTING = Examples.scenarioAccepting();
    private static final List<Word<Character>> REJECTING = Examples.scenarioRejecting();

    private static int minimalNonStutterCount() {
        try (Stream<Pair<Codec<Character>, Model>> models = new SATDFAIdentifier<Character>().findModels(ACCEPTING,
                                                                                                         REJECTING)) {
            return models.mapToInt(p -> p.getFirst().nonStutterCount(p.getSecond())).min().getAsInt();
        }
    }

    @Test
    public void testOrderedByStutter() {
        final SATIdentificationConfig<Character> config =
                new SATIdentificationConfigBuilder<Character>().withOrderByStutter(true).create();

        final List<Pair<Codec<Character>, Model>> models;
        try (Stream<Pair<Codec<Character>, Model>> stream = new SATDFAIdentifier<>(config).findModels(ACCEPTING,
                                                                                                      REJECTING)) {
            models = stream.limit(50).collect(Collectors.toList());
        }

        Assert.assertFalse(models.isEmpty());

        final List<Integer> counts =
                models.stream().map(p -> p.getFirst().nonStutterCount(p.getSecond())).collect(Collectors.toList());
        Assert.assertEquals(counts.get(0).intValue(), minimalNonStutterCount());
        for (int i = 1; i < counts.size(); i++) {
            Assert.assertTrue(counts.get(i - 1) <= counts.get(i), counts.toString());
        }

        for (Pair<Codec<Character>, Model> p : models) {
            final CompactDFA<Character> dfa = p.getFirst().extractDFA(p.getSecond());
            Assert.assertEquals(dfa.size(), 3);
            for (Word<Character> w : ACCEPTING) {
                Assert.assertTrue(dfa.accepts(w));
            }
            for (Word<Character> w : REJECTING) {
                Assert.assertFalse(dfa.accepts(w));
            }
        }
    }

    @Test
    public void testDrainsAllBounds() {
        final CountingSatOracle oracle = new CountingSatOracle(new Sat4jOracle());
        final SATIdentificationConfig<Character> config =
                new SATIdentificationConfigBuilder<Character>().withOracle(oracle).withOrderByStutter(true).create();

        final SATDFAIdentifier<Character> identifier = new SATDFAIdentifier<>(config);

        final List<Integer> counts;
        try (Stream<Pair<Codec<Character>, Model>> stream = identifier.findModels(Examples.words("a"),
                                                                                  Examples.words(""))) {
            counts = stream.map(p -> {
                final CompactDFA<Character> dfa = p.getFirst().extractDFA(p.getSecond());
                Assert.assertEquals(dfa.size(), 2);
                Assert.assertTrue(dfa.accepts(Word.fromLetter('a')));
                Assert.assertFalse(dfa.accepts(Word.epsilon()));
                return p.getFirst().nonStutterCount(p.getSecond());
            }).collect(Collectors.toList());
        }

        // the initial state must leave on 'a', the other state may loop or return
        Assert.assertEquals(counts, Arrays.asList(1, 2));
        Assert.assertEquals(oracle.getActiveSessions(), 0);
    }

    @Test
    public void testFindDFAPrefersStutter() {
        final SATIdentificationConfig<Character> config =
                new SATIdentificationConfigBuilder<Character>().withOrderByStutter(true).create();
        final CompactDFA<Character> dfa = new SATDFAIdentifier<>(config).findDFA(ACCEPTING, REJECTING);

        Assert.assertNotNull(dfa);

        int nonStutter = 0;
        for (Integer s : dfa.getStates()) {
            for (Character sym : dfa.getInputAlphabet()) {
                if (!s.equals(dfa.getSuccessor(s, sym))) {
                    nonStutter++;
                }
            }
        }
        Assert.assertEquals(nonStutter, minimalNonStutterCount());
    }

    @Test
    public void testSessionsAreScoped() {
        final APTA<Character> apta = APTA.fromExamples(ACCEPTING, REJECTING);
        final DFAEncoding<Character> encoding = new DFAEncoder<>(apta).encode(3);
        final CountingSatOracle oracle = new CountingSatOracle(new Sat4jOracle());

        final Model witness;
        try (Session session = oracle.open(encoding.getClauses())) {
            Assert.assertTrue(session.solve());
            witness = session.getModel();
        }

        try (StutterOptimizer<Character> optimizer =
                     new StutterOptimizer<>(oracle, new SequentialCounterEncoder(), encoding, witness)) {
            Assert.assertEquals(oracle.getOpenedSessions(), 1);

            Assert.assertTrue(optimizer.hasNext());
            final Model first = optimizer.next();
            Assert.assertTrue(first.satisfies(encoding.getClauses()));
            final Codec<Character> codec = encoding.getCodec();
            Assert.assertTrue(codec.nonStutterCount(first) <= codec.nonStutterCount(witness));
            Assert.assertEquals(oracle.getActiveSessions(), 1);
        }

        Assert.assertEquals(oracle.getActiveSessions(), 0);
    }
}
