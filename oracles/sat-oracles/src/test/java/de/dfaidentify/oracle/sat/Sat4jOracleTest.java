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

import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

import de.dfaidentify.api.sat.CNF;
import de.dfaidentify.api.sat.Model;
import de.dfaidentify.api.sat.SatOracle;
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.api.exception.OracleLimitException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class Sat4jOracleTest {

    private final SatOracle oracle = new Sat4jOracle();

    @Test
    public void testSatisfiable() {
        final CNF cnf = new CNF().add(1, 2).add(-1).add(-2, 3);

        try (Session session = oracle.open(cnf)) {
            Assert.assertTrue(session.solve());
            final Model model = session.getModel();
            Assert.assertTrue(model.satisfies(cnf));
            Assert.assertFalse(model.isTrue(1));
            Assert.assertTrue(model.isTrue(2));
            Assert.assertTrue(model.isTrue(3));
        }
    }

    @Test
    public void testUnsatisfiable() {
        final CNF cnf = new CNF().add(1, 2).add(-1, 2).add(1, -2).add(-1, -2);

        try (Session session = oracle.open(cnf)) {
            Assert.assertFalse(session.solve());
            Assert.assertThrows(IllegalStateException.class, session::getModel);
            Assert.assertFalse(session.enumerateModels().hasNext());
        }
    }

    @Test
    public void testTrivialContradiction() {
        final CNF cnf = new CNF().add(1).add(-1);

        try (Session session = oracle.open(cnf)) {
            Assert.assertFalse(session.solve());
            Assert.assertFalse(session.enumerateModels().hasNext());
        }
    }

    @Test
    public void testEnumeration() {
        // exactly one of three
        final CNF cnf = new CNF().add(1, 2, 3).add(-1, -2).add(-1, -3).add(-2, -3);

        final Set<Model> models = new HashSet<>();
        try (Session session = oracle.open(cnf)) {
            Assert.assertTrue(session.solve());
            final Iterator<Model> it = session.enumerateModels();
            while (it.hasNext()) {
                final Model m = it.next();
                Assert.assertTrue(m.satisfies(cnf));
                models.add(m);
            }
        }
        Assert.assertEquals(models.size(), 3);
    }

    @Test
    public void testAppend() {
        final CNF cnf = new CNF().add(1, 2);

        try (Session session = oracle.open(cnf)) {
            Assert.assertTrue(session.solve());
            session.append(new CNF().add(-1).add(-2, 5));
            Assert.assertTrue(session.solve());
            Assert.assertTrue(session.getModel().isTrue(5));
            session.append(new CNF().add(-5));
            Assert.assertFalse(session.solve());
        }
    }

    @Test
    public void testClosedSession() {
        final Session session = oracle.open(new CNF().add(1));
        session.close();
        session.close();
        Assert.assertThrows(IllegalStateException.class, session::solve);
    }

    @Test
    public void testSessionLimit() {
        final LimitSatOracle limited = new LimitSatOracle(2, oracle);
        limited.open(new CNF().add(1)).close();
        limited.open(new CNF().add(1)).close();

        Assert.assertEquals(limited.getSessionCount(), 2);
        Assert.assertThrows(OracleLimitException.class, () -> limited.open(new CNF().add(1)));
    }
}
