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
import de.dfaidentify.api.sat.SatOracle.Session;
import de.dfaidentify.oracle.sat.Sat4jOracle;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CountingSatOracleTest {

    @Test
    public void testCounting() {
        final CountingSatOracle oracle = new CountingSatOracle(new Sat4jOracle(), "test");
        final CNF cnf = new CNF().add(1, 2).add(-1, -2);

        try (Session session = oracle.open(cnf)) {
            Assert.assertTrue(session.solve());
            Assert.assertEquals(oracle.getActiveSessions(), 1);

            final Iterator<Model> it = session.enumerateModels();
            while (it.hasNext()) {
                it.next();
            }
        }

        final Session other = oracle.open(cnf);
        Assert.assertEquals(oracle.getOpenedSessions(), 2);
        Assert.assertEquals(oracle.getClosedSessions(), 1);
        Assert.assertEquals(oracle.getActiveSessions(), 1);

        other.close();
        other.close();

        Assert.assertEquals(oracle.getClosedSessions(), 2);
        Assert.assertEquals(oracle.getActiveSessions(), 0);
        Assert.assertEquals(oracle.getSolveCalls(), 1);
        Assert.assertEquals(oracle.getEnumeratedModels(), 2);
        Assert.assertTrue(oracle.toString().startsWith("test"));
    }
}
