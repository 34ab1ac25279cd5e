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
package de.dfaidentify.api.sat;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ModelTest {

    @Test
    public void testValues() {
        final Model model = Model.fromLiterals(new int[] {1, -2, 3}, 5);

        Assert.assertEquals(model.numVariables(), 5);
        Assert.assertTrue(model.isTrue(1));
        Assert.assertFalse(model.isTrue(2));
        Assert.assertTrue(model.value(-2));
        Assert.assertFalse(model.value(-3));
        // not mentioned, or beyond the known variables
        Assert.assertFalse(model.isTrue(4));
        Assert.assertFalse(model.isTrue(42));
        Assert.assertEquals(model.toLiterals(), new int[] {1, -2, 3, -4, -5});
    }

    @Test
    public void testSatisfies() {
        final Model model = Model.fromLiterals(new int[] {1, -2}, 2);
        final CNF cnf = new CNF().add(1, 2).add(-2);

        Assert.assertTrue(model.satisfies(cnf));
        Assert.assertFalse(model.satisfies(new int[] {-1, 2}));
        Assert.assertFalse(model.satisfies(new int[0]));
        Assert.assertFalse(model.satisfies(new CNF(cnf).add(2)));
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(Model.fromLiterals(new int[] {1, -2}, 2), Model.fromLiterals(new int[] {1}, 2));
        Assert.assertNotEquals(Model.fromLiterals(new int[] {1}, 2), Model.fromLiterals(new int[] {2}, 2));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidVariable() {
        Model.fromLiterals(new int[] {1}, 1).isTrue(0);
    }
}
