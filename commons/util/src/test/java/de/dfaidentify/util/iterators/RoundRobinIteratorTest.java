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
package de.dfaidentify.util.iterators;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.testng.Assert;
import org.testng.annotations.Test;

public class RoundRobinIteratorTest {

    private static CloseableIterator<Integer> of(AtomicInteger closeCounter, Integer... elements) {
        return Iterators.wrap(Arrays.asList(elements).iterator(), closeCounter::incrementAndGet);
    }

    private static <T> List<T> drain(CloseableIterator<T> it) {
        final List<T> result = new ArrayList<>();
        it.forEachRemaining(result::add);
        return result;
    }

    @Test
    public void testAlternation() {
        final AtomicInteger closed = new AtomicInteger();
        final RoundRobinIterator<Integer> it = new RoundRobinIterator<>(of(closed, 1, 3, 5), of(closed, 2, 4, 6));

        Assert.assertEquals(drain(it), Arrays.asList(1, 2, 3, 4, 5, 6));
        Assert.assertEquals(closed.get(), 2);
    }

    @Test
    public void testDrainsSurvivorAfterExhaustion() {
        final AtomicInteger closed = new AtomicInteger();
        final RoundRobinIterator<Integer> it = new RoundRobinIterator<>(of(closed, 1), of(closed, 2, 4, 6, 8));

        Assert.assertEquals(drain(it), Arrays.asList(1, 2, 4, 6, 8));
    }

    @Test
    public void testFirstEmpty() {
        final AtomicInteger closed = new AtomicInteger();
        final RoundRobinIterator<Integer> it = new RoundRobinIterator<>(of(closed), of(closed, 2, 4));

        Assert.assertEquals(drain(it), Arrays.asList(2, 4));
        Assert.assertEquals(closed.get(), 2);
    }

    @Test
    public void testEarlyClose() {
        final AtomicInteger closed = new AtomicInteger();
        final RoundRobinIterator<Integer> it = new RoundRobinIterator<>(of(closed, 1, 3), of(closed, 2, 4));

        Assert.assertEquals(it.next(), Integer.valueOf(1));
        it.close();

        Assert.assertEquals(closed.get(), 2);
        Assert.assertFalse(it.hasNext());
        Assert.assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    public void testNoDelegates() {
        Assert.assertFalse(new RoundRobinIterator<>(Collections.emptyList()).hasNext());
    }

    @Test
    public void testStreamClosesIterator() {
        final AtomicInteger closed = new AtomicInteger();
        final List<Integer> firstTwo;
        try (Stream<Integer> stream = Iterators.stream(of(closed, 1, 2, 3, 4))) {
            firstTwo = stream.limit(2).collect(Collectors.toList());
        }

        Assert.assertEquals(firstTwo, Arrays.asList(1, 2));
        Assert.assertEquals(closed.get(), 1);
    }

    @Test
    public void testWrapClosesOnlyOnce() {
        final AtomicInteger closed = new AtomicInteger();
        final CloseableIterator<Integer> it = of(closed, 1);

        Assert.assertEquals(drain(it), Collections.singletonList(1));
        it.close();
        Assert.assertEquals(closed.get(), 1);
    }

    @Test
    public void testMap() {
        final AtomicInteger closed = new AtomicInteger();
        final CloseableIterator<String> it = Iterators.map(of(closed, 1, 2), i -> "x" + i);

        Assert.assertEquals(drain(it), Arrays.asList("x1", "x2"));
        Assert.assertEquals(closed.get(), 1);
    }
}
