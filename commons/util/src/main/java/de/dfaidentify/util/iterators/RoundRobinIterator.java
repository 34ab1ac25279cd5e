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
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Interleaves several iterators by taking one element from each in turn. Once an iterator is exhausted it is closed and
 * skipped, the remaining ones are drained in the same fashion.
 *
 * @param <T>
 *         element type
 */
public class RoundRobinIterator<T> implements CloseableIterator<T> {

    private final List<CloseableIterator<? extends T>> delegates;
    private int current;

    @SafeVarargs
    public RoundRobinIterator(CloseableIterator<? extends T>... delegates) {
        this(Arrays.asList(delegates));
    }

    public RoundRobinIterator(List<? extends CloseableIterator<? extends T>> delegates) {
        this.delegates = new ArrayList<>(delegates);
    }

    @Override
    public boolean hasNext() {
        while (!delegates.isEmpty()) {
            if (current >= delegates.size()) {
                current = 0;
            }
            final CloseableIterator<? extends T> it = delegates.get(current);
            if (it.hasNext()) {
                return true;
            }
            it.close();
            delegates.remove(current);
        }
        return false;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final T result = delegates.get(current).next();
        current++;
        return result;
    }

    @Override
    public void close() {
        for (CloseableIterator<? extends T> it : delegates) {
            it.close();
        }
        delegates.clear();
    }
}
