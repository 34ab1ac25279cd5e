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

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Static helpers for {@link CloseableIterator}s.
 */
public final class Iterators {

    private Iterators() {
        // prevent instantiation
    }

    public static <T> CloseableIterator<T> empty() {
        return wrap(Collections.emptyIterator(), () -> {});
    }

    /**
     * Attaches a close action to a plain iterator. The action runs at most once, either on exhaustion or on an explicit
     * call to {@link CloseableIterator#close()}.
     */
    public static <T> CloseableIterator<T> wrap(Iterator<? extends T> iterator, Runnable onClose) {
        return new CloseableIterator<T>() {

            private boolean closed;

            @Override
            public boolean hasNext() {
                if (closed) {
                    return false;
                }
                if (iterator.hasNext()) {
                    return true;
                }
                close();
                return false;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return iterator.next();
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    onClose.run();
                }
            }
        };
    }

    public static <T, R> CloseableIterator<R> map(CloseableIterator<? extends T> iterator,
                                                   Function<? super T, ? extends R> mapper) {
        return new CloseableIterator<R>() {

            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public R next() {
                return mapper.apply(iterator.next());
            }

            @Override
            public void close() {
                iterator.close();
            }
        };
    }

    /**
     * Exposes the iterator as a sequential, ordered stream. Closing the stream closes the iterator.
     */
    public static <T> Stream<T> stream(CloseableIterator<T> iterator) {
        final Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED);
        return StreamSupport.stream(spliterator, false).onClose(iterator::close);
    }
}
