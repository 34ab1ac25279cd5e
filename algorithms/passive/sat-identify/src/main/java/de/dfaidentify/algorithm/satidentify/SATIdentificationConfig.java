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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.misberner.buildergen.annotations.GenerateBuilder;
import de.dfaidentify.api.sat.CardinalityEncoder;
import de.dfaidentify.api.sat.SatOracle;
import de.dfaidentify.oracle.sat.Sat4jOracle;
import de.dfaidentify.oracle.sat.SequentialCounterEncoder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The (immutable) parameters of a {@link SATDFAIdentifier}. Instances are usually created via the generated
 * {@code SATIdentificationConfigBuilder}, which falls back to the values of {@link BuilderDefaults} for every parameter
 * that is not set explicitly. A {@code null} alphabet means the alphabet is inferred from the examples.
 *
 * @param <I>
 *         input symbol type
 */
public final class SATIdentificationConfig<I> {

    private final SatOracle oracle;
    private final CardinalityEncoder cardinalityEncoder;
    private final SymmetryBreaking symmetryBreaking;
    private final ExtraClauseGenerator<I> extraClauses;
    private final Bounds bounds;
    private final boolean orderByStutter;
    private final @Nullable List<I> alphabet;
    private final boolean allowUnminimized;

    @GenerateBuilder(defaults = BuilderDefaults.class)
    public SATIdentificationConfig(SatOracle oracle,
                                   CardinalityEncoder cardinalityEncoder,
                                   SymmetryBreaking symmetryBreaking,
                                   ExtraClauseGenerator<I> extraClauses,
                                   Bounds bounds,
                                   boolean orderByStutter,
                                   Collection<? extends I> alphabet,
                                   boolean allowUnminimized) {
        this.oracle = Objects.requireNonNull(oracle);
        this.cardinalityEncoder = Objects.requireNonNull(cardinalityEncoder);
        this.symmetryBreaking = Objects.requireNonNull(symmetryBreaking);
        this.extraClauses = Objects.requireNonNull(extraClauses);
        this.bounds = Objects.requireNonNull(bounds);
        this.orderByStutter = orderByStutter;
        this.alphabet = alphabet == null ? null : Collections.unmodifiableList(new ArrayList<>(alphabet));
        this.allowUnminimized = allowUnminimized;
    }

    /**
     * Returns the default configuration: Sat4j, breadth-first symmetry breaking, no extra clauses, no size bounds, no
     * stutter ordering, an inferred alphabet, and minimal DFAs only.
     *
     * @param <I>
     *         input symbol type
     *
     * @return the default configuration
     */
    public static <I> SATIdentificationConfig<I> defaults() {
        return new SATIdentificationConfigBuilder<I>().create();
    }

    /**
     * Returns a copy of this configuration that stops after the first satisfiable size.
     *
     * @return the copy, or {@code this} if unminimized DFAs are already excluded
     */
    public SATIdentificationConfig<I> minimalOnly() {
        if (!allowUnminimized) {
            return this;
        }
        return new SATIdentificationConfig<>(oracle,
                                             cardinalityEncoder,
                                             symmetryBreaking,
                                             extraClauses,
                                             bounds,
                                             orderByStutter,
                                             alphabet,
                                             false);
    }

    public SatOracle getOracle() {
        return oracle;
    }

    public CardinalityEncoder getCardinalityEncoder() {
        return cardinalityEncoder;
    }

    public SymmetryBreaking getSymmetryBreaking() {
        return symmetryBreaking;
    }

    public ExtraClauseGenerator<I> getExtraClauses() {
        return extraClauses;
    }

    public Bounds getBounds() {
        return bounds;
    }

    public boolean isOrderByStutter() {
        return orderByStutter;
    }

    /**
     * Returns the explicit alphabet, or {@code null} if the alphabet is inferred from the examples.
     *
     * @return the explicit alphabet
     */
    public @Nullable List<I> getAlphabet() {
        return alphabet;
    }

    public boolean isAllowUnminimized() {
        return allowUnminimized;
    }

    @Override
    public String toString() {
        return "SATIdentificationConfig{" + "oracle=" + oracle + ", symmetryBreaking=" + symmetryBreaking +
               ", bounds=" + bounds + ", orderByStutter=" + orderByStutter + ", alphabet=" + alphabet +
               ", allowUnminimized=" + allowUnminimized + '}';
    }

    public static final class BuilderDefaults {

        private BuilderDefaults() {
            // prevent instantiation
        }

        public static SatOracle oracle() {
            return new Sat4jOracle();
        }

        public static CardinalityEncoder cardinalityEncoder() {
            return new SequentialCounterEncoder();
        }

        public static SymmetryBreaking symmetryBreaking() {
            return SymmetryBreakings.BFS;
        }

        public static <I> ExtraClauseGenerator<I> extraClauses() {
            return ExtraClauseGenerator.none();
        }

        public static Bounds bounds() {
            return Bounds.unbounded();
        }

        public static boolean orderByStutter() {
            return false;
        }

        public static boolean allowUnminimized() {
            return false;
        }
    }
}
