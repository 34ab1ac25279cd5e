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
package de.dfaidentify.datastructure.apta;

/**
 * The (partial) acceptance information of an {@link APTANode}.
 */
public enum NodeLabel {
    ACCEPTING,
    REJECTING,
    UNLABELED;

    public static NodeLabel of(boolean accepting) {
        return accepting ? ACCEPTING : REJECTING;
    }
}
