/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.opendigraph.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Generates fresh node ids that do not appear in a set of used ids,
 * and remembers the translation from the ids of a graph being imported
 * to the fresh ids that replace them. */
public class IdAllocator {
    final Set<Integer> used;
    final Map<Integer, Integer> translation;
    int next;

    /** @param used Ids that may not be handed out.  The set is copied. */
    public IdAllocator(Set<Integer> used) {
        this.used = new HashSet<>(used);
        this.translation = new HashMap<>();
        this.next = 0;
        for (int id: used)
            this.next = Math.max(this.next, id + 1);
    }

    /** A fresh id, never returned before and not in the used set. */
    public int fresh() {
        while (this.used.contains(this.next))
            this.next++;
        int result = this.next++;
        this.used.add(result);
        return result;
    }

    /** The fresh id that replaces 'oldId'; the same old id always maps to the same fresh id. */
    public int translate(int oldId) {
        return this.translation.computeIfAbsent(oldId, k -> this.fresh());
    }

    public Map<Integer, Integer> getTranslation() {
        return this.translation;
    }
}
