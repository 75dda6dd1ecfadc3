/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.concise.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Narrows a tree to blocks tagged with any of the requested tags. A tagged group keeps its
 * whole subtree; an untagged group survives only as the ancestor of something tagged. The
 * root is always kept, possibly empty. Skip flags are carried over untouched, so a
 * skipped group stays skipped whatever its tags.
 */
public final class TagFilter {

    private TagFilter() {
    }

    /**
     * @param tags requested tags, null or empty to keep everything
     */
    public static Group apply(Collection<String> tags, Group root) {
        if (tags == null || tags.isEmpty()) {
            return root;
        }
        Set<String> requested = new LinkedHashSet<>(tags);
        return root.withChildren(narrowChildren(root, requested));
    }

    private static List<Block> narrowChildren(Group group, Set<String> requested) {
        List<Block> kept = new ArrayList<>();
        for (Block child : group.getChildren()) {
            Block narrowed = narrow(child, requested);
            if (narrowed != null) {
                kept.add(narrowed);
            }
        }
        return kept;
    }

    private static Block narrow(Block block, Set<String> requested) {
        if (!Collections.disjoint(block.getTags(), requested)) {
            return block;
        }
        if (block instanceof Group group) {
            List<Block> kept = narrowChildren(group, requested);
            return kept.isEmpty() ? null : group.withChildren(kept);
        }
        return null;
    }

}
