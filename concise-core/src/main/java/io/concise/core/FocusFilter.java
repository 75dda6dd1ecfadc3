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
import java.util.List;

/**
 * Narrows a tree to its focused blocks. When any block is focused, the result holds only
 * focused blocks (each with its whole subtree) and the groups needed to reach them;
 * unfocused siblings are pruned. Without any focused block the tree is returned as is.
 */
public final class FocusFilter {

    private FocusFilter() {
    }

    public static Group apply(Group root) {
        if (!containsFocus(root)) {
            return root;
        }
        return root.withChildren(narrowChildren(root));
    }

    static boolean containsFocus(Block block) {
        if (block.isFocus()) {
            return true;
        }
        if (block instanceof Group group) {
            for (Block child : group.getChildren()) {
                if (containsFocus(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Block> narrowChildren(Group group) {
        List<Block> kept = new ArrayList<>();
        for (Block child : group.getChildren()) {
            Block narrowed = narrow(child);
            if (narrowed != null) {
                kept.add(narrowed);
            }
        }
        return kept;
    }

    private static Block narrow(Block block) {
        if (block.isFocus()) {
            return block;
        }
        if (block instanceof Group group) {
            List<Block> kept = narrowChildren(group);
            return kept.isEmpty() ? null : group.withChildren(kept);
        }
        return null;
    }

}
