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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FocusFilterTest {

    private static final TestBody NOOP = t -> {
    };

    private static List<String> names(Group group) {
        return group.getChildren().stream().map(Block::getName).toList();
    }

    @Test
    void testNoFocusPassesThrough() {
        BlockTree tree = new BlockTree();
        tree.describe("a", () -> tree.it("x", NOOP));
        tree.it("y", NOOP);
        Group root = tree.close();
        assertSame(root, FocusFilter.apply(root));
    }

    @Test
    void testFocusedTestKeepsAncestorChainOnly() {
        BlockTree tree = new BlockTree();
        tree.describe("a", () -> {
            tree.it("x", NOOP);
            tree.describe("b", () -> {
                tree.only().it("focused", NOOP);
                tree.it("sibling", NOOP);
            });
        });
        tree.describe("c", () -> tree.it("z", NOOP));
        Group root = tree.close();

        Group filtered = FocusFilter.apply(root);
        assertEquals(List.of("a"), names(filtered));
        Group a = (Group) filtered.getChildren().get(0);
        assertEquals(List.of("b"), names(a));
        Group b = (Group) a.getChildren().get(0);
        assertEquals(List.of("focused"), names(b));
        // input untouched
        assertEquals(List.of("a", "c"), names(root));
    }

    @Test
    void testFocusedGroupKeepsWholeSubtree() {
        BlockTree tree = new BlockTree();
        tree.only().describe("focused", () -> {
            tree.it("one", NOOP);
            tree.describe("inner", () -> tree.it("two", NOOP));
        });
        tree.it("other", NOOP);
        Group filtered = FocusFilter.apply(tree.close());
        assertEquals(List.of("focused"), names(filtered));
        assertEquals(2, filtered.getTests().size());
    }

    @Test
    void testIdempotent() {
        BlockTree tree = new BlockTree();
        tree.describe("a", () -> {
            tree.only().it("x", NOOP);
            tree.it("y", NOOP);
        });
        tree.only().describe("b", () -> tree.it("z", NOOP));
        tree.it("w", NOOP);
        Group once = FocusFilter.apply(tree.close());
        Group twice = FocusFilter.apply(once);
        assertEquals(once.toJson(), twice.toJson());
    }

    @Test
    void testOnlyScenario() {
        BlockTree tree = new BlockTree();
        tree.describe("A", () -> {
            tree.only().it("a1", NOOP);
            tree.it("a2", NOOP);
        });
        tree.describe("B", () -> tree.it("b1", NOOP));
        Group filtered = FocusFilter.apply(tree.close());
        assertEquals(1, filtered.getTests().size());
        assertEquals("a1", filtered.getTests().get(0).getName());
    }

}
