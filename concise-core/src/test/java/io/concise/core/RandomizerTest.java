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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RandomizerTest {

    private static final TestBody NOOP = t -> {
    };

    private static Group sample() {
        BlockTree tree = new BlockTree();
        for (int i = 0; i < 5; i++) {
            String group = "g" + i;
            tree.describe(group, () -> {
                for (int j = 0; j < 5; j++) {
                    tree.it(group + "-t" + j, NOOP);
                }
            });
        }
        return tree.close();
    }

    private static List<String> sortedTestNames(Group group) {
        List<String> names = new ArrayList<>();
        for (TestCase test : group.getTests()) {
            names.add(test.getName());
        }
        names.sort(null);
        return names;
    }

    @Test
    void testPreservesEveryBlock() {
        Group root = sample();
        Group shuffled = new Randomizer(7).apply(root);
        assertEquals(sortedTestNames(root), sortedTestNames(shuffled));
        assertEquals(root.getChildren().size(), shuffled.getChildren().size());
        for (Block child : shuffled.getChildren()) {
            Group group = (Group) child;
            assertEquals(5, group.getChildren().size());
            // children never move across groups
            for (Block test : group.getChildren()) {
                assertTrue(test.getName().startsWith(group.getName() + "-"));
            }
        }
    }

    @Test
    void testSameSeedSameOrder() {
        Group root = sample();
        Group a = new Randomizer(42).apply(root);
        Group b = new Randomizer(42).apply(root);
        assertEquals(a.toJson(), b.toJson());
    }

    @Test
    void testDoesNotMutateInput() {
        Group root = sample();
        Object before = root.toJson();
        new Randomizer(1).apply(root);
        assertEquals(before, root.toJson());
    }

    @Test
    void testPipelineRandomizesOnlyWhenAsked() {
        Group root = sample();
        assertEquals(root.toJson(), FilterPipeline.apply(root, RunOptions.DEFAULTS).toJson());
        Group shuffled = FilterPipeline.apply(root, new RunOptions(null, true, 3L));
        assertEquals(sortedTestNames(root), sortedTestNames(shuffled));
        assertEquals(new Randomizer(3).apply(root).toJson(), shuffled.toJson());
    }

}
