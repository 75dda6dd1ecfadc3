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
package io.concise.junit5;

import io.concise.core.BlockTree;
import io.concise.core.Group;
import io.concise.core.Suite;
import io.concise.core.TestCase;
import io.concise.core.TestFile;
import io.concise.match.ExpectationError;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.opentest4j.TestAbortedException;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ConciseTestsTest {

    static class Calculator implements TestFile {
        @Override
        public void load(BlockTree tree) {
            tree.describe("calc", () -> {
                tree.it("adds", t -> t.expect(1 + 1).toBe(2));
                tree.it("multiplies", t -> t.expect(2 * 3).toBe(6));
                tree.describe("slow", () -> tree.it("big sum", t -> t.expect(1_000 + 1).toBe(1_001)));
                tree.it("later");
            });
        }
    }

    static class Broken implements TestFile {
        @Override
        public void load(BlockTree tree) {
            tree.it("wrong", t -> {
                t.expect(3).toBe(2);
                t.expect("a").toBe("b");
            });
        }
    }

    static class SameFailureTwice implements TestFile {
        @Override
        public void load(BlockTree tree) {
            tree.it("twice", t -> {
                ExpectationError error = ExpectationError.of("<actual> to be positive", -1);
                t.addFailure(error);
                t.addFailure(error);
            });
        }
    }

    @ConciseTests.Test
    Iterable<DynamicNode> testCalculator() {
        return ConciseTests.of(new Calculator());
    }

    @TestFactory
    Stream<DynamicNode> testCalculatorRandomized() {
        return ConciseTests.of(new Calculator()).randomize(true).seed(11).stream();
    }

    @Test
    void testTreeIsMirrored() {
        List<DynamicNode> nodes = ConciseTests.of(new Calculator()).stream().toList();
        assertEquals(1, nodes.size());
        DynamicContainer calc = (DynamicContainer) nodes.get(0);
        assertEquals("calc", calc.getDisplayName());
        List<String> names = calc.getChildren().map(DynamicNode::getDisplayName).toList();
        assertEquals(List.of("adds", "multiplies", "slow", "later"), names);
    }

    @Test
    void testFailedTestRethrowsFirstError() {
        Group root = Suite.of(new Broken()).run().getRoot();
        DynamicTest test = (DynamicTest) ConciseTests.toNode(root.getChildren().get(0));
        AssertionError error = assertThrows(AssertionError.class, () -> test.getExecutable().execute());
        assertEquals("Expected 3 to be 2", error.getMessage());
        assertEquals(1, error.getSuppressed().length);
        assertEquals("Expected 'a' to be 'b'", error.getSuppressed()[0].getMessage());
    }

    @Test
    void testReplayLeavesRecordedErrorsUntouched() {
        Group root = Suite.of(new SameFailureTwice()).run().getRoot();
        TestCase twice = (TestCase) root.getChildren().get(0);
        DynamicTest test = (DynamicTest) ConciseTests.toNode(twice);
        AssertionError error = assertThrows(AssertionError.class, () -> test.getExecutable().execute());
        assertEquals("Expected -1 to be positive", error.getMessage());
        assertSame(twice.getErrors().get(0), error.getCause());
        assertEquals(1, error.getSuppressed().length);
        assertEquals(0, twice.getErrors().get(0).getSuppressed().length);
        // replaying again gives the same result
        assertThrows(AssertionError.class, () -> test.getExecutable().execute());
        assertEquals(0, twice.getErrors().get(0).getSuppressed().length);
    }

    @Test
    void testSkippedTestIsAborted() {
        Group root = Suite.of(new Calculator()).run().getRoot();
        List<DynamicNode> nodes = ConciseTests.toNodes((Group) root.getChildren().get(0));
        DynamicTest later = (DynamicTest) nodes.get(3);
        assertThrows(TestAbortedException.class, () -> later.getExecutable().execute());
    }

    @Test
    void testTagsNarrowTree() {
        List<DynamicNode> nodes = ConciseTests.of(new Calculator(), new Broken()).tags("missing").stream().toList();
        assertTrue(nodes.isEmpty());
    }

}
