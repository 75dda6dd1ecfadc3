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

import io.concise.match.ExpectationError;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class BlockRunnerTest {

    private final List<String> events = new ArrayList<>();

    private EventDispatcher recordingDispatcher() {
        EventDispatcher dispatcher = new EventDispatcher();
        dispatcher.listenAll(event -> {
            if (event instanceof DescribeRunEvent e) {
                events.add(event.getType().getEventName() + ":" + e.group().getName());
            } else if (event instanceof TestRunEvent e) {
                events.add(event.getType().getEventName() + ":" + e.test().getName());
            }
        });
        return dispatcher;
    }

    private static TestCase findTest(Group root, String name) {
        for (TestCase test : root.getTests()) {
            if (test.getName().equals(name)) {
                return test;
            }
        }
        throw new AssertionError("no test named " + name);
    }

    @Test
    void testCalcScenario() {
        BlockTree tree = new BlockTree();
        tree.describe("calc", () -> {
            tree.it("adds", t -> t.expect(1 + 1).toBe(2));
            tree.it("fails", t -> t.expect(3).toBe(2));
        });
        Group root = tree.close();
        boolean failed = new BlockRunner(recordingDispatcher()).run(root);

        assertTrue(failed);
        assertEquals(List.of("beginningDescribe:calc", "finishedTest:adds", "finishedTest:fails"), events);
        TestCase adds = findTest(root, "adds");
        TestCase fails = findTest(root, "fails");
        assertFalse(adds.isFailed());
        assertEquals(1, fails.getErrors().size());
        assertEquals("Expected 3 to be 2", fails.getErrors().get(0).getMessage());
        assertEquals("calc → fails", fails.getFullName());
    }

    @Test
    void testAllPassing() {
        BlockTree tree = new BlockTree();
        tree.it("a", t -> t.expect("x").toBe("x"));
        assertFalse(new BlockRunner(new EventDispatcher()).run(tree.close()));
    }

    @Test
    void testHookOrderOutermostFirst() {
        List<String> calls = new ArrayList<>();
        BlockTree tree = new BlockTree();
        tree.beforeEach(() -> calls.add("before root"));
        tree.afterEach(() -> calls.add("after root"));
        tree.describe("outer", () -> {
            tree.beforeEach(() -> calls.add("before outer"));
            tree.afterEach(() -> calls.add("after outer"));
            tree.describe("inner", () -> {
                tree.beforeEach(() -> calls.add("before inner"));
                tree.afterEach(() -> calls.add("after inner"));
                tree.it("test", t -> calls.add("body"));
            });
        });
        new BlockRunner(new EventDispatcher()).run(tree.close());
        assertEquals(List.of("before root", "before outer", "before inner", "body",
                "after root", "after outer", "after inner"), calls);
    }

    @Test
    void testThrowingBodySkipsAfters() {
        List<String> calls = new ArrayList<>();
        BlockTree tree = new BlockTree();
        tree.describe("group", () -> {
            tree.beforeEach(() -> calls.add("before"));
            tree.afterEach(() -> calls.add("after"));
            tree.it("throws", t -> {
                throw new IllegalStateException("boom");
            });
            tree.it("next", t -> calls.add("next body"));
        });
        Group root = tree.close();
        assertTrue(new BlockRunner(new EventDispatcher()).run(root));
        assertEquals(List.of("before", "before", "next body", "after"), calls);
        TestCase test = findTest(root, "throws");
        assertEquals("boom", test.getErrors().get(0).getMessage());
        assertFalse(findTest(root, "next").isFailed());
    }

    @Test
    void testFailingBeforeHookSkipsBodyAndAfters() {
        List<String> calls = new ArrayList<>();
        BlockTree tree = new BlockTree();
        tree.beforeEach(() -> {
            throw new Exception("setup failed");
        });
        tree.afterEach(() -> calls.add("after"));
        tree.it("test", t -> calls.add("body"));
        Group root = tree.close();
        assertTrue(new BlockRunner(new EventDispatcher()).run(root));
        assertTrue(calls.isEmpty());
        assertEquals("setup failed", findTest(root, "test").getErrors().get(0).getMessage());
    }

    @Test
    void testExpectationFailuresDoNotStopBody() {
        List<String> calls = new ArrayList<>();
        BlockTree tree = new BlockTree();
        tree.afterEach(() -> calls.add("after"));
        tree.it("several", t -> {
            t.expect(1).toBe(2);
            t.expect("a").toEqual("b");
            calls.add("reached end");
        });
        Group root = tree.close();
        new BlockRunner(new EventDispatcher()).run(root);
        TestCase test = findTest(root, "several");
        assertEquals(2, test.getErrors().size());
        assertTrue(test.getErrors().get(1) instanceof ExpectationError);
        assertEquals(List.of("reached end", "after"), calls);
    }

    @Test
    void testSkippedNodesOnlyEmitSkipEvents() {
        List<String> calls = new ArrayList<>();
        BlockTree tree = new BlockTree();
        tree.beforeEach(() -> calls.add("before"));
        tree.skip().describe("off", () -> tree.it("inside", t -> calls.add("inside")));
        tree.skip().it("skipped", t -> calls.add("skipped"));
        tree.it("pending");
        tree.describe("no body");
        Group root = tree.close();
        boolean failed = new BlockRunner(recordingDispatcher()).run(root);
        assertFalse(failed);
        assertTrue(calls.isEmpty());
        assertEquals(List.of("skippingDescribe:off", "skippingTest:skipped", "skippingTest:pending",
                "skippingDescribe:no body"), events);
    }

    @Test
    void testDescribeStackExcludesRoot() {
        BlockTree tree = new BlockTree();
        tree.describe("a", () -> tree.describe("b", () -> tree.it("c", t -> {
        })));
        Group root = tree.close();
        new BlockRunner(new EventDispatcher()).run(root);
        TestCase test = findTest(root, "c");
        assertEquals(List.of("a", "b"), test.getDescribeStack().stream().map(Group::getName).toList());
        assertTrue(test.getStartTime() > 0);
        assertTrue(test.getEndTime() >= test.getStartTime());
    }

    @Test
    void testErrorsResetOnEveryRun() {
        int[] runs = {0};
        BlockTree tree = new BlockTree();
        tree.it("flaky", t -> t.expect(++runs[0]).toBe(2));
        Group root = tree.close();
        BlockRunner runner = new BlockRunner(new EventDispatcher());
        assertTrue(runner.run(root));
        assertFalse(runner.run(root));
        assertTrue(findTest(root, "flaky").getErrors().isEmpty());
    }

    @Test
    void testLogIsCapturedOnTest() {
        BlockTree tree = new BlockTree();
        tree.it("logs", t -> t.log("value is {}", 42));
        Group root = tree.close();
        new BlockRunner(new EventDispatcher()).run(root);
        assertEquals("value is 42\n", findTest(root, "logs").getLog());
    }

    @Test
    void testAsyncBodyCompletesNormally() {
        BlockTree tree = new BlockTree();
        tree.itAsync("async", t -> CompletableFuture.runAsync(() -> t.expect(true).toBeTrue()));
        tree.itAsync("async failure", t -> CompletableFuture.supplyAsync(() -> {
            throw new IllegalArgumentException("async boom");
        }));
        Group root = tree.close();
        new BlockRunner(new EventDispatcher()).run(root);
        assertFalse(findTest(root, "async").isFailed());
        assertEquals("async boom", findTest(root, "async failure").getErrors().get(0).getMessage());
    }

    @Test
    void testErrorFromBodyIsRecordedAndRunContinues() {
        BlockTree tree = new BlockTree();
        tree.it("overflows", t -> {
            throw new StackOverflowError("deep");
        });
        tree.itAsync("runs out of memory", t -> CompletableFuture.runAsync(() -> {
            throw new OutOfMemoryError("heap");
        }));
        tree.it("sibling", t -> t.expect(1).toBe(1));
        Group root = tree.close();
        assertTrue(new BlockRunner(recordingDispatcher()).run(root));

        assertEquals(List.of("finishedTest:overflows", "finishedTest:runs out of memory", "finishedTest:sibling"), events);
        assertInstanceOf(StackOverflowError.class, findTest(root, "overflows").getErrors().get(0));
        assertInstanceOf(OutOfMemoryError.class, findTest(root, "runs out of memory").getErrors().get(0));
        assertFalse(findTest(root, "sibling").isFailed());
    }

    @Test
    void testErrorFromHookIsRecorded() {
        BlockTree tree = new BlockTree();
        tree.describe("broken setup", () -> {
            tree.beforeEach(() -> {
                throw new NoClassDefFoundError("com/example/Missing");
            });
            tree.it("a", t -> {
            });
        });
        Group root = tree.close();
        assertTrue(new BlockRunner(new EventDispatcher()).run(root));
        assertEquals("com/example/Missing", findTest(root, "a").getErrors().get(0).getMessage());
    }

    @Test
    void testUnknownMatcherFailsTest() {
        BlockTree tree = new BlockTree();
        tree.it("typo", t -> t.expect(1).to("toBeOne"));
        Group root = tree.close();
        assertTrue(new BlockRunner(new EventDispatcher()).run(root));
        assertTrue(findTest(root, "typo").getErrors().get(0).getMessage().contains("toBeOne"));
    }

    @Test
    void testAnyFailed() {
        BlockTree tree = new BlockTree();
        tree.describe("a", () -> tree.it("b", t -> {
        }));
        Group root = tree.close();
        assertFalse(BlockRunner.anyFailed(root));
        findTest(root, "b").addError(new AssertionError("x"));
        assertTrue(BlockRunner.anyFailed(root));
    }

}
