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

import io.concise.match.Matchers;
import io.concise.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Depth-first, strictly sequential execution of a (filtered) block tree.
 * <p>
 * For each runnable test: every ancestor's befores run outermost first, then the body
 * (raced against a {@link TimeoutGuard} when it returns a pending result), then every
 * ancestor's afters, also outermost first. A hook or body that throws ends the sequence:
 * the error is recorded on the test and no afters run. Expectation failures are recorded
 * without ending the sequence.
 * <p>
 * Not re-entrant: one runner walks one tree at a time.
 */
public class BlockRunner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final EventDispatcher dispatcher;
    private final Matchers matchers;

    // root first, includes the root group
    private final List<Group> ancestors = new ArrayList<>();

    public BlockRunner(EventDispatcher dispatcher) {
        this(dispatcher, Matchers.defaults());
    }

    public BlockRunner(EventDispatcher dispatcher, Matchers matchers) {
        this.dispatcher = dispatcher;
        this.matchers = matchers;
    }

    /**
     * Run every child of {@code root}.
     *
     * @return true if any test in the tree failed
     */
    public boolean run(Group root) {
        ancestors.clear();
        ancestors.add(root);
        try {
            for (Block child : root.getChildren()) {
                runBlock(child);
            }
        } finally {
            ancestors.clear();
        }
        return anyFailed(root);
    }

    private void runBlock(Block block) {
        if (block instanceof TestCase test) {
            runTest(test);
        } else {
            runGroup((Group) block);
        }
    }

    private void runGroup(Group group) {
        if (group.isSkip()) {
            logger.debug("skipping describe: {}", group.getName());
            dispatcher.dispatch(DescribeRunEvent.skipping(describeStack(), group));
            return;
        }
        dispatcher.dispatch(DescribeRunEvent.beginning(describeStack(), group));
        ancestors.add(group);
        try {
            for (Block child : group.getChildren()) {
                runBlock(child);
            }
        } finally {
            ancestors.remove(ancestors.size() - 1);
        }
    }

    private void runTest(TestCase test) {
        test.prepare(describeStack());
        if (test.isSkip() || !test.hasBody()) {
            logger.debug("skipping test: {}", test.getFullName());
            dispatcher.dispatch(TestRunEvent.skipping(test));
            return;
        }
        logger.debug("running test: {}", test.getFullName());
        TestContext context = new TestContext(test, matchers);
        test.setStartTime(System.currentTimeMillis());
        try {
            invokeBefores();
            invokeBody(test, context);
            invokeAfters();
        } catch (Throwable t) {
            // any failure, Errors included, belongs to this test and never ends the run
            test.addError(t);
        } finally {
            context.close();
            test.setEndTime(System.currentTimeMillis());
        }
        if (test.isFailed()) {
            logger.debug("test failed: {} ({} errors)", test.getFullName(), test.getErrors().size());
        }
        dispatcher.dispatch(TestRunEvent.finished(test));
    }

    private void invokeBody(TestCase test, TestContext context) throws Exception {
        CompletionStage<?> pending = test.getBody().run(context);
        if (pending != null) {
            TimeoutGuard guard = TimeoutGuard.start(test.getTimeoutMillis());
            try {
                guard.race(pending);
            } catch (TestTimeoutException e) {
                logger.debug("test timed out after {}ms: {}", e.getTimeoutMillis(), test.getFullName());
                throw e;
            }
        }
    }

    private void invokeBefores() throws Exception {
        for (Group group : ancestors) {
            for (Hook hook : group.getBefores()) {
                hook.run();
            }
        }
    }

    private void invokeAfters() throws Exception {
        for (Group group : ancestors) {
            for (Hook hook : group.getAfters()) {
                hook.run();
            }
        }
    }

    private List<Group> describeStack() {
        return List.copyOf(ancestors.subList(1, ancestors.size()));
    }

    /**
     * True if any test below {@code block} (or {@code block} itself) has errors.
     * Groups carry no result of their own, so only leaves are checked.
     */
    public static boolean anyFailed(Block block) {
        if (block instanceof TestCase test) {
            return test.isFailed();
        }
        for (Block child : ((Group) block).getChildren()) {
            if (anyFailed(child)) {
                return true;
            }
        }
        return false;
    }

}
