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

import io.concise.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Declarative construction API for the block tree.
 * <p>
 * Each {@code describe} opens a group builder, makes it the current construction context,
 * runs the body synchronously and then appends the finished {@link Group} to the enclosing
 * group. {@code it} appends a {@link TestCase} to the current group. A root group always
 * exists, so there is always a current group until {@link #close()} hands the tree over
 * for execution.
 * <p>
 * Example:
 * <pre>
 * tree.describe("calc", () -&gt; {
 *     tree.beforeEach(calc::clear);
 *     tree.it("adds", t -&gt; t.expect(calc.add(1, 1)).toBe(2));
 *     tree.only().it("subtracts", t -&gt; t.expect(calc.subtract(3, 1)).toBe(2));
 * });
 * </pre>
 */
public class BlockTree {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String ROOT_NAME = "root";

    private final SharedExamples sharedExamples;
    private final Deque<GroupBuilder> stack = new ArrayDeque<>();
    private long defaultTimeoutMillis = TestCase.DEFAULT_TIMEOUT_MILLIS;
    private Group root;

    public BlockTree() {
        this(new SharedExamples());
    }

    public BlockTree(SharedExamples sharedExamples) {
        this.sharedExamples = sharedExamples;
        stack.push(new GroupBuilder(ROOT_NAME, false, false, Set.of(), null));
    }

    /**
     * Timeout applied to tests declared from now on that do not set their own.
     */
    public BlockTree defaultTimeout(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + millis);
        }
        this.defaultTimeoutMillis = millis;
        return this;
    }

    public SharedExamples getSharedExamples() {
        return sharedExamples;
    }

    // ========== describe ==========

    public void describe(String name, GroupBody body) {
        parseDescribe(name, body, BlockOptions.NONE, null);
    }

    public void describe(String name, BlockOptions options, GroupBody body) {
        parseDescribe(name, body, options, null);
    }

    /**
     * A group with no body: recorded as skipped, nothing inside it is declared.
     */
    public void describe(String name) {
        parseDescribe(name, null, BlockOptions.NONE, null);
    }

    // ========== it ==========

    public void it(String name, TestBody body) {
        parseIt(name, AsyncTestBody.of(body), BlockOptions.NONE);
    }

    public void it(String name, BlockOptions options, TestBody body) {
        parseIt(name, AsyncTestBody.of(body), options);
    }

    /**
     * A test with no body, reported as skipped.
     */
    public void it(String name) {
        parseIt(name, null, BlockOptions.NONE);
    }

    public void itAsync(String name, AsyncTestBody body) {
        parseIt(name, body, BlockOptions.NONE);
    }

    public void itAsync(String name, BlockOptions options, AsyncTestBody body) {
        parseIt(name, body, options);
    }

    // ========== hooks ==========

    public void beforeEach(Hook hook) {
        current("beforeEach").befores.add(hook);
    }

    public void afterEach(Hook hook) {
        current("afterEach").afters.add(hook);
    }

    // ========== variants ==========

    /**
     * Variant whose blocks are focused: only focused blocks (and their ancestors) run.
     */
    public Variant only() {
        return new Variant(BlockOptions.focused());
    }

    /**
     * Variant whose blocks are skipped.
     */
    public Variant skip() {
        return new Variant(BlockOptions.skipped());
    }

    // ========== shared examples ==========

    public void sharedExample(String name, GroupBody body) {
        ensureOpen("sharedExample");
        sharedExamples.register(name, body);
    }

    public void behavesLike(String name) {
        behavesLike(name, () -> null);
    }

    /**
     * Declare a group named {@code name} whose body is the registered shared example of the
     * same name. Tests inside can read {@code sharedContext} through
     * {@link TestContext#sharedContext()}.
     *
     * @throws SharedExampleNotFoundException if no such shared example is registered
     */
    public void behavesLike(String name, Supplier<?> sharedContext) {
        ensureOpen("behavesLike");
        GroupBody body = sharedExamples.resolve(name);
        parseDescribe(name, body, BlockOptions.NONE, sharedContext);
    }

    // ========== lifecycle ==========

    public boolean isClosed() {
        return root != null;
    }

    /**
     * Finish construction and return the root group. Calling it again returns the same root.
     *
     * @throws IllegalStateException if called from inside a describe body
     */
    public Group close() {
        if (root != null) {
            return root;
        }
        if (stack.size() != 1) {
            throw new IllegalStateException("cannot close tree while describe '" + stack.peek().name + "' is open");
        }
        root = stack.pop().build();
        logger.debug("block tree closed: {} top-level blocks, {} tests", root.getChildren().size(), root.getTests().size());
        return root;
    }

    // ========== internals ==========

    private void parseDescribe(String name, GroupBody body, BlockOptions options, Supplier<?> sharedContext) {
        GroupBuilder parent = current("describe");
        boolean skip = body == null || options.isSkip();
        GroupBuilder builder = new GroupBuilder(name, skip, options.isFocus(), options.getTags(), sharedContext);
        stack.push(builder);
        try {
            if (body != null) {
                body.define();
            }
        } finally {
            stack.pop();
        }
        parent.children.add(builder.build());
    }

    private void parseIt(String name, AsyncTestBody body, BlockOptions options) {
        GroupBuilder parent = current("it");
        Long timeout = options.getTimeoutMillis();
        TestCase test = new TestCase(name, body, options.isSkip(), options.isFocus(), options.getTags(),
                timeout == null ? defaultTimeoutMillis : timeout);
        parent.children.add(test);
    }

    private GroupBuilder current(String operation) {
        ensureOpen(operation);
        return stack.peek();
    }

    private void ensureOpen(String operation) {
        if (root != null) {
            throw new IllegalStateException(operation + " called outside of test loading, the tree is already closed");
        }
    }

    /**
     * Mutable state of a group while its body runs, discarded once the group is built.
     */
    private static class GroupBuilder {

        final String name;
        final boolean skip;
        final boolean focus;
        final Set<String> tags;
        final Supplier<?> sharedContext;
        final List<Hook> befores = new ArrayList<>();
        final List<Hook> afters = new ArrayList<>();
        final List<Block> children = new ArrayList<>();

        GroupBuilder(String name, boolean skip, boolean focus, Set<String> tags, Supplier<?> sharedContext) {
            this.name = name;
            this.skip = skip;
            this.focus = focus;
            this.tags = tags;
            this.sharedContext = sharedContext;
        }

        Group build() {
            return new Group(name, skip, focus, tags, sharedContext, befores, afters, children);
        }

    }

    /**
     * {@code describe} and {@code it} with extension options bound. Extension options win
     * over conflicting user options.
     */
    public final class Variant {

        private final BlockOptions extension;

        private Variant(BlockOptions extension) {
            this.extension = extension;
        }

        public void describe(String name, GroupBody body) {
            parseDescribe(name, body, extension, null);
        }

        public void describe(String name, BlockOptions options, GroupBody body) {
            parseDescribe(name, body, options.merge(extension), null);
        }

        public void describe(String name) {
            parseDescribe(name, null, extension, null);
        }

        public void it(String name, TestBody body) {
            parseIt(name, AsyncTestBody.of(body), extension);
        }

        public void it(String name, BlockOptions options, TestBody body) {
            parseIt(name, AsyncTestBody.of(body), options.merge(extension));
        }

        public void it(String name) {
            parseIt(name, null, extension);
        }

        public void itAsync(String name, AsyncTestBody body) {
            parseIt(name, body, extension);
        }

        public void itAsync(String name, BlockOptions options, AsyncTestBody body) {
            parseIt(name, body, options.merge(extension));
        }

    }

}
