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

import io.concise.match.Expectation;
import io.concise.match.ExpectationError;
import io.concise.match.ExpectationSink;
import io.concise.match.Matchers;
import io.concise.match.ThrowingRunnable;
import io.concise.output.LogContext;
import org.slf4j.Logger;

import java.util.List;

/**
 * Handle passed to a running test body. Expectations created through it record their
 * failures on this test and no other; once the test has finished the context is closed
 * and anything recorded later (for example by a body that lost its timeout race) is
 * discarded.
 */
public class TestContext implements ExpectationSink {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestCase test;
    private final Matchers matchers;
    private final LogContext logContext = new LogContext();
    private volatile boolean closed;

    TestContext(TestCase test, Matchers matchers) {
        this.test = test;
        this.matchers = matchers;
    }

    public Expectation expect(Object actual) {
        return new Expectation(actual, matchers, this);
    }

    public Expectation expect(ThrowingRunnable source) {
        return new Expectation(source, matchers, this);
    }

    /**
     * Change the timeout of this execution. Takes effect when the body returns a pending
     * result, so call it before returning.
     */
    public void timesOutAfter(long millis) {
        if (closed) {
            throw new IllegalStateException("timesOutAfter called after test finished: " + test.getName());
        }
        test.setTimeoutMillis(millis);
    }

    /**
     * The value supplied to the nearest enclosing {@code behavesLike} group.
     *
     * @throws IllegalStateException if the test is not inside a shared example
     */
    @SuppressWarnings("unchecked")
    public <T> T sharedContext() {
        List<Group> stack = test.getDescribeStack();
        for (int i = stack.size() - 1; i >= 0; i--) {
            Group group = stack.get(i);
            if (group.isSharedExample()) {
                return (T) group.getSharedContext().get();
            }
        }
        throw new IllegalStateException("not inside a shared example: " + test.getFullName());
    }

    /**
     * Log text against this test, {@code {}} placeholders are replaced by the arguments.
     */
    public void log(String format, Object... args) {
        logContext.log(format, args);
    }

    public TestCase getTest() {
        return test;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void addFailure(ExpectationError error) {
        if (closed) {
            logger.debug("discarding failure recorded after '{}' finished: {}", test.getFullName(), error.getMessage());
            return;
        }
        test.addError(error);
    }

    void close() {
        closed = true;
        test.setLog(logContext.collect());
    }

}
