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
package io.concise.output;

import io.concise.core.DescribeRunEvent;
import io.concise.core.Group;
import io.concise.core.RunEvent;
import io.concise.core.RunListener;
import io.concise.core.SuiteRunEvent;
import io.concise.core.TestCase;
import io.concise.core.TestRunEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Default console reporter.
 * <pre>
 * calc
 *   ✓ adds
 *   ✗ divides
 *
 * Failures:
 *
 * calc → divides
 * Expected 3 to be 2
 *
 * 1 tests passed, 1 tests failed.
 * </pre>
 */
public class ConsoleReporter implements RunListener {

    private final boolean showStackTraces;
    private final List<TestCase> failures = new ArrayList<>();
    private int successes;

    public ConsoleReporter() {
        this(false);
    }

    public ConsoleReporter(boolean showStackTraces) {
        this.showStackTraces = showStackTraces;
    }

    @Override
    public void onEvent(RunEvent event) {
        switch (event.getType()) {
            case BEGINNING_DESCRIBE -> {
                DescribeRunEvent e = (DescribeRunEvent) event;
                Console.println(indent(e.describeStack(), e.group().getName()));
            }
            case SKIPPING_DESCRIBE -> {
                DescribeRunEvent e = (DescribeRunEvent) event;
                Console.println(indent(e.describeStack(), Console.grey(e.group().getName() + " (skipped)")));
            }
            case SKIPPING_TEST -> {
                TestCase test = ((TestRunEvent) event).test();
                Console.println(indent(test.getDescribeStack(), Console.yellow("-") + " " + Console.grey(test.getName())));
            }
            case FINISHED_TEST -> finishedTest(((TestRunEvent) event).test());
            case FINISHED_TEST_RUN -> finishedTestRun((SuiteRunEvent) event);
        }
    }

    private void finishedTest(TestCase test) {
        if (test.isFailed()) {
            failures.add(test);
            Console.println(indent(test.getDescribeStack(), Console.fail("✗") + " " + test.getName()));
        } else {
            successes++;
            Console.println(indent(test.getDescribeStack(), Console.pass("✓") + " " + test.getName()));
        }
    }

    private void finishedTestRun(SuiteRunEvent event) {
        if (!failures.isEmpty()) {
            Console.printlnError();
            Console.printlnError("Failures:");
            Console.printlnError();
        }
        for (TestCase failure : failures) {
            printFailure(failure);
        }
        Console.println(Console.green(String.valueOf(successes)) + " tests passed, "
                + Console.red(String.valueOf(failures.size())) + " tests failed.");
        if (event.result() != null && event.result().getSeed() != null) {
            Console.println(Console.info("randomized with seed " + event.result().getSeed()));
        }
    }

    private void printFailure(TestCase failure) {
        Console.printlnError(fullTestDescription(failure));
        for (Throwable error : failure.getErrors()) {
            Console.printlnError(String.valueOf(error.getMessage()));
            if (showStackTraces) {
                for (StackTraceElement element : error.getStackTrace()) {
                    Console.printlnError(Console.grey("    at " + element));
                }
            }
        }
        Console.printlnError();
    }

    static String fullTestDescription(TestCase test) {
        StringBuilder sb = new StringBuilder();
        for (Group group : test.getDescribeStack()) {
            sb.append(Console.bold(group.getName())).append(" → ");
        }
        return sb.append(Console.bold(test.getName())).toString();
    }

    static String indent(List<Group> describeStack, String message) {
        return " ".repeat(describeStack.size() * 2) + message;
    }

    public int getSuccesses() {
        return successes;
    }

    public List<TestCase> getFailures() {
        return failures;
    }

}
