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
package io.concise.match;

/**
 * An actual value bound to the sink of the test that created it.
 * <p>
 * Every matcher call dispatches by name through {@link #to(String, Object...)}. A mismatch
 * is handed to the sink and the caller carries on, so several failed expectations in one
 * test body are all recorded. Any other exception raised by the matcher propagates.
 */
public class Expectation {

    private final Object actual;
    private final Matchers matchers;
    private final ExpectationSink sink;

    public Expectation(Object actual, Matchers matchers, ExpectationSink sink) {
        this.actual = actual;
        this.matchers = matchers;
        this.sink = sink;
    }

    /**
     * Apply the matcher registered under {@code matcherName}.
     *
     * @throws UnknownMatcherException if no matcher has that name
     */
    public void to(String matcherName, Object... args) {
        Matcher matcher = matchers.get(matcherName);
        try {
            matcher.match(actual, args);
        } catch (ExpectationError e) {
            sink.addFailure(e);
        }
    }

    public void toBe(Object expected) {
        to(Matchers.TO_BE, expected);
    }

    public void toEqual(Object expected) {
        to(Matchers.TO_EQUAL, expected);
    }

    public void toBeDefined() {
        to(Matchers.TO_BE_DEFINED);
    }

    public void toBeNull() {
        to(Matchers.TO_BE_NULL);
    }

    public void toBeTrue() {
        to(Matchers.TO_BE_TRUE);
    }

    public void toBeFalse() {
        to(Matchers.TO_BE_FALSE);
    }

    public void toThrow() {
        to(Matchers.TO_THROW);
    }

    /**
     * @param expected a message, an exception carrying the expected message, or an exception class
     */
    public void toThrow(Object expected) {
        to(Matchers.TO_THROW, expected);
    }

    public void toHaveLength(int expected) {
        to(Matchers.TO_HAVE_LENGTH, expected);
    }

    public void toContain(Object expected) {
        to(Matchers.TO_CONTAIN, expected);
    }

    public Object getActual() {
        return actual;
    }

}
