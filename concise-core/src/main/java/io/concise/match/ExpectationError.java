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

import java.util.Arrays;

/**
 * Failure raised by a matcher. The message is built from a template in which
 * {@code <actual>}, {@code <expected>} and {@code <source>} are replaced by the
 * corresponding values, prefixed with "Expected ".
 * <pre>
 * new ExpectationError("&lt;actual&gt; to be &lt;expected&gt;", 3, 2, null).getMessage()
 * // Expected 3 to be 2
 * </pre>
 */
public class ExpectationError extends AssertionError {

    public static final String ACTUAL = "<actual>";
    public static final String EXPECTED = "<expected>";
    public static final String SOURCE = "<source>";

    private final String template;
    private final transient Object actual;
    private final transient Object expected;
    private final transient Object source;

    public ExpectationError(String template, Object actual, Object expected, Object source) {
        super(render(template, actual, expected, source));
        this.template = template;
        this.actual = actual;
        this.expected = expected;
        this.source = source;
    }

    public static ExpectationError of(String template, Object actual) {
        return new ExpectationError(template, actual, null, null);
    }

    public static ExpectationError of(String template, Object actual, Object expected) {
        return new ExpectationError(template, actual, expected, null);
    }

    static String render(String template, Object actual, Object expected, Object source) {
        // single pass, so placeholders inside substituted values stay as they are
        StringBuilder sb = new StringBuilder("Expected ");
        int i = 0;
        while (i < template.length()) {
            if (template.startsWith(ACTUAL, i)) {
                sb.append(describe(actual));
                i += ACTUAL.length();
            } else if (template.startsWith(EXPECTED, i)) {
                sb.append(describe(expected));
                i += EXPECTED.length();
            } else if (template.startsWith(SOURCE, i)) {
                sb.append(describe(source));
                i += SOURCE.length();
            } else {
                sb.append(template.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof ThrowingRunnable) {
            return "code block";
        }
        if (value instanceof Object[] array) {
            return Arrays.deepToString(array);
        }
        if (value.getClass().isArray()) {
            return Arrays.deepToString(new Object[]{value}).replaceAll("^\\[|]$", "");
        }
        if (value instanceof CharSequence) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }

    public String getTemplate() {
        return template;
    }

    public Object getActual() {
        return actual;
    }

    public Object getExpected() {
        return expected;
    }

    public Object getSource() {
        return source;
    }

}
