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

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registry of matchers keyed by name. {@link #defaults()} returns a registry holding the
 * built-in matchers; more can be added with {@link #register(String, Matcher)}.
 * Looking up a name that was never registered fails with {@link UnknownMatcherException}.
 */
public class Matchers {

    public static final String TO_BE = "toBe";
    public static final String TO_EQUAL = "toEqual";
    public static final String TO_BE_DEFINED = "toBeDefined";
    public static final String TO_BE_NULL = "toBeNull";
    public static final String TO_BE_TRUE = "toBeTrue";
    public static final String TO_BE_FALSE = "toBeFalse";
    public static final String TO_THROW = "toThrow";
    public static final String TO_HAVE_LENGTH = "toHaveLength";
    public static final String TO_CONTAIN = "toContain";

    private final Map<String, Matcher> matchers = new LinkedHashMap<>();

    public static Matchers defaults() {
        Matchers m = new Matchers();
        m.register(TO_BE, Matchers::toBe);
        m.register(TO_EQUAL, Matchers::toEqual);
        m.register(TO_BE_DEFINED, Matchers::toBeDefined);
        m.register(TO_BE_NULL, Matchers::toBeNull);
        m.register(TO_BE_TRUE, (actual, args) -> toBeBoolean(actual, true, args));
        m.register(TO_BE_FALSE, (actual, args) -> toBeBoolean(actual, false, args));
        m.register(TO_THROW, Matchers::toThrow);
        m.register(TO_HAVE_LENGTH, Matchers::toHaveLength);
        m.register(TO_CONTAIN, Matchers::toContain);
        return m;
    }

    public Matchers register(String name, Matcher matcher) {
        matchers.put(name, matcher);
        return this;
    }

    public Matcher get(String name) {
        Matcher matcher = matchers.get(name);
        if (matcher == null) {
            throw new UnknownMatcherException(name);
        }
        return matcher;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(matchers.keySet());
    }

    // ========== built-in matchers ==========

    /**
     * Same value for numbers, strings, booleans, characters and enums; same instance otherwise.
     */
    static void toBe(Object actual, Object... args) {
        Object expected = arg(TO_BE, args);
        if (!sameValue(actual, expected)) {
            throw ExpectationError.of("<actual> to be <expected>", actual, expected);
        }
    }

    static void toEqual(Object actual, Object... args) {
        Object expected = arg(TO_EQUAL, args);
        if (!Objects.deepEquals(actual, expected)) {
            throw ExpectationError.of("<actual> to equal <expected>", actual, expected);
        }
    }

    static void toBeDefined(Object actual, Object... args) {
        noArgs(TO_BE_DEFINED, args);
        if (actual == null) {
            throw ExpectationError.of("<actual> to be defined", null);
        }
    }

    static void toBeNull(Object actual, Object... args) {
        noArgs(TO_BE_NULL, args);
        if (actual != null) {
            throw ExpectationError.of("<actual> to be null", actual);
        }
    }

    static void toBeBoolean(Object actual, boolean expected, Object... args) {
        noArgs(expected ? TO_BE_TRUE : TO_BE_FALSE, args);
        if (!Boolean.valueOf(expected).equals(actual)) {
            throw ExpectationError.of("<actual> to be <expected>", actual, expected);
        }
    }

    /**
     * The actual value must be a {@link ThrowingRunnable}. The optional argument is an
     * expected message (a {@link String}), an exception whose message must match, or an
     * exception class the thrown exception must be an instance of.
     */
    static void toThrow(Object source, Object... args) {
        if (!(source instanceof ThrowingRunnable runnable)) {
            throw new IllegalArgumentException("toThrow expects a code block, got: " + source);
        }
        if (args.length > 1) {
            throw new IllegalArgumentException("toThrow takes at most one argument");
        }
        Throwable thrown = null;
        try {
            runnable.run();
        } catch (Throwable t) {
            thrown = t;
        }
        if (thrown == null) {
            throw new ExpectationError("<source> to throw exception but it did not", null, null, source);
        }
        Object expected = args.length == 0 ? null : args[0];
        if (expected == null) {
            return;
        }
        if (expected instanceof Class<?> type) {
            if (!type.isInstance(thrown)) {
                throw new ExpectationError("<source> to throw <expected> but it threw <actual>",
                        thrown.getClass().getName(), type.getName(), source);
            }
            return;
        }
        String expectedMessage = expected instanceof Throwable t ? t.getMessage() : String.valueOf(expected);
        if (!Objects.equals(expectedMessage, thrown.getMessage())) {
            throw new ExpectationError("<source> to throw an exception, but the thrown error message did not match the expected message.\n"
                    + "  Expected exception message: <expected>\n"
                    + "    Actual exception message: <actual>\n",
                    thrown.getMessage(), expectedMessage, source);
        }
    }

    static void toHaveLength(Object actual, Object... args) {
        Object expected = arg(TO_HAVE_LENGTH, args);
        if (!(expected instanceof Number number)) {
            throw new IllegalArgumentException("toHaveLength expects a number, got: " + expected);
        }
        int length = lengthOf(actual);
        if (length != number.intValue()) {
            throw ExpectationError.of("value to have length <expected> but it was <actual>", length, number.intValue());
        }
    }

    static void toContain(Object actual, Object... args) {
        Object expected = arg(TO_CONTAIN, args);
        boolean found;
        if (actual instanceof CharSequence cs) {
            found = expected != null && cs.toString().contains(String.valueOf(expected));
        } else if (actual instanceof Collection<?> collection) {
            found = collection.contains(expected);
        } else if (actual != null && actual.getClass().isArray()) {
            found = false;
            int length = Array.getLength(actual);
            for (int i = 0; i < length && !found; i++) {
                found = Objects.equals(Array.get(actual, i), expected);
            }
        } else {
            throw new IllegalArgumentException("toContain expects a string, collection or array, got: " + actual);
        }
        if (!found) {
            throw ExpectationError.of("<actual> to contain <expected>", actual, expected);
        }
    }

    // ========== helpers ==========

    private static Object arg(String name, Object... args) {
        if (args == null || args.length != 1) {
            throw new IllegalArgumentException(name + " takes exactly one argument");
        }
        return args[0];
    }

    private static void noArgs(String name, Object... args) {
        if (args != null && args.length > 0) {
            throw new IllegalArgumentException(name + " takes no arguments");
        }
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (actual == expected) {
            return true;
        }
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number && expected instanceof Number) {
            if (actual.getClass() == expected.getClass()) {
                return actual.equals(expected);
            }
            return ((Number) actual).doubleValue() == ((Number) expected).doubleValue();
        }
        if (actual instanceof CharSequence && expected instanceof CharSequence) {
            return actual.toString().equals(expected.toString());
        }
        if (actual instanceof Boolean || actual instanceof Character || actual instanceof Enum) {
            return actual.equals(expected);
        }
        return false;
    }

    private static int lengthOf(Object value) {
        if (value instanceof CharSequence cs) {
            return cs.length();
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new IllegalArgumentException("value has no length: " + value);
    }

}
