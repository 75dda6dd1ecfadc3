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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log collector for one test execution. Text logged by a test body goes into this
 * buffer (later attached to the test for reports) and cascades to the
 * {@link #TEST_LOGGER} category.
 */
public class LogContext {

    // ========== Category Loggers ==========

    /** Logger for the framework itself (tree construction, filters, engine, suite, config) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("concise.runtime");

    /** Logger for text logged by test bodies */
    public static final Logger TEST_LOGGER = LoggerFactory.getLogger("concise.test");

    /** Logger for console output (test summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("concise.console");

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Set the level of the parent {@code concise} logger at runtime.
     * Logback is only a runtime dependency, so it is reached through reflection.
     *
     * @param level trace, debug, info, warn or error
     * @return true if the level was set, false if Logback is not the active binding
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported: not using Logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "concise");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Log a message with {@code {}} placeholders.
     */
    public synchronized void log(String format, Object... args) {
        String message = format(format, args);
        buffer.append(message).append('\n');
        TEST_LOGGER.info(message);
    }

    /**
     * Get accumulated log and clear the buffer.
     */
    public synchronized String collect() {
        String result = buffer.toString();
        buffer.setLength(0);
        return result;
    }

    static String format(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            if (i < format.length() - 1 && format.charAt(i) == '{' && format.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    sb.append(args[argIndex++]);
                } else {
                    sb.append("{}");
                }
                i += 2;
            } else {
                sb.append(format.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

}
