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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed store of reusable group bodies. Registering a name twice replaces the
 * earlier body. Populated while test files load, only read afterwards.
 */
public class SharedExamples {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Map<String, GroupBody> bodies = new ConcurrentHashMap<>();

    public void register(String name, GroupBody body) {
        if (name == null || body == null) {
            throw new IllegalArgumentException("shared example needs a name and a body");
        }
        if (bodies.put(name, body) != null) {
            logger.debug("shared example re-registered, latest definition wins: {}", name);
        }
    }

    public GroupBody resolve(String name) {
        GroupBody body = bodies.get(name);
        if (body == null) {
            throw new SharedExampleNotFoundException(name);
        }
        return body;
    }

    public boolean contains(String name) {
        return bodies.containsKey(name);
    }

}
