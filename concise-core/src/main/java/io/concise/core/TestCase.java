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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An "it" node. The declaration (name, body, flags, configured timeout) is fixed at
 * construction; the execution state (errors, describe stack, log, timings) belongs to the
 * most recent run and is reset by {@link BlockRunner} each time the test executes.
 */
public class TestCase implements Block {

    public static final long DEFAULT_TIMEOUT_MILLIS = 5000;

    private final String name;
    private final AsyncTestBody body;
    private final boolean skip;
    private final boolean focus;
    private final Set<String> tags;
    private final long configuredTimeoutMillis;

    // bodies may record failures from other threads
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private volatile long timeoutMillis;
    private List<Group> describeStack = Collections.emptyList();
    private String log = "";
    private long startTime;
    private long endTime;

    TestCase(String name, AsyncTestBody body, boolean skip, boolean focus, Set<String> tags, long timeoutMillis) {
        this.name = name;
        this.body = body;
        this.skip = skip;
        this.focus = focus;
        this.tags = tags;
        this.configuredTimeoutMillis = timeoutMillis;
        this.timeoutMillis = timeoutMillis;
    }

    void prepare(List<Group> stack) {
        errors.clear();
        timeoutMillis = configuredTimeoutMillis;
        describeStack = List.copyOf(stack);
        log = "";
        startTime = 0;
        endTime = 0;
    }

    void addError(Throwable error) {
        errors.add(error);
    }

    void setTimeoutMillis(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + millis);
        }
        this.timeoutMillis = millis;
    }

    void setLog(String log) {
        this.log = log;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    @Override
    public String getName() {
        return name;
    }

    public AsyncTestBody getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public boolean isSkip() {
        return skip;
    }

    @Override
    public boolean isFocus() {
        return focus;
    }

    @Override
    public Set<String> getTags() {
        return tags;
    }

    public long getConfiguredTimeoutMillis() {
        return configuredTimeoutMillis;
    }

    /**
     * Timeout in effect for the current (or last) execution, including any
     * {@link TestContext#timesOutAfter(long)} override.
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isFailed() {
        return !errors.isEmpty();
    }

    /**
     * Ancestor groups (outermost first, root excluded) captured when the test last started.
     */
    public List<Group> getDescribeStack() {
        return describeStack;
    }

    public String getLog() {
        return log;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    /**
     * Names of the describe stack and this test joined with arrows, e.g. {@code calc → adds}.
     */
    public String getFullName() {
        StringBuilder sb = new StringBuilder();
        for (Group group : describeStack) {
            sb.append(group.getName()).append(" → ");
        }
        return sb.append(name).toString();
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("skip", skip || body == null);
        map.put("focus", focus);
        if (!tags.isEmpty()) {
            map.put("tags", new ArrayList<>(tags));
        }
        List<String> path = new ArrayList<>(describeStack.size());
        for (Group group : describeStack) {
            path.add(group.getName());
        }
        map.put("describeStack", path);
        map.put("timeoutMillis", timeoutMillis);
        map.put("failed", isFailed());
        if (isFailed()) {
            List<String> messages = new ArrayList<>(errors.size());
            for (Throwable error : errors) {
                messages.add(String.valueOf(error.getMessage()));
            }
            map.put("errors", messages);
        }
        if (startTime > 0) {
            map.put("durationMillis", getDurationMillis());
        }
        if (!log.isEmpty()) {
            map.put("log", log);
        }
        return map;
    }

    @Override
    public String toString() {
        return "TestCase{" + name + (skip ? ", skip" : "") + (focus ? ", focus" : "") + '}';
    }

}
