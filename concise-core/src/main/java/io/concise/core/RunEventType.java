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

/**
 * Lifecycle events emitted by {@link BlockRunner} and {@link Suite}.
 */
public enum RunEventType {

    BEGINNING_DESCRIBE("beginningDescribe"),
    SKIPPING_DESCRIBE("skippingDescribe"),
    SKIPPING_TEST("skippingTest"),
    FINISHED_TEST("finishedTest"),
    FINISHED_TEST_RUN("finishedTestRun");

    private final String eventName;

    RunEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * The camel-case name used in serialized events.
     */
    public String getEventName() {
        return eventName;
    }

    public static RunEventType fromEventName(String name) {
        for (RunEventType type : values()) {
            if (type.eventName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown event name: " + name);
    }

}
