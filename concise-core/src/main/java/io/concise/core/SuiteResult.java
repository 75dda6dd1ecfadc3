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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a run over a filtered tree.
 */
public class SuiteResult {

    private final Group root;
    private long startTime;
    private long endTime;
    private Long seed;

    public SuiteResult(Group root) {
        this.root = root;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    void setSeed(Long seed) {
        this.seed = seed;
    }

    /**
     * The filtered tree that was executed.
     */
    public Group getRoot() {
        return root;
    }

    public boolean isFailed() {
        return BlockRunner.anyFailed(root);
    }

    public boolean isPassed() {
        return !isFailed();
    }

    public List<TestCase> getFailures() {
        List<TestCase> list = new ArrayList<>();
        for (TestCase test : root.getTests()) {
            if (test.isFailed()) {
                list.add(test);
            }
        }
        return list;
    }

    public int getFailedCount() {
        return getFailures().size();
    }

    /**
     * Tests that ran without errors.
     */
    public int getPassedCount() {
        int count = 0;
        for (TestCase test : root.getTests()) {
            if (test.getStartTime() > 0 && !test.isFailed()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Tests that did not run: skipped themselves, bodiless, or inside a skipped group.
     */
    public int getSkippedCount() {
        int count = 0;
        for (TestCase test : root.getTests()) {
            if (test.getStartTime() == 0) {
                count++;
            }
        }
        return count;
    }

    public int getTestCount() {
        return root.getTests().size();
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
     * Seed used to shuffle the run, null if the run was not randomized.
     */
    public Long getSeed() {
        return seed;
    }

    public Map<String, Object> toSummaryJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("passed", getPassedCount());
        map.put("failed", getFailedCount());
        map.put("skipped", getSkippedCount());
        map.put("durationMillis", getDurationMillis());
        if (seed != null) {
            map.put("seed", seed);
        }
        return map;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = toSummaryJson();
        map.put("root", root.toJson());
        return map;
    }

}
