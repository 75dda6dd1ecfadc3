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

import io.concise.common.Json;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Project configuration loaded from concise-pom.json. The pom says how to run tests:
 * which test files, tags, ordering, timeouts and output settings.
 * <p>
 * Example concise-pom.json:
 * <pre>
 * {
 *   "tests": ["com.example.CalculatorTests", "com.example.ParserTests"],
 *   "tags": ["fast"],
 *   "randomize": true,
 *   "seed": 42,
 *   "timeout": 2000,
 *   "output": {
 *     "dir": "target/concise-reports",
 *     "jsonLines": true,
 *     "color": false,
 *     "logLevel": "debug"
 *   }
 * }
 * </pre>
 */
public class ConcisePom {

    public static final String DEFAULT_FILE = "concise-pom.json";

    private List<String> tests = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private boolean randomize;
    private Long seed;
    private Long timeout;
    private OutputPom output = new OutputPom();

    /**
     * Output configuration nested object.
     */
    public static class OutputPom {
        private String dir = "target/concise-reports";
        private boolean jsonLines;
        private boolean color = true;
        private String logLevel;  // trace, debug, info, warn, error

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public boolean isJsonLines() {
            return jsonLines;
        }

        public void setJsonLines(boolean jsonLines) {
            this.jsonLines = jsonLines;
        }

        public boolean isColor() {
            return color;
        }

        public void setColor(boolean color) {
            this.color = color;
        }

        public String getLogLevel() {
            return logLevel;
        }

        public void setLogLevel(String logLevel) {
            this.logLevel = logLevel;
        }
    }

    public static ConcisePom load(String configPath) {
        return load(Path.of(configPath));
    }

    /**
     * Load configuration from a JSON file.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static ConcisePom load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("failed to load config from: " + configPath, e);
        }
    }

    /**
     * Parse configuration from a JSON string.
     *
     * @throws RuntimeException if the JSON is invalid or not an object
     */
    public static ConcisePom parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("invalid config: expected JSON object");
        }
        ConcisePom config = new ConcisePom();
        j.<List<String>>getOptional("tests").ifPresent(config::setTests);
        j.<List<String>>getOptional("tags").ifPresent(config::setTags);
        j.<Boolean>getOptional("randomize").ifPresent(config::setRandomize);
        j.<Number>getOptional("seed").ifPresent(n -> config.setSeed(n.longValue()));
        j.<Number>getOptional("timeout").ifPresent(n -> config.setTimeout(n.longValue()));
        if (j.get("output") != null) {
            OutputPom output = config.getOutput();
            j.<String>getOptional("output.dir").ifPresent(output::setDir);
            j.<Boolean>getOptional("output.jsonLines").ifPresent(output::setJsonLines);
            j.<Boolean>getOptional("output.color").ifPresent(output::setColor);
            j.<String>getOptional("output.logLevel").ifPresent(output::setLogLevel);
        }
        return config;
    }

    /**
     * Apply the run settings of this configuration to a suite.
     * CLI options override pom values, so call this before applying CLI options.
     */
    public Suite applyTo(Suite suite) {
        if (!tags.isEmpty()) {
            suite.tags(tags);
        }
        suite.randomize(randomize);
        if (seed != null) {
            suite.seed(seed);
        }
        if (timeout != null) {
            suite.defaultTimeout(timeout);
        }
        return suite;
    }

    // ========== Getters and Setters ==========

    public List<String> getTests() {
        return tests;
    }

    public void setTests(List<String> tests) {
        this.tests = tests != null ? new ArrayList<>(tests) : new ArrayList<>();
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public boolean isRandomize() {
        return randomize;
    }

    public void setRandomize(boolean randomize) {
        this.randomize = randomize;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Long getTimeout() {
        return timeout;
    }

    public void setTimeout(Long timeout) {
        this.timeout = timeout;
    }

    public OutputPom getOutput() {
        return output;
    }

    public void setOutput(OutputPom output) {
        this.output = output != null ? output : new OutputPom();
    }

}
