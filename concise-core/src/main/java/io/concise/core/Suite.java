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

import io.concise.match.Matchers;
import io.concise.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Top-level entry point of a run: loads test files into a fresh {@link BlockTree}, filters
 * the tree, executes it and reports through an {@link EventDispatcher}.
 * <p>
 * Example usage:
 * <pre>
 * SuiteResult result = Suite.of(new CalculatorTests(), new ParserTests())
 *     .tags("fast")
 *     .randomize(true)
 *     .reporter(new ConsoleReporter())
 *     .run();
 * </pre>
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<TestFile> testFiles = new ArrayList<>();

    // Configuration
    private List<String> tags;
    private boolean randomize;
    private Long seed;
    private long defaultTimeoutMillis = TestCase.DEFAULT_TIMEOUT_MILLIS;
    private EventDispatcher dispatcher = new EventDispatcher();
    private Matchers matchers = Matchers.defaults();

    // Results
    private SuiteResult result;

    private Suite() {
    }

    public static Suite of(TestFile... files) {
        return of(Arrays.asList(files));
    }

    public static Suite of(List<? extends TestFile> files) {
        Suite suite = new Suite();
        suite.testFiles.addAll(files);
        return suite;
    }

    // ========== Configuration (Builder Pattern) ==========

    public Suite tags(String... values) {
        return tags(Arrays.asList(values));
    }

    public Suite tags(List<String> values) {
        this.tags = values == null ? null : new ArrayList<>(values);
        return this;
    }

    public Suite randomize(boolean randomize) {
        this.randomize = randomize;
        return this;
    }

    public Suite seed(Long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * @throws IllegalArgumentException if {@code millis} is not positive
     */
    public Suite defaultTimeout(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + millis);
        }
        this.defaultTimeoutMillis = millis;
        return this;
    }

    public Suite dispatcher(EventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    public Suite matchers(Matchers matchers) {
        this.matchers = matchers;
        return this;
    }

    public Suite listener(RunEventType type, RunListener listener) {
        dispatcher.listen(type, listener);
        return this;
    }

    /**
     * Register a listener for every event type.
     */
    public Suite reporter(RunListener listener) {
        dispatcher.listenAll(listener);
        return this;
    }

    public EventDispatcher getDispatcher() {
        return dispatcher;
    }

    public RunOptions getOptions() {
        return new RunOptions(tags, randomize, seed);
    }

    public SuiteResult getResult() {
        return result;
    }

    // ========== Execution ==========

    /**
     * Load every test file, in order, into a new tree and close it.
     *
     * @throws TestFileLoadException if any file fails to declare its blocks; no test has run
     */
    public Group load() {
        BlockTree tree = new BlockTree().defaultTimeout(defaultTimeoutMillis);
        for (TestFile file : testFiles) {
            logger.debug("loading test file: {}", file.getName());
            try {
                file.load(tree);
            } catch (TestFileLoadException e) {
                throw e;
            } catch (Throwable t) {
                // linkage and initializer errors are load failures too
                logger.error("test file failed to load: {} - {}", file.getName(), t.getMessage());
                throw new TestFileLoadException(file.getName(), t);
            }
        }
        return tree.close();
    }

    public SuiteResult run() {
        Group root = load();
        result = execute(root, getOptions());
        return result;
    }

    /**
     * Filter and run an already built tree.
     *
     * @return true if any test failed
     */
    public boolean runParsedBlocks(Group root, RunOptions options) {
        result = execute(root, options);
        return result.isFailed();
    }

    private SuiteResult execute(Group root, RunOptions options) {
        Long usedSeed = null;
        if (options.shouldRandomize()) {
            usedSeed = options.seed() != null ? options.seed() : System.nanoTime();
            options = new RunOptions(options.tags(), true, usedSeed);
        }
        Group filtered = FilterPipeline.apply(root, options);
        SuiteResult suiteResult = new SuiteResult(filtered);
        suiteResult.setSeed(usedSeed);
        suiteResult.setStartTime(System.currentTimeMillis());
        try {
            new BlockRunner(dispatcher, matchers).run(filtered);
        } finally {
            suiteResult.setEndTime(System.currentTimeMillis());
        }
        logger.debug("run complete: {} passed, {} failed, {} skipped",
                suiteResult.getPassedCount(), suiteResult.getFailedCount(), suiteResult.getSkippedCount());
        dispatcher.dispatch(SuiteRunEvent.finished(suiteResult));
        return suiteResult;
    }

}
