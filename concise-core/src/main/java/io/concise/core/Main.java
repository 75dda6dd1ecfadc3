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

import io.concise.output.Console;
import io.concise.output.ConsoleReporter;
import io.concise.output.JsonLinesReportListener;
import io.concise.output.LogContext;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command-line interface for running concise test files.
 * <p>
 * Usage examples:
 * <pre>
 * # Run test files by class name
 * java -jar concise.jar com.example.CalculatorTests com.example.ParserTests
 *
 * # Run only tests tagged 'fast', in random order
 * java -jar concise.jar -t fast -r com.example.CalculatorTests
 *
 * # No class names: use concise-pom.json, or every TestFile registered with ServiceLoader
 * java -jar concise.jar
 * </pre>
 * Exit codes: 0 when every test passed, 1 when a test failed, 2 when a test file could
 * not be found or loaded.
 */
@Command(
        name = "concise",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Run concise test files"
)
public class Main implements Callable<Integer> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_LOAD_ERROR = 2;

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"concise " + Globals.VERSION};
        }
    }

    @Parameters(
            description = "Fully qualified class names of TestFile implementations",
            arity = "0..*"
    )
    List<String> testClasses;

    @Option(
            names = {"-t", "--tags"},
            split = ",",
            description = "Only run tests (or describes) carrying one of these tags"
    )
    List<String> tags;

    @Option(
            names = {"-r", "--randomize"},
            description = "Shuffle the children of every describe"
    )
    boolean randomize;

    @Option(
            names = {"--seed"},
            description = "Seed for --randomize, for a reproducible order"
    )
    Long seed;

    @Option(
            names = {"--timeout"},
            description = "Default per-test timeout in milliseconds (default: 5000)"
    )
    Long timeout;

    @Option(
            names = {"-o", "--output"},
            description = "Output directory for reports (default: target/concise-reports)"
    )
    String outputDir;

    @Option(
            names = {"--jsonl"},
            description = "Write a JSON Lines report to the output directory"
    )
    boolean jsonLines;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"-p", "--pom"},
            description = "Project file (default: concise-pom.json if present)"
    )
    String pomFile;

    @Option(
            names = {"--no-pom"},
            description = "Ignore concise-pom.json"
    )
    boolean noPom;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        ConcisePom pom;
        try {
            pom = loadPom();
        } catch (Exception e) {
            Console.printlnError(Console.fail("Error: " + e.getMessage()));
            return EXIT_LOAD_ERROR;
        }
        if (noColor || !pom.getOutput().isColor()) {
            Console.setColorsEnabled(false);
        }
        if (pom.getOutput().getLogLevel() != null) {
            LogContext.setRuntimeLogLevel(pom.getOutput().getLogLevel());
        }
        List<TestFile> files;
        try {
            files = resolveTestFiles(pom);
        } catch (TestFileLoadException e) {
            Console.printlnError(Console.fail("Error: " + e.getMessage()));
            return EXIT_LOAD_ERROR;
        }
        if (files.isEmpty()) {
            Console.println(Console.yellow("No test files found."));
            Console.println("Usage: concise [options] <TestFile class names...>");
            Console.println("Run 'concise --help' for more information.");
            return EXIT_PASSED;
        }
        Suite suite;
        try {
            suite = configure(pom, files);
        } catch (IllegalArgumentException e) {
            Console.printlnError(Console.fail("Error: " + e.getMessage()));
            return EXIT_LOAD_ERROR;
        }
        suite.reporter(new ConsoleReporter());
        if (jsonLines || pom.getOutput().isJsonLines()) {
            String dir = outputDir != null ? outputDir : pom.getOutput().getDir();
            suite.reporter(new JsonLinesReportListener(Path.of(dir)));
        }
        try {
            SuiteResult result = suite.run();
            return result.isFailed() ? EXIT_FAILED : EXIT_PASSED;
        } catch (TestFileLoadException e) {
            Console.printlnError(Console.fail("Error: " + e.getMessage()));
            return EXIT_LOAD_ERROR;
        }
    }

    // pom values first, CLI options override them
    private Suite configure(ConcisePom pom, List<TestFile> files) {
        Suite suite = pom.applyTo(Suite.of(files));
        if (tags != null && !tags.isEmpty()) {
            suite.tags(tags);
        }
        if (randomize) {
            suite.randomize(true);
        }
        if (seed != null) {
            suite.seed(seed);
        }
        if (timeout != null) {
            suite.defaultTimeout(timeout);
        }
        return suite;
    }

    private ConcisePom loadPom() {
        if (noPom) {
            return new ConcisePom();
        }
        if (pomFile != null) {
            return ConcisePom.load(pomFile);
        }
        Path defaultPom = Path.of(ConcisePom.DEFAULT_FILE);
        if (Files.exists(defaultPom)) {
            logger.debug("using project file: {}", defaultPom.toAbsolutePath());
            return ConcisePom.load(defaultPom);
        }
        return new ConcisePom();
    }

    private List<TestFile> resolveTestFiles(ConcisePom pom) {
        List<String> names = testClasses != null && !testClasses.isEmpty() ? testClasses : pom.getTests();
        if (!names.isEmpty()) {
            List<TestFile> files = new ArrayList<>(names.size());
            for (String name : names) {
                files.add(instantiate(name));
            }
            return files;
        }
        List<TestFile> files = new ArrayList<>();
        try {
            for (TestFile file : ServiceLoader.load(TestFile.class)) {
                files.add(file);
            }
        } catch (ServiceConfigurationError e) {
            throw new TestFileLoadException(TestFile.class.getName(), e);
        }
        logger.debug("discovered {} test files through ServiceLoader", files.size());
        return files;
    }

    static TestFile instantiate(String className) {
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new TestFileLoadException(className, "class not found");
        } catch (LinkageError e) {
            throw new TestFileLoadException(className, e);
        }
        if (!TestFile.class.isAssignableFrom(type)) {
            throw new TestFileLoadException(className, "does not implement " + TestFile.class.getName());
        }
        try {
            return (TestFile) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new TestFileLoadException(className, e);
        }
    }

    // ========== Getters for programmatic access ==========

    public List<String> getTestClasses() {
        return testClasses;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isRandomize() {
        return randomize;
    }

    public Long getSeed() {
        return seed;
    }

    public String getOutputDir() {
        return outputDir;
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

}
