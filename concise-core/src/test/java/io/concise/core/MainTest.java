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
import io.concise.output.JsonLinesReportListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void captureConsole() {
        Console.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        Console.setErrorOutput(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreConsole() {
        Console.setOutput(System.out);
        Console.setErrorOutput(System.err);
        Console.setColorsEnabled(false);
    }

    private static String passing() {
        return SampleTestFiles.Passing.class.getName();
    }

    private static String failing() {
        return SampleTestFiles.Failing.class.getName();
    }

    @Test
    void testPassingExitCode() {
        assertEquals(Main.EXIT_PASSED, Main.execute("--no-pom", "--no-color", passing()));
        String output = out.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("✓ adds"));
        assertTrue(output.contains("2 tests passed, 0 tests failed."));
    }

    @Test
    void testFailingExitCode() {
        assertEquals(Main.EXIT_FAILED, Main.execute("--no-pom", "--no-color", passing(), failing()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("calc → divides"));
    }

    @Test
    void testTagsOverrideFailure() {
        assertEquals(Main.EXIT_PASSED, Main.execute("--no-pom", "--no-color", "-t", "fast", passing(), failing()));
    }

    @Test
    void testUnknownClassExitCode() {
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", "com.example.DoesNotExist"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("class not found"));
    }

    @Test
    void testNotATestFileExitCode() {
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", SampleTestFiles.NotATestFile.class.getName()));
    }

    @Test
    void testLoadFailureExitCode() {
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", SampleTestFiles.MissingSharedExample.class.getName()));
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", SampleTestFiles.Throwing.class.getName()));
    }

    @Test
    void testLinkageErrorWhileLoadingExitCode() {
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", SampleTestFiles.MissingDependency.class.getName()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("com/example/Missing"));
    }

    @Test
    void testNonPositiveTimeoutExitCode(@TempDir Path dir) throws Exception {
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("--no-pom", "--timeout", "0", passing()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("timeout must be positive"));
        Path pom = dir.resolve("concise-pom.json");
        Files.writeString(pom, "{\"tests\": [\"" + passing() + "\"], \"timeout\": -5}");
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("-p", pom.toString()));
    }

    @Test
    void testServiceLoaderDiscovery() {
        assertEquals(Main.EXIT_PASSED, Main.execute("--no-pom", "--no-color"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("2 tests passed"));
    }

    @Test
    void testPomFile(@TempDir Path dir) throws Exception {
        Path pom = dir.resolve("concise-pom.json");
        Files.writeString(pom, "{\"tests\": [\"" + failing() + "\"], \"output\": {\"color\": false}}");
        assertEquals(Main.EXIT_FAILED, Main.execute("-p", pom.toString()));
        assertEquals(Main.EXIT_LOAD_ERROR, Main.execute("-p", dir.resolve("missing.json").toString()));
    }

    @Test
    void testJsonLinesOutput(@TempDir Path dir) throws Exception {
        int code = Main.execute("--no-pom", "--no-color", "--jsonl", "-o", dir.toString(), passing());
        assertEquals(Main.EXIT_PASSED, code);
        List<String> lines = Files.readAllLines(dir.resolve(JsonLinesReportListener.FILE_NAME));
        assertTrue(lines.get(0).contains("\"t\":\"run\""));
        assertTrue(lines.get(lines.size() - 1).contains("\"t\":\"finishedTestRun\""));
    }

    @Test
    void testParseOptions() {
        Main main = Main.parse("-t", "fast,db", "-r", "--seed", "7", "-o", "out", "a.B");
        assertEquals(List.of("fast", "db"), main.getTags());
        assertTrue(main.isRandomize());
        assertEquals(7L, main.getSeed());
        assertEquals("out", main.getOutputDir());
        assertEquals(List.of("a.B"), main.getTestClasses());
    }

}
