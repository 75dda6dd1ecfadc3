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

import io.concise.core.BlockTree;
import io.concise.core.Suite;
import io.concise.core.TestFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private boolean colors;

    @BeforeEach
    void captureConsole() {
        colors = Console.isColorsEnabled();
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        Console.setErrorOutput(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreConsole() {
        Console.setOutput(System.out);
        Console.setErrorOutput(System.err);
        Console.setColorsEnabled(colors);
    }

    private static final TestFile CALC = (BlockTree tree) -> tree.describe("calc", () -> {
        tree.it("adds", t -> t.expect(1 + 1).toBe(2));
        tree.describe("division", () -> tree.it("divides", t -> t.expect(6 / 2).toBe(2)));
        tree.it("later");
    });

    @Test
    void testReport() {
        ConsoleReporter reporter = new ConsoleReporter();
        Suite.of(CALC).reporter(reporter).run();

        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains("calc\n"));
        assertTrue(stdout.contains("  ✓ adds\n"));
        assertTrue(stdout.contains("  division\n"));
        assertTrue(stdout.contains("    ✗ divides\n"));
        assertTrue(stdout.contains("  - later\n"));
        assertTrue(stdout.contains("1 tests passed, 1 tests failed."));

        String stderr = err.toString(StandardCharsets.UTF_8);
        assertTrue(stderr.contains("Failures:"));
        assertTrue(stderr.contains("calc → division → divides\nExpected 3 to be 2\n"));

        assertEquals(1, reporter.getSuccesses());
        assertEquals(1, reporter.getFailures().size());
    }

    @Test
    void testNoFailuresSection() {
        TestFile passing = tree -> tree.it("ok", t -> {
        });
        Suite.of(passing).reporter(new ConsoleReporter()).run();
        assertFalse(err.toString(StandardCharsets.UTF_8).contains("Failures:"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("1 tests passed, 0 tests failed."));
    }

    @Test
    void testColoredOutput() {
        Console.setColorsEnabled(true);
        TestFile passing = tree -> tree.it("ok", t -> {
        });
        Suite.of(passing).reporter(new ConsoleReporter()).run();
        String stdout = out.toString(StandardCharsets.UTF_8);
        assertTrue(stdout.contains(Console.GREEN + "✓" + Console.RESET));
        assertEquals("✓ ok", Console.stripAnsi(Console.pass("✓") + " ok"));
    }

}
