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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConcisePomTest {

    @Test
    void testParseFull() {
        ConcisePom pom = ConcisePom.parse("""
                {
                  "tests": ["com.example.CalcTests"],
                  "tags": ["fast", "db"],
                  "randomize": true,
                  "seed": 42,
                  "timeout": 2000,
                  "output": {
                    "dir": "build/reports",
                    "jsonLines": true,
                    "color": false,
                    "logLevel": "debug"
                  }
                }
                """);
        assertEquals(List.of("com.example.CalcTests"), pom.getTests());
        assertEquals(List.of("fast", "db"), pom.getTags());
        assertTrue(pom.isRandomize());
        assertEquals(42L, pom.getSeed());
        assertEquals(2000L, pom.getTimeout());
        assertEquals("build/reports", pom.getOutput().getDir());
        assertTrue(pom.getOutput().isJsonLines());
        assertFalse(pom.getOutput().isColor());
        assertEquals("debug", pom.getOutput().getLogLevel());
    }

    @Test
    void testDefaults() {
        ConcisePom pom = ConcisePom.parse("{}");
        assertTrue(pom.getTests().isEmpty());
        assertTrue(pom.getTags().isEmpty());
        assertFalse(pom.isRandomize());
        assertNull(pom.getSeed());
        assertNull(pom.getTimeout());
        assertEquals("target/concise-reports", pom.getOutput().getDir());
        assertFalse(pom.getOutput().isJsonLines());
        assertTrue(pom.getOutput().isColor());
    }

    @Test
    void testInvalidJson() {
        assertThrows(RuntimeException.class, () -> ConcisePom.parse("[1, 2]"));
        assertThrows(RuntimeException.class, () -> ConcisePom.parse(""));
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve(ConcisePom.DEFAULT_FILE);
        Files.writeString(file, "{\"tags\": [\"fast\"]}");
        assertEquals(List.of("fast"), ConcisePom.load(file).getTags());
        RuntimeException e = assertThrows(RuntimeException.class, () -> ConcisePom.load(dir.resolve("missing.json")));
        assertTrue(e.getMessage().contains("missing.json"));
    }

    @Test
    void testApplyTo() {
        ConcisePom pom = ConcisePom.parse("{\"tags\": [\"fast\"], \"randomize\": true, \"seed\": 5, \"timeout\": 300}");
        Suite suite = pom.applyTo(Suite.of(new SampleTestFiles.Passing()));
        RunOptions options = suite.getOptions();
        assertEquals(List.of("fast"), options.tags());
        assertTrue(options.shouldRandomize());
        assertEquals(5L, options.seed());
        for (TestCase test : suite.load().getTests()) {
            assertEquals(300, test.getConfiguredTimeoutMillis());
        }
    }

}
