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

import io.concise.common.Json;
import io.concise.core.Globals;
import io.concise.core.RunEvent;
import io.concise.core.RunEventType;
import io.concise.core.RunListener;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RunListener} that streams run events to a JSON Lines (.jsonl) file.
 * <p>
 * JSON Lines format:
 * <pre>
 * {"t":"run","time":"2025-12-16T10:30:00Z","version":"0.1.0"}
 * {"t":"beginningDescribe","name":"calc","describeStack":[]}
 * {"t":"finishedTest","name":"adds","describeStack":["calc"],"failed":false,...}
 * {"t":"finishedTestRun","passed":1,"failed":0,"skipped":0,"durationMillis":12}
 * </pre>
 * The file is opened lazily on the first event and closed after the run event.
 */
public class JsonLinesReportListener implements RunListener {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String FILE_NAME = "concise-results.jsonl";

    private final Path outputDir;
    private final Path jsonlPath;
    private BufferedWriter writer;

    public JsonLinesReportListener(Path outputDir) {
        this.outputDir = outputDir;
        this.jsonlPath = outputDir.resolve(FILE_NAME);
    }

    public Path getPath() {
        return jsonlPath;
    }

    @Override
    public void onEvent(RunEvent event) {
        try {
            if (writer == null) {
                start();
            }
            writeLine(Json.stringifyStrict(event.toJson()));
            if (event.getType() == RunEventType.FINISHED_TEST_RUN) {
                writer.close();
                writer = null;
                logger.debug("JSON Lines report written: {}", jsonlPath);
            }
        } catch (IOException e) {
            logger.warn("failed to write JSON Lines report {}: {}", jsonlPath, e.getMessage());
        }
    }

    private void start() throws IOException {
        Files.createDirectories(outputDir);
        writer = Files.newBufferedWriter(jsonlPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("t", "run");
        header.put("time", DateTimeFormatter.ISO_INSTANT.format(Instant.now()));
        header.put("version", Globals.VERSION);
        writeLine(Json.stringifyStrict(header));
    }

    private void writeLine(String line) throws IOException {
        writer.write(line);
        writer.newLine();
        writer.flush();
    }

}
