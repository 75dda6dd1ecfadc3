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

import io.concise.output.LogContext;
import org.slf4j.Logger;

/**
 * Focus, then tags, then randomization, each producing a new tree from the previous one.
 */
public final class FilterPipeline {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private FilterPipeline() {
    }

    public static Group apply(Group root, RunOptions options) {
        Group filtered = FocusFilter.apply(root);
        if (filtered != root) {
            logger.debug("focused blocks found, unfocused blocks pruned");
        }
        filtered = TagFilter.apply(options.tags(), filtered);
        if (options.shouldRandomize()) {
            long seed = options.seed() != null ? options.seed() : System.nanoTime();
            logger.info("randomizing test order with seed: {}", seed);
            filtered = new Randomizer(seed).apply(filtered);
        }
        return filtered;
    }

}
