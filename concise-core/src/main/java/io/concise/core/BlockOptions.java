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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options accepted by {@code describe} and {@code it}. Unset fields are {@code null} so
 * that two option sets can be merged: see {@link #merge(BlockOptions)}.
 * <p>
 * Example:
 * <pre>
 * tree.it("uploads", BlockOptions.tags("slow", "io").withTimeout(10000), t -> { ... });
 * </pre>
 */
public final class BlockOptions {

    public static final BlockOptions NONE = new BlockOptions(null, null, null, null);

    private final Boolean focus;
    private final Boolean skip;
    private final Set<String> tags;
    private final Long timeoutMillis;

    private BlockOptions(Boolean focus, Boolean skip, Set<String> tags, Long timeoutMillis) {
        this.focus = focus;
        this.skip = skip;
        this.tags = tags;
        this.timeoutMillis = timeoutMillis;
    }

    public static BlockOptions focused() {
        return NONE.withFocus(true);
    }

    public static BlockOptions skipped() {
        return NONE.withSkip(true);
    }

    public static BlockOptions tags(String... tags) {
        return NONE.withTags(tags);
    }

    public static BlockOptions timeout(long millis) {
        return NONE.withTimeout(millis);
    }

    public BlockOptions withFocus(boolean value) {
        return new BlockOptions(value, skip, tags, timeoutMillis);
    }

    public BlockOptions withSkip(boolean value) {
        return new BlockOptions(focus, value, tags, timeoutMillis);
    }

    public BlockOptions withTags(String... values) {
        return withTags(Arrays.asList(values));
    }

    public BlockOptions withTags(Collection<String> values) {
        Set<String> set = new LinkedHashSet<>(values);
        return new BlockOptions(focus, skip, Collections.unmodifiableSet(set), timeoutMillis);
    }

    public BlockOptions withTimeout(long millis) {
        if (millis <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + millis);
        }
        return new BlockOptions(focus, skip, tags, millis);
    }

    /**
     * Merge extension options on top of these (user) options.
     * Any field set on the extension wins over the same field set here.
     */
    public BlockOptions merge(BlockOptions extension) {
        if (extension == null || extension == NONE) {
            return this;
        }
        return new BlockOptions(
                extension.focus != null ? extension.focus : focus,
                extension.skip != null ? extension.skip : skip,
                extension.tags != null ? extension.tags : tags,
                extension.timeoutMillis != null ? extension.timeoutMillis : timeoutMillis);
    }

    public boolean isFocus() {
        return focus != null && focus;
    }

    public boolean isSkip() {
        return skip != null && skip;
    }

    public Set<String> getTags() {
        return tags == null ? Collections.emptySet() : tags;
    }

    /**
     * @return the timeout, or null when not set
     */
    public Long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String toString() {
        return "BlockOptions{focus=" + focus + ", skip=" + skip + ", tags=" + tags + ", timeoutMillis=" + timeoutMillis + '}';
    }

}
