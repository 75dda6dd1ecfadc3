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
 * Group-level events (BEGINNING_DESCRIBE, SKIPPING_DESCRIBE). There is no event for the
 * end of a group.
 */
public record DescribeRunEvent(
        RunEventType type,
        List<Group> describeStack, // ancestors of group, root excluded
        Group group
) implements RunEvent {

    public static DescribeRunEvent beginning(List<Group> describeStack, Group group) {
        return new DescribeRunEvent(RunEventType.BEGINNING_DESCRIBE, describeStack, group);
    }

    public static DescribeRunEvent skipping(List<Group> describeStack, Group group) {
        return new DescribeRunEvent(RunEventType.SKIPPING_DESCRIBE, describeStack, group);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("t", type.getEventName());
        if (group != null) {
            map.put("name", group.getName());
        }
        if (describeStack != null) {
            List<String> names = new ArrayList<>(describeStack.size());
            for (Group g : describeStack) {
                names.add(g.getName());
            }
            map.put("describeStack", names);
        }
        return map;
    }

}
