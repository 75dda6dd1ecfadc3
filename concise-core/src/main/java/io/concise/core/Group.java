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
import java.util.Set;
import java.util.function.Supplier;

/**
 * A "describe" node. Immutable once built by {@link BlockTree}; the filters derive new
 * groups through {@link #withChildren(List)} instead of changing this one.
 */
public class Group implements Block {

    private final String name;
    private final boolean skip;
    private final boolean focus;
    private final Set<String> tags;
    private final Supplier<?> sharedContext;
    private final List<Hook> befores;
    private final List<Hook> afters;
    private final List<Block> children;

    Group(String name, boolean skip, boolean focus, Set<String> tags, Supplier<?> sharedContext,
          List<Hook> befores, List<Hook> afters, List<Block> children) {
        this.name = name;
        this.skip = skip;
        this.focus = focus;
        this.tags = tags;
        this.sharedContext = sharedContext;
        this.befores = List.copyOf(befores);
        this.afters = List.copyOf(afters);
        this.children = List.copyOf(children);
    }

    /**
     * Same group (name, flags, hooks) with a different child list.
     */
    public Group withChildren(List<Block> newChildren) {
        return new Group(name, skip, focus, tags, sharedContext, befores, afters, newChildren);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isSkip() {
        return skip;
    }

    @Override
    public boolean isFocus() {
        return focus;
    }

    @Override
    public Set<String> getTags() {
        return tags;
    }

    /**
     * The context supplier given to {@code behavesLike}, null for ordinary groups.
     */
    public Supplier<?> getSharedContext() {
        return sharedContext;
    }

    public boolean isSharedExample() {
        return sharedContext != null;
    }

    public List<Hook> getBefores() {
        return befores;
    }

    public List<Hook> getAfters() {
        return afters;
    }

    public List<Block> getChildren() {
        return children;
    }

    /**
     * All tests in this subtree, depth-first in child order.
     */
    public List<TestCase> getTests() {
        List<TestCase> list = new ArrayList<>();
        collectTests(this, list);
        return list;
    }

    private static void collectTests(Group group, List<TestCase> list) {
        for (Block child : group.children) {
            if (child instanceof TestCase test) {
                list.add(test);
            } else {
                collectTests((Group) child, list);
            }
        }
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("skip", skip);
        map.put("focus", focus);
        if (!tags.isEmpty()) {
            map.put("tags", new ArrayList<>(tags));
        }
        List<Map<String, Object>> list = new ArrayList<>(children.size());
        for (Block child : children) {
            list.add(child.toJson());
        }
        map.put("children", list);
        return map;
    }

    @Override
    public String toString() {
        return "Group{" + name + (skip ? ", skip" : "") + (focus ? ", focus" : "") + ", children=" + children.size() + '}';
    }

}
