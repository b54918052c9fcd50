package com.jsconformance.report;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Directory-keyed outcome counts for a corpus.
 *
 * The node set is derived from the complete file list up front, so recording a run
 * never changes the tree's shape. Files directly in the corpus root have no node.
 */
public final class ResultTree {

    private final Map<String, ResultNode> roots = new TreeMap<>();

    private ResultTree() {
    }

    public static ResultTree build(List<TestFile> files) {
        ResultTree tree = new ResultTree();
        for (TestFile file : files) {
            Map<String, ResultNode> level = tree.roots;
            for (String segment : file.directorySegments()) {
                ResultNode node = level.computeIfAbsent(segment, key -> new ResultNode());
                node.addTest();
                level = node.childMap();
            }
        }
        return tree;
    }

    public Map<String, ResultNode> roots() {
        return Collections.unmodifiableMap(roots);
    }

    public ResultNode node(List<String> segments) {
        Map<String, ResultNode> level = roots;
        ResultNode node = null;
        for (String segment : segments) {
            node = level.get(segment);
            if (node == null) {
                return null;
            }
            level = node.childMap();
        }
        return node;
    }

    /**
     * Increments {@code outcome} at every directory above {@code file}.
     * Callers serialise access; see {@link ResultAggregator}.
     */
    void increment(TestFile file, TestOutcome outcome) {
        List<ResultNode> path = new ArrayList<>();
        Map<String, ResultNode> level = roots;
        for (String segment : file.directorySegments()) {
            ResultNode node = level.get(segment);
            if (node == null) {
                throw new IllegalArgumentException(file + " was not part of the corpus the tree was built from");
            }
            path.add(node);
            level = node.childMap();
        }
        for (ResultNode node : path) {
            node.increment(outcome);
        }
    }
}
