package com.jsconformance.report;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Folds test runs from all workers into the {@link ResultTree}, the optional per-file
 * map and the live totals.
 *
 * Tree and totals are updated under one lock, held for a single walk from the corpus
 * root to the file's directory, so a snapshot never disagrees with the tree by more
 * than the record being applied.
 */
public class ResultAggregator {

    private final Object lock = new Object();
    private final ResultTree tree;
    private final int total;
    private final EnumMap<TestOutcome, Integer> totals = new EnumMap<>(TestOutcome.class);
    private final Map<String, TestOutcome> perFile;
    private int completed;

    /**
     * @param files          the complete corpus of the run
     * @param trackPerFile   also keep an outcome per relative path
     */
    public ResultAggregator(List<TestFile> files, boolean trackPerFile) {
        this.tree = ResultTree.build(files);
        this.total = files.size();
        this.perFile = trackPerFile ? new ConcurrentHashMap<>() : null;
        for (TestOutcome outcome : TestOutcome.values()) {
            totals.put(outcome, 0);
        }
    }

    /**
     * Records one file-level run. Must be called exactly once per file.
     */
    public void record(TestRun run) {
        Objects.requireNonNull(run, "run");
        synchronized (lock) {
            tree.increment(run.file(), run.outcome());
            totals.merge(run.outcome(), 1, Integer::sum);
            completed++;
        }
        if (perFile != null) {
            perFile.put(run.file().relativePath(), run.outcome());
        }
    }

    public ProgressSnapshot snapshot() {
        synchronized (lock) {
            return new ProgressSnapshot(total, completed, totals);
        }
    }

    /**
     * The tree. Read it once the run is over, or hold no expectation of consistency.
     */
    public ResultTree tree() {
        return tree;
    }

    public boolean tracksPerFile() {
        return perFile != null;
    }

    /**
     * @return outcome per relative path, sorted by path; empty if per-file tracking is off
     */
    public Map<String, TestOutcome> perFileResults() {
        return perFile == null ? Map.of() : new TreeMap<>(perFile);
    }
}
