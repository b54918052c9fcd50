package com.jsconformance;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestRun;

import java.util.List;

/**
 * Receives runs as workers produce them. Called from worker threads, possibly concurrently.
 */
public interface TestRunListener {

    TestRunListener NONE = run -> { };

    default void onRunStarted(List<TestFile> files, int workLists) {
    }

    void onTestRun(TestRun run);
}
