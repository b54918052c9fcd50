package com.jsconformance.cli;

import com.jsconformance.TestRunListener;
import com.jsconformance.model.TestRun;

import java.io.PrintStream;

/**
 * Prints every run as it finishes, with the executor's output.
 */
class ConsoleRunListener implements TestRunListener {

    private final PrintStream out;
    private final boolean failOnly;

    ConsoleRunListener(PrintStream out, boolean failOnly) {
        this.out = out;
        this.failOnly = failOnly;
    }

    @Override
    public void onTestRun(TestRun run) {
        if (failOnly && run.outcome().isPassed()) {
            return;
        }
        synchronized (out) {
            out.println(run.outcome().symbol() + " " + run.file());
            if (run.hasOutput()) {
                out.println();
                out.println(run.output());
                out.println();
            }
        }
    }
}
