package com.jsconformance.cli;

import com.jsconformance.model.TestOutcome;
import com.jsconformance.report.ResultNode;
import com.jsconformance.report.ResultTree;

import java.io.PrintStream;
import java.util.Map;

/**
 * Prints a result tree, one line per directory:
 * {@code path   passed/count  (pct%) [ symbol n ... ]}.
 *
 * A directory's children are only listed when at least one test below it passed.
 */
public final class TreeReportPrinter {

    private static final int PATH_WIDTH = 80;

    private TreeReportPrinter() {
    }

    public static void print(ResultTree tree, boolean summaryOnly, PrintStream out) {
        for (Map.Entry<String, ResultNode> root : tree.roots().entrySet()) {
            print(root.getValue(), root.getKey(), summaryOnly, out);
        }
    }

    private static void print(ResultNode node, String path, boolean summaryOnly, PrintStream out) {
        out.println(formatLine(path, node));
        if (summaryOnly || node.passed() == 0) {
            return;
        }
        for (Map.Entry<String, ResultNode> child : node.children().entrySet()) {
            print(child.getValue(), path + "/" + child.getKey(), false, out);
        }
    }

    static String formatLine(String path, ResultNode node) {
        StringBuilder results = new StringBuilder("[ ");
        for (TestOutcome outcome : TestOutcome.values()) {
            int value = node.result(outcome);
            if (value > 0) {
                results.append(outcome.symbol()).append(' ').append(String.format("%-5d", value)).append(' ');
            }
        }
        results.append(']');
        return String.format("%-" + PATH_WIDTH + "s%5d/%-5d (%6.2f%%) %s ",
            path, node.passed(), node.count(), node.passRate(), results);
    }
}
