package com.jsconformance.cli;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import com.jsconformance.report.ResultAggregator;
import com.jsconformance.report.ResultNode;
import com.jsconformance.report.ResultTree;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeReportPrinterTest {

    private static final Path ROOT = Path.of("/corpus");

    private static ResultTree tree() {
        TestFile a = TestFile.of(ROOT, ROOT.resolve("test/language/a.js"));
        TestFile b = TestFile.of(ROOT, ROOT.resolve("test/language/expr/b.js"));
        TestFile c = TestFile.of(ROOT, ROOT.resolve("test/intl/sub/c.js"));
        ResultAggregator aggregator = new ResultAggregator(List.of(a, b, c), false);
        aggregator.record(TestRun.of(a, TestOutcome.PASSED));
        aggregator.record(TestRun.of(b, TestOutcome.FAILED));
        aggregator.record(TestRun.of(c, TestOutcome.SKIPPED));
        return aggregator.tree();
    }

    private static List<String> print(boolean summaryOnly) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        TreeReportPrinter.print(tree(), summaryOnly, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void testLineLayout() {
        ResultNode language = tree().node(List.of("test", "language"));

        String line = TreeReportPrinter.formatLine("test/language", language);

        assertTrue(line.startsWith(String.format("%-80s", "test/language")), line);
        assertTrue(line.contains("    1/2     ( 50.00%)"), line);
        assertTrue(line.contains("[ " + TestOutcome.PASSED.symbol() + " 1     "), line);
        assertTrue(line.contains(TestOutcome.FAILED.symbol() + " 1     "), line);
        assertFalse(line.contains(TestOutcome.SKIPPED.symbol()), line);
    }

    @Test
    void testChildrenOnlyBelowPassingDirectories() {
        List<String> lines = print(false);

        assertEquals(4, lines.size(), String.join("\n", lines));
        assertTrue(lines.get(0).startsWith("test "));
        assertTrue(lines.get(1).startsWith("test/intl "));
        assertTrue(lines.get(2).startsWith("test/language "));
        // test/intl has no passing test, so test/intl/sub is not listed
        assertTrue(lines.get(3).startsWith("test/language/expr "), lines.get(3));
    }

    @Test
    void testSummaryOnlyPrintsRoots() {
        List<String> lines = print(true);

        assertEquals(1, lines.size());
        assertTrue(lines.get(0).startsWith("test "));
    }
}
