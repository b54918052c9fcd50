package com.jsconformance.exec;

import com.jsconformance.model.ExecutorRecord;
import com.jsconformance.model.TestFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Typed decoder over the executor's framed output. Each record must echo the path
 * submitted at the same position; anything else is a protocol violation.
 */
final class BatchRecordStream {

    record MatchedRecord(int index, TestFile file, ExecutorRecord record) {
    }

    private final FrameReader frames;
    private final List<TestFile> expected;
    private final RecordDecoder decoder;
    private final StringBuilder trailing = new StringBuilder();
    private int matched;
    private boolean finished;
    private boolean stoppedByResult;

    BatchRecordStream(InputStream in, List<TestFile> expected, RecordDecoder decoder) {
        this.frames = new FrameReader(in);
        this.expected = List.copyOf(expected);
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * @return the next matched record, or {@code null} once the executor has nothing
     *         more to report for this invocation
     * @throws ProtocolViolationException if a record does not belong at its position
     */
    MatchedRecord next() throws IOException {
        while (!finished) {
            String chunk = frames.next();
            if (chunk == null) {
                finished = true;
                break;
            }
            Frame frame = Frame.of(chunk);
            switch (frame.type()) {
                case BLANK:
                    continue;
                case TRAILING:
                    trailing.append(frame.payload());
                    finished = true;
                    break;
                case RESULT:
                    return match(frame.payload());
                default:
                    throw new IllegalStateException("Unhandled frame " + frame.type());
            }
        }
        return null;
    }

    private MatchedRecord match(String json) {
        ExecutorRecord record;
        try {
            record = decoder.decode(json);
        } catch (IllegalArgumentException e) {
            throw new ProtocolViolationException("Undecodable result record: " + e.getMessage(), e);
        }
        if (matched >= expected.size()) {
            throw new ProtocolViolationException(
                "Result for " + record.test() + " after all " + expected.size() + " submitted tests were reported");
        }
        TestFile file = expected.get(matched);
        if (!sameTest(record.test(), file)) {
            throw new ProtocolViolationException(
                "Result out of order at position " + matched + ": expected " + file.path() + " but got " + record.test());
        }
        MatchedRecord result = new MatchedRecord(matched, file, record);
        matched++;
        if (record.kind().isStopping()) {
            stoppedByResult = true;
            finished = true;
        }
        return result;
    }

    private static boolean sameTest(String echoed, TestFile file) {
        if (echoed.equals(file.path().toString())) {
            return true;
        }
        try {
            return Path.of(echoed).toAbsolutePath().normalize().equals(file.path());
        } catch (InvalidPathException e) {
            return false;
        }
    }

    int matchedCount() {
        return matched;
    }

    TestFile lastMatched() {
        return matched == 0 ? null : expected.get(matched - 1);
    }

    boolean stoppedByResult() {
        return stoppedByResult;
    }

    String trailingText() {
        return trailing.toString();
    }
}
