package com.jsconformance.exec;

import com.jsconformance.model.TestFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the sorted file list into work-lists, one per worker task.
 */
public final class WorkPartitioner {

    private WorkPartitioner() {
    }

    /**
     * Number of work-lists for {@code fileCount} files at the given concurrency:
     * {@code min(4 * concurrency, concurrency^2, fileCount)}, at least one for a non-empty corpus.
     */
    public static int listCount(int concurrency, int fileCount) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (fileCount == 0) {
            return 0;
        }
        long squared = (long) concurrency * concurrency;
        long bound = Math.min(4L * concurrency, squared);
        return (int) Math.max(1, Math.min(bound, fileCount));
    }

    /**
     * Distributes files round-robin so list lengths differ by at most one and files of
     * one directory are spread over all workers. Order within a list follows the input.
     */
    public static List<List<TestFile>> partition(List<TestFile> files, int concurrency) {
        int count = listCount(concurrency, files.size());
        List<List<TestFile>> lists = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            lists.add(new ArrayList<>(files.size() / count + 1));
        }
        for (int i = 0; i < files.size(); i++) {
            lists.get(i % count).add(files.get(i));
        }
        List<List<TestFile>> result = new ArrayList<>(count);
        for (List<TestFile> list : lists) {
            result.add(List.copyOf(list));
        }
        return result;
    }
}
