package com.jsconformance.exec;

import com.jsconformance.model.TestFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkPartitionerTest {

    private static List<TestFile> files(int count) {
        Path root = Path.of("/corpus");
        List<TestFile> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(TestFile.of(root, root.resolve(String.format("test/dir%d/t%05d.js", i % 7, i))));
        }
        return files;
    }

    @Test
    void listCountIsBoundedByConcurrencyAndFiles() {
        assertEquals(1, WorkPartitioner.listCount(1, 1000));
        assertEquals(4, WorkPartitioner.listCount(2, 1000));
        assertEquals(9, WorkPartitioner.listCount(3, 1000));
        assertEquals(16, WorkPartitioner.listCount(4, 1000));
        assertEquals(32, WorkPartitioner.listCount(8, 1000));
        assertEquals(5, WorkPartitioner.listCount(8, 5));
        assertEquals(0, WorkPartitioner.listCount(8, 0));
        assertThrows(IllegalArgumentException.class, () -> WorkPartitioner.listCount(0, 10));
    }

    @Test
    void everyFileLandsInExactlyOneList() {
        List<TestFile> files = files(1003);
        List<List<TestFile>> lists = WorkPartitioner.partition(files, 8);

        assertEquals(32, lists.size());
        Set<TestFile> seen = new HashSet<>();
        int total = 0;
        for (List<TestFile> list : lists) {
            total += list.size();
            seen.addAll(list);
        }
        assertEquals(files.size(), total);
        assertEquals(new HashSet<>(files), seen);
    }

    @Test
    void listSizesDifferByAtMostOne() {
        List<List<TestFile>> lists = WorkPartitioner.partition(files(1003), 8);
        int min = Integer.MAX_VALUE;
        int max = 0;
        for (List<TestFile> list : lists) {
            min = Math.min(min, list.size());
            max = Math.max(max, list.size());
        }
        assertTrue(max - min <= 1, "sizes between " + min + " and " + max);
    }

    @Test
    void filesAreDealtRoundRobinInInputOrder() {
        List<TestFile> files = files(10);
        List<List<TestFile>> lists = WorkPartitioner.partition(files, 2);

        assertEquals(4, lists.size());
        assertEquals(List.of(files.get(0), files.get(4), files.get(8)), lists.get(0));
        assertEquals(List.of(files.get(3), files.get(7)), lists.get(3));
    }

    @Test
    void emptyCorpusHasNoLists() {
        assertTrue(WorkPartitioner.partition(List.of(), 4).isEmpty());
    }
}
