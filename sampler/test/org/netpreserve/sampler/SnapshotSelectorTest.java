package org.netpreserve.sampler;

import org.junit.jupiter.api.Test;
import org.netpreserve.sampler.config.Frequency;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotSelectorTest {
    private static final List<SnapshotRef> REFS = List.of(
            new SnapshotRef("20240320120000", "C"),
            new SnapshotRef("20240110120000", "A"),
            new SnapshotRef("20240102080000", "A"),
            new SnapshotRef("20240215120000", "B"),
            new SnapshotRef("20240215060000", "B"),
            new SnapshotRef("20231231235959", "Z"),
            new SnapshotRef("20240401000000", "Y"));

    @Test
    public void testMonthlyPicksEarliestInEachMonth() {
        var selected = SnapshotSelector.select(REFS, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31),
                Frequency.MONTHLY);
        assertEquals(List.of("2024-01", "2024-02", "2024-03"), selected.stream().map(SelectedSnapshot::bucket).toList());
        assertEquals(List.of("20240102080000", "20240215060000", "20240320120000"),
                selected.stream().map(SelectedSnapshot::timestamp).toList());
    }

    @Test
    public void testDailyAndAnnually() {
        var daily = SnapshotSelector.select(REFS, LocalDate.of(2024, 2, 15), LocalDate.of(2024, 2, 15),
                Frequency.DAILY);
        assertEquals(1, daily.size());
        assertEquals("2024-02-15", daily.get(0).bucket());
        assertEquals("20240215060000", daily.get(0).timestamp());

        var annually = SnapshotSelector.select(REFS, LocalDate.of(2023, 1, 1), LocalDate.of(2024, 12, 31),
                Frequency.ANNUALLY);
        assertEquals(List.of("2023", "2024"), annually.stream().map(SelectedSnapshot::bucket).toList());
        assertEquals("20240102080000", annually.get(1).timestamp());
    }

    @Test
    public void testResultsStayWithinRangeAndAreOrdered() {
        LocalDate start = LocalDate.of(2024, 1, 5);
        LocalDate end = LocalDate.of(2024, 3, 1);
        var selected = SnapshotSelector.select(REFS, start, end, Frequency.DAILY);
        for (int i = 0; i < selected.size(); i++) {
            LocalDate date = selected.get(i).date();
            assertFalse(date.isBefore(start));
            assertFalse(date.isAfter(end));
            if (i > 0) assertTrue(selected.get(i - 1).timestamp().compareTo(selected.get(i).timestamp()) < 0);
        }
        assertEquals(2, selected.size());
    }

    @Test
    public void testEmptyInputAndInvalidRange() {
        assertTrue(SnapshotSelector.select(List.of(), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31),
                Frequency.MONTHLY).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> SnapshotSelector.select(REFS,
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), Frequency.MONTHLY));
    }
}
