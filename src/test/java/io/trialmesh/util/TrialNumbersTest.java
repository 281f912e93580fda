package io.trialmesh.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class TrialNumbersTest {

    @Test
    void parsesListsAndRanges() {
        Assertions.assertEquals(List.of(4, 7, 9, 10, 11, 12), TrialNumbers.parse("7,4, 9-12,10"));
        Assertions.assertEquals(List.of(), TrialNumbers.parse(" "));
        Assertions.assertEquals(List.of(0, 1, 2), TrialNumbers.parse("", 3));
    }

    @Test
    void rejectsMalformedOrOutOfRangeSelections() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("5-2"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("a"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("-1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("1,3", 3));
    }

    @Test
    void rangeEndingPastTheTrialCountIsRejectedBeforeExpansion() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("0-2147483647", 10));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("5-2147483647", 10));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TrialNumbers.parse("2147483647"));
        Assertions.assertEquals(List.of(8, 9), TrialNumbers.parse("8-9", 10));
    }
}
