package com.netcracker.core.access.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TargetSelectionParserTest {

    @Test
    void parsesSinglesListsAndRanges() {
        assertThat(TargetSelectionParser.parse("3", 5)).containsExactly(2);
        assertThat(TargetSelectionParser.parse("1,3,5", 5)).containsExactly(0, 2, 4);
        assertThat(TargetSelectionParser.parse("2-4", 5)).containsExactly(1, 2, 3);
        assertThat(TargetSelectionParser.parse("1, 3-4 ,5", 5)).containsExactly(0, 2, 3, 4);
    }

    @Test
    void allSelectsEverything() {
        assertThat(TargetSelectionParser.parse("ALL", 3)).containsExactly(0, 1, 2);
    }

    @Test
    void reversedRangeIsSwappedAndDuplicatesCollapse() {
        assertThat(TargetSelectionParser.parse("4-2,3", 5)).containsExactly(1, 2, 3);
    }

    @Test
    void invalidAndOutOfRangePartsAreSkipped() {
        assertThat(TargetSelectionParser.parse("0,2,x,7,1-a", 3)).containsExactly(1);
        assertThat(TargetSelectionParser.parse("", 3)).isEmpty();
        assertThat(TargetSelectionParser.parse(null, 3)).isEmpty();
    }
}
