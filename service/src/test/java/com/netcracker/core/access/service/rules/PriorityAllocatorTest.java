package com.netcracker.core.access.service.rules;

import com.netcracker.core.access.model.SecurityRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static com.netcracker.core.access.model.RuleFixtures.allow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PriorityAllocatorTest {

    @Test
    void returnsFirstUnusedPriority() {
        List<SecurityRule> rules = List.of(allow("a", 100, "*", "22"), allow("b", 101, "*", "22"));

        assertEquals(102, PriorityAllocator.nextFreePriority(rules));
    }

    @Test
    void emptyGroupStartsAtRangeMinimum() {
        assertEquals(100, PriorityAllocator.nextFreePriority(List.of()));
        assertEquals(500, PriorityAllocator.nextFreePriority(List.of(), new PriorityRange(500, 600)));
    }

    @Test
    void fillsGapsAndIgnoresSystemRules() {
        List<SecurityRule> rules = List.of(
                allow("a", 100, "*", "22"),
                allow("b", 102, "*", "22"),
                allow("system", 65000, "*", "*"));

        assertEquals(101, PriorityAllocator.nextFreePriority(rules));
    }

    @Test
    void rangeMaximumIsUsable() {
        List<SecurityRule> rules = IntStream.range(100, 4096)
                .mapToObj(priority -> allow("r" + priority, priority, "*", "22"))
                .toList();

        assertEquals(4096, PriorityAllocator.nextFreePriority(rules));
    }

    @Test
    void exhaustedRangeFails() {
        PriorityRange range = new PriorityRange(100, 102);
        List<SecurityRule> rules = List.of(
                allow("a", 100, "*", "22"),
                allow("b", 101, "*", "22"),
                allow("c", 102, "*", "22"));

        assertThatThrownBy(() -> PriorityAllocator.nextFreePriority(rules, range))
                .isInstanceOf(PriorityExhaustedException.class)
                .hasMessageContaining("100")
                .hasMessageContaining("102");
    }

    @Test
    void rangeMayNotReachProviderDefaults() {
        assertThatThrownBy(() -> new PriorityRange(100, 65000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriorityRange(200, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThat(PriorityRange.DEFAULT.max()).isLessThan(SecurityRule.SYSTEM_PRIORITY_FLOOR);
    }
}
