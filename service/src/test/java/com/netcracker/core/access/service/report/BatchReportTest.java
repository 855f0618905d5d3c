package com.netcracker.core.access.service.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchReportTest {

    @Test
    void targetFailsWhenAnyGroupFails() {
        TargetReport report = new TargetReport("id", "web-1", null, List.of(
                GroupReport.succeeded("nic-nsg", "NIC 'nic'", "created 'a' (priority 100)"),
                GroupReport.failed("subnet-nsg", "Subnet 'default'", "No free priority")), null, null);

        assertFalse(report.success());
        assertThat(report.reason()).contains("subnet-nsg: No free priority");
    }

    @Test
    void targetWithoutGroupsSucceeds() {
        TargetReport report = new TargetReport("id", "web-1", null, null, null, null);

        assertTrue(report.success());
        assertThat(report.reason()).isEmpty();
        assertThat(report.groups()).isEmpty();
    }

    @Test
    void tallyCountsOutcomes() {
        BatchReport report = new BatchReport("cleanup", List.of(
                new TargetReport("a", "a", null, List.of(), null, null),
                TargetReport.failed("b", "b", "not found"),
                new TargetReport("c", "c", null, List.of(), null, null)));

        assertEquals(2, report.succeeded());
        assertEquals(1, report.failed());
        assertTrue(report.hasFailures());
        assertEquals("cleanup: 3 target(s) processed, 2 succeeded, 1 failed", report.tally());
    }
}
