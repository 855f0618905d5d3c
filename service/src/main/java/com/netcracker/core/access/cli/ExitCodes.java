package com.netcracker.core.access.cli;

import com.netcracker.core.access.service.report.BatchReport;

final class ExitCodes {
    static final int OK = 0;
    static final int TARGET_FAILED = 1;

    private ExitCodes() {
    }

    static int of(BatchReport report) {
        return report.hasFailures() ? TARGET_FAILED : OK;
    }
}
