package com.netcracker.core.access.cli;

import com.netcracker.core.access.model.Target;
import com.netcracker.core.access.service.report.BatchReport;
import com.netcracker.core.access.service.report.GroupReport;
import com.netcracker.core.access.service.report.TargetReport;
import com.netcracker.core.access.service.verify.VerificationResult;

import java.io.PrintWriter;
import java.util.List;

final class ReportPrinter {

    private ReportPrinter() {
    }

    static void printTargetTable(PrintWriter out, List<Target> targets) {
        out.printf("%4s  %-30s  %-30s  %s%n", "#", "VM Name", "Resource Group", "Location");
        for (int i = 0; i < targets.size(); i++) {
            Target target = targets.get(i);
            out.printf("%4d  %-30s  %-30s  %s%n", i + 1, target.name(), target.resourceGroup(), target.location());
        }
        out.flush();
    }

    static void print(PrintWriter out, BatchReport report) {
        for (TargetReport target : report.targets()) {
            out.printf("%s %s%n", target.success() ? "[OK]  " : "[FAIL]", target.targetName());
            if (target.serviceSpec() != null) {
                out.printf("       %s / %s port %d%n", target.serviceSpec().osType(), target.serviceSpec().service(),
                        target.serviceSpec().port());
            }
            for (GroupReport group : target.groups()) {
                out.printf("       %s %s [%s]: %s%n", group.success() ? "+" : "x", group.groupName(), group.attachment(), group.detail());
            }
            target.verificationResult().ifPresent(result -> out.println("       " + describe(result)));
            if (target.groups().isEmpty() && target.verification() == null) {
                target.reason().ifPresent(reason -> out.println("       " + reason));
            }
        }
        out.println(report.tally());
        out.flush();
    }

    static String describe(VerificationResult result) {
        return switch (result.state()) {
            case REACHABLE -> "reachable at %s:%d (%d ms)".formatted(result.address(), result.port(),
                    result.latency().toMillis());
            case UNREACHABLE -> result.address() == null
                    ? "unreachable: " + result.reason()
                    : "unreachable at %s:%d: %s".formatted(result.address(), result.port(), result.reason());
            default -> "not running: " + result.reason();
        };
    }
}
