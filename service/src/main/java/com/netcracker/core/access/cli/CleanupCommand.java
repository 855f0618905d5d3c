package com.netcracker.core.access.cli;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.service.AccessReconciler;
import com.netcracker.core.access.service.report.BatchReport;
import jakarta.inject.Inject;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Remove duplicate rules from the security groups of the selected VMs")
public class CleanupCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    TargetOptions targetOptions;

    @Inject
    ResourceProviderClient provider;

    @Inject
    AccessReconciler reconciler;

    @Inject
    TargetSelector targetSelector;

    @Override
    public Integer call() {
        provider.ensureAuthenticated();
        List<String> targetIds = targetSelector.select(spec.commandLine(), targetOptions, "Remove duplicate rules");
        if (targetIds.isEmpty()) {
            return ExitCodes.OK;
        }
        BatchReport report = reconciler.cleanup(targetIds);
        ReportPrinter.print(spec.commandLine().getOut(), report);
        return ExitCodes.of(report);
    }
}
