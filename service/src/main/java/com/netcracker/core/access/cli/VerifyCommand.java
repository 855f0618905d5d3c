package com.netcracker.core.access.cli;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.service.AccessReconciler;
import com.netcracker.core.access.service.classify.ServicePorts;
import com.netcracker.core.access.service.report.BatchReport;
import jakarta.inject.Inject;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Test SSH/RDP connectivity to the selected VMs without changing any rule")
public class VerifyCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    TargetOptions targetOptions;

    @Mixin
    PortOptions portOptions;

    @Inject
    ResourceProviderClient provider;

    @Inject
    AccessReconciler reconciler;

    @Inject
    TargetSelector targetSelector;

    @Inject
    ServicePorts defaultPorts;

    @Override
    public Integer call() {
        ServicePorts ports = CommandSupport.ports(spec.commandLine(), defaultPorts, portOptions);
        provider.ensureAuthenticated();
        List<String> targetIds = targetSelector.select(spec.commandLine(), targetOptions, "Run connectivity test");
        if (targetIds.isEmpty()) {
            return ExitCodes.OK;
        }
        BatchReport report = reconciler.verify(targetIds, ports);
        ReportPrinter.print(spec.commandLine().getOut(), report);
        return ExitCodes.of(report);
    }
}
