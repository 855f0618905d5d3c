package com.netcracker.core.access.cli;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.net.PublicAddressDetector;
import com.netcracker.core.access.client.prompt.OperatorPrompt;
import com.netcracker.core.access.service.AccessReconciler;
import com.netcracker.core.access.service.classify.ServicePorts;
import com.netcracker.core.access.service.report.BatchReport;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "grant", mixinStandardHelpOptions = true,
        description = "Allow SSH (Linux) or RDP (Windows) from the caller's public IP to the selected VMs")
@Slf4j
public class GrantCommand implements Callable<Integer> {

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    TargetOptions targetOptions;

    @Mixin
    PortOptions portOptions;

    @Option(names = {"--ip"}, description = "Source IP to allow instead of the auto-detected public IP")
    String sourceAddress;

    @Option(names = {"--test"}, description = "Run a TCP connectivity test after configuring each VM")
    boolean test;

    @Inject
    ResourceProviderClient provider;

    @Inject
    AccessReconciler reconciler;

    @Inject
    TargetSelector targetSelector;

    @Inject
    PublicAddressDetector addressDetector;

    @Inject
    OperatorPrompt prompt;

    @Inject
    ServicePorts defaultPorts;

    @Override
    public Integer call() {
        ServicePorts ports = CommandSupport.ports(spec.commandLine(), defaultPorts, portOptions);
        String explicitSource = sourceAddress == null ? null : CommandSupport.sourceAddress(spec.commandLine(), sourceAddress);
        provider.ensureAuthenticated();
        String source = explicitSource != null ? explicitSource : addressDetector.detect();
        log.info("Source IP: {}", source);

        List<String> targetIds = targetSelector.select(spec.commandLine(), targetOptions, "Add access rules");
        if (targetIds.isEmpty()) {
            return ExitCodes.OK;
        }
        boolean verifyAfter = test || interactive() && prompt.askYesNo("Run TCP connectivity test after configuring each VM?");

        BatchReport report = reconciler.grant(targetIds, source, ports, verifyAfter);
        ReportPrinter.print(spec.commandLine().getOut(), report);
        return ExitCodes.of(report);
    }

    private boolean interactive() {
        return targetOptions.resourceId == null && !targetOptions.all;
    }
}
