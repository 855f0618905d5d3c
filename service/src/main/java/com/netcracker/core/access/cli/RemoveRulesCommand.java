package com.netcracker.core.access.cli;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.prompt.OperatorPrompt;
import com.netcracker.core.access.service.AccessReconciler;
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

@Command(name = "remove-rules", mixinStandardHelpOptions = true,
        description = "Remove ALL custom rules from the security groups of the selected VMs (default rules are kept)")
@Slf4j
public class RemoveRulesCommand implements Callable<Integer> {
    static final String CONFIRMATION = "DELETE";

    @Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    TargetOptions targetOptions;

    @Option(names = {"-y", "--yes"}, description = "Do not ask for the DELETE confirmation")
    boolean yes;

    @Inject
    ResourceProviderClient provider;

    @Inject
    AccessReconciler reconciler;

    @Inject
    TargetSelector targetSelector;

    @Inject
    OperatorPrompt prompt;

    @Override
    public Integer call() {
        provider.ensureAuthenticated();
        List<String> targetIds = targetSelector.select(spec.commandLine(), targetOptions, "Remove all custom rules");
        if (targetIds.isEmpty()) {
            return ExitCodes.OK;
        }
        if (!yes) {
            String answer = prompt.readLine("This will remove ALL custom rules from %d VM(s). Type %s to confirm"
                    .formatted(targetIds.size(), CONFIRMATION));
            if (answer == null || !CONFIRMATION.equals(answer.trim())) {
                log.info("Operation cancelled.");
                return ExitCodes.OK;
            }
        }
        BatchReport report = reconciler.removeRules(targetIds);
        ReportPrinter.print(spec.commandLine().getOut(), report);
        return ExitCodes.of(report);
    }
}
