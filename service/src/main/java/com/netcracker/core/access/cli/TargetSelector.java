package com.netcracker.core.access.cli;

import com.netcracker.core.access.client.ResourceProviderClient;
import com.netcracker.core.access.client.azure.AzureResourceId;
import com.netcracker.core.access.client.prompt.OperatorPrompt;
import com.netcracker.core.access.model.Target;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;

/**
 * Turns target options into the list of target ids to process, asking the operator
 * when neither a resource id nor {@code --all} was given.
 */
@ApplicationScoped
@Slf4j
public class TargetSelector {
    private final ResourceProviderClient provider;
    private final OperatorPrompt prompt;

    @Inject
    public TargetSelector(ResourceProviderClient provider, OperatorPrompt prompt) {
        this.provider = provider;
        this.prompt = prompt;
    }

    public List<String> select(CommandLine commandLine, TargetOptions options, String actionLabel) {
        if (options.resourceId != null && options.all) {
            throw new CommandLine.ParameterException(commandLine, "--resource-id and --all are mutually exclusive");
        }
        if (options.resourceId != null) {
            if (!AzureResourceId.isValid(options.resourceId)) {
                throw new CommandLine.ParameterException(commandLine,
                        "Invalid resource ID format. It should start with '/subscriptions/'.");
            }
            return List.of(options.resourceId);
        }

        List<Target> targets = provider.listTargets();
        if (targets.isEmpty()) {
            log.warn("No VMs found in current subscription.");
            return List.of();
        }
        if (options.all) {
            return targets.stream().map(Target::id).toList();
        }
        return selectInteractively(commandLine.getOut(), targets, actionLabel);
    }

    private List<String> selectInteractively(PrintWriter out, List<Target> targets, String actionLabel) {
        ReportPrinter.printTargetTable(out, targets);
        String selection = prompt.readLine("Select VMs (e.g. 1,3-5 or all)");
        List<Integer> indices = TargetSelectionParser.parse(selection, targets.size());
        if (indices.isEmpty()) {
            log.warn("No VMs selected.");
            return List.of();
        }
        List<Target> selected = indices.stream().map(targets::get).toList();
        out.println("Selected " + selected.size() + " VM(s):");
        selected.forEach(target -> out.println("  - " + target.name() + " (" + target.resourceGroup() + ")"));
        out.flush();
        if (!prompt.askYesNo(actionLabel + " for the selected VM(s)?")) {
            log.info("Operation cancelled.");
            return List.of();
        }
        return selected.stream().map(Target::id).toList();
    }
}
