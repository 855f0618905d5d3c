package com.netcracker.core.access.service.topology;

import com.netcracker.core.access.model.SecurityGroup;
import com.netcracker.core.access.service.AccessManagerException;
import lombok.Getter;

/**
 * A security group was created but could not be attached. The group is left in place.
 */
@Getter
public class PartialProvisioningException extends AccessManagerException {
    private final transient SecurityGroup orphanedGroup;
    private final String attachTarget;

    public PartialProvisioningException(SecurityGroup orphanedGroup, String attachTarget, Throwable cause) {
        super("Security group '%s' was created but attaching it to '%s' failed: %s"
                .formatted(orphanedGroup.name(), attachTarget, cause.getMessage()), cause);
        this.orphanedGroup = orphanedGroup;
        this.attachTarget = attachTarget;
    }
}
