package com.netcracker.core.access.service.topology;

import com.netcracker.core.access.model.SecurityGroup;

/**
 * A security group on a target's network path together with where it was found.
 */
public record GuardingGroup(SecurityGroup group, AttachmentPoint attachedVia, String attachedTo, boolean autoCreated) {

    public String describe() {
        return "%s (%s)%s".formatted(attachedVia.label(), attachedTo, autoCreated ? " auto-created" : "");
    }
}
