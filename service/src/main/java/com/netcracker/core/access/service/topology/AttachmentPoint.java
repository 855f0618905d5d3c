package com.netcracker.core.access.service.topology;

public enum AttachmentPoint {
    INTERFACE("NIC"),
    SUBNET("Subnet");

    private final String label;

    AttachmentPoint(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
