package com.netcracker.core.access.model;

public record PowerStatus(PowerState state, String displayStatus, String provisioningState) {

    public PowerStatus {
        state = state == null ? PowerState.UNKNOWN : state;
        displayStatus = displayStatus == null || displayStatus.isBlank() ? "Unknown" : displayStatus;
        provisioningState = provisioningState == null || provisioningState.isBlank() ? "Unknown" : provisioningState;
    }

    public boolean isRunning() {
        return state == PowerState.RUNNING;
    }
}
