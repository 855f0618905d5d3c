package com.netcracker.core.access.service.verify;

public enum VerificationState {
    CHECKING_POWER(false),
    NOT_RUNNING(true),
    RESOLVING_ADDRESS(false),
    PROBING(false),
    REACHABLE(true),
    UNREACHABLE(true);

    private final boolean terminal;

    VerificationState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
