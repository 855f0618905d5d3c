package com.netcracker.core.access.service.verify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationResultTest {

    @Test
    void onlyTerminalStatesMakeAResult() {
        assertThatThrownBy(() -> new VerificationResult(VerificationState.PROBING, null, "20.1.2.3", 22, null, null, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
