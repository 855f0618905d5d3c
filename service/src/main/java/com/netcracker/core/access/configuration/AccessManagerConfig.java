package com.netcracker.core.access.configuration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;

@ConfigMapping(prefix = "access-manager")
public interface AccessManagerConfig {

    Ports ports();

    Priority priority();

    Probe probe();

    Verify verify();

    Azure azure();

    PublicIp publicIp();

    interface Ports {
        @WithDefault("22")
        int ssh();

        @WithDefault("3389")
        int rdp();
    }

    /**
     * Inclusive range of priorities available to custom rules.
     */
    interface Priority {
        @WithDefault("100")
        int min();

        @WithDefault("4096")
        int max();
    }

    interface Probe {
        @WithDefault("5S")
        Duration timeout();
    }

    interface Verify {
        /**
         * Wait after a start action before the power state is checked again.
         */
        @WithDefault("10S")
        Duration startSettleDelay();
    }

    interface Azure {
        @WithDefault("az")
        String cliCommand();

        @WithDefault("5M")
        Duration tokenRefreshThreshold();
    }

    interface PublicIp {
        @WithDefault("https://api.ipify.org,https://ifconfig.me/ip,https://checkip.amazonaws.com")
        List<String> services();

        @WithDefault("10S")
        Duration timeout();
    }
}
