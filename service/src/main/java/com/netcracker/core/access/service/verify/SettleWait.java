package com.netcracker.core.access.service.verify;

import java.time.Duration;

@FunctionalInterface
public interface SettleWait {
    SettleWait SLEEP = duration -> Thread.sleep(duration.toMillis());

    void await(Duration duration) throws InterruptedException;
}
