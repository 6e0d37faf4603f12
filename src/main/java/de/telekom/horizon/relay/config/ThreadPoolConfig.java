// Copyright 2024 Deutsche Telekom IT GmbH
//
// SPDX-License-Identifier: Apache-2.0

package de.telekom.horizon.relay.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Collections;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    /**
     * Single thread that aborts outbound requests whose attempt deadline expired.
     */
    @Bean(name = "deliveryTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService deliveryTimeoutScheduler(MeterRegistry meterRegistry) {
        ScheduledThreadPoolExecutor timeoutScheduler = new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("delivery-timeout-"));

        timeoutScheduler.setRemoveOnCancelPolicy(true);
        timeoutScheduler.allowCoreThreadTimeOut(true);
        timeoutScheduler.setKeepAliveTime(20, TimeUnit.SECONDS);

        timeoutScheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        timeoutScheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);

        ExecutorServiceMetrics.monitor(meterRegistry, timeoutScheduler, "deliveryTimeoutScheduler", Collections.emptyList());

        return timeoutScheduler;
    }

}
