package com.netpilot.gateway.job;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code gateway.jobs.*}
 *
 * @param workerThreads size of the fixed pool running batch jobs
 */
@ConfigurationProperties("gateway.jobs")
public record JobProperties(@DefaultValue("8") int workerThreads) {

    public JobProperties {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("gateway.jobs.worker-threads must be at least 1");
        }
    }
}
