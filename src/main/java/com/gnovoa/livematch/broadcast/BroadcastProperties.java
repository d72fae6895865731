package com.gnovoa.livematch.broadcast;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Delivery pool size and per-subscriber backlog of the {@link BroadcastHub} ({@code broadcast.*}). */
@ConfigurationProperties(prefix = "broadcast")
public record BroadcastProperties(int workerThreads, int queueCapacity) {
    public BroadcastProperties {
        if (workerThreads <= 0) workerThreads = 4;
        if (queueCapacity <= 0) queueCapacity = 256;
    }
}
