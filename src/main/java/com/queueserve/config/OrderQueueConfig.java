package com.queueserve.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for order handling.
 *
 * <p>Controls the conflict retry budget for status transitions and the result caps
 * on the listing endpoints. Properties are read from the {@code queueserve.orders} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "queueserve.orders")
@Getter
@Setter
public class OrderQueueConfig {

    /** Attempts (including the first) for a status update that loses a concurrent race. */
    private int transitionMaxAttempts = 3;

    /** Pause between conflict retries, in milliseconds. */
    private long transitionRetryWaitMs = 20;

    /** Maximum orders returned by the history listing. */
    private int historyLimit = 200;

    /** Maximum orders returned when a customer lists their own orders. */
    private int ownerLimit = 50;
}
