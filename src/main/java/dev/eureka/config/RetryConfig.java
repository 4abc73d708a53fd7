package dev.eureka.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/** Activates {@code @Retryable} / {@code @Recover} on page fetches. */
@Configuration
@EnableRetry
public class RetryConfig {}
