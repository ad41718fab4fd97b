package io.kandiegang.shop.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/** Runs {@code @Async} listeners on Boot's auto-configured task executor. */
@Configuration
@EnableAsync
public class AsyncConfig {}
