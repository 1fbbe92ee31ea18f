package com.susuchain.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Outbound clients: chain JSON-RPC, automation network API, and the worker
 * pool that bounds registry calls and per-group deadline reads.
 */
@Configuration
public class ClientConfig {

    @Bean
    public RestClient chainRestClient(AutomationProperties properties) {
        AutomationProperties.ChainConfig chain = properties.getChain();
        return RestClient.builder()
                .requestFactory(requestFactory(
                        (int) chain.getConnectTimeout().toMillis(),
                        (int) chain.getReadTimeout().toMillis()))
                .build();
    }

    @Bean
    public RestClient automationRestClient(AutomationProperties properties) {
        AutomationProperties.AutomationConfig automation = properties.getAutomation();
        int timeoutMs = (int) automation.getRequestTimeout().toMillis();

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(automation.getApiUrl())
                .requestFactory(requestFactory(timeoutMs, timeoutMs));

        if (automation.getApiKey() != null && !automation.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + automation.getApiKey());
        }
        return builder.build();
    }

    @Bean
    @Qualifier("automationTaskExecutor")
    public ThreadPoolTaskExecutor automationTaskExecutor(AutomationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAutomation().getWorkerThreads());
        executor.setMaxPoolSize(properties.getAutomation().getWorkerThreads());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("automation-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static SimpleClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }
}
