package com.susuchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Susu Payout Automation Service
 *
 * Keeps savings-group payouts running without manual member action.
 *
 * Architecture:
 * - Payout checker (resolver) polled by the external automation network
 * - Task registry syncing one checking duty per group with the network
 * - Deadline notifier raising tiered contribution reminders
 * - Bootstrap orchestrator wiring automation for existing groups
 * - Kafka-based opt-in/opt-out requests with Dead Letter Queue
 * - Circuit breaker on chain RPC
 *
 * Execution safety (one payout per round) is enforced by the group contract,
 * not by this service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
@EnableScheduling
public class SusuAutomationApplication {

    public static void main(String[] args) {
        SpringApplication.run(SusuAutomationApplication.class, args);
    }
}
