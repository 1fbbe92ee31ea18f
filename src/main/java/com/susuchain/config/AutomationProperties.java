package com.susuchain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app")
public class AutomationProperties {

    /**
     * Product name used in duty names ("<product> Payout - <groupName>").
     */
    private String productName = "SusuChain";

    private ChainConfig chain = new ChainConfig();
    private AutomationConfig automation = new AutomationConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private BootstrapConfig bootstrap = new BootstrapConfig();

    @Data
    public static class ChainConfig {
        /**
         * JSON-RPC endpoint of the chain node.
         */
        private String rpcUrl = "http://localhost:8545";

        /**
         * Node-managed account used as sender for the few writes this service makes.
         */
        private String senderAddress;

        /**
         * SusuFactory contract enumerating all groups.
         */
        private String factoryAddress;

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        /**
         * How long to wait for a write to be mined before giving up.
         */
        private Duration receiptTimeout = Duration.ofMinutes(2);
        private Duration receiptPollInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class AutomationConfig {
        private String apiUrl = "http://localhost:8090/automate";
        private String apiKey;

        /**
         * Automate contract address set as executor on each group.
         */
        private String executorAddress = "0x2A6C106ae13B558BB9E2Ec64Bd2f1f7BEFF3A5E0";

        /**
         * Default timeout for registry calls when the caller supplies none.
         */
        private Duration requestTimeout = Duration.ofSeconds(30);

        private int workerThreads = 4;
    }

    @Data
    public static class NotificationConfig {
        /**
         * Prefix of delivery record keys ("<namespace>-notification-<group>-<round>").
         */
        private String namespace = "susu";

        /**
         * Delivery record storage: "jpa" or "memory".
         */
        private String store = "jpa";

        private Duration pollingInterval = Duration.ofMinutes(1);

        /**
         * Width of the window below each threshold in WINDOW mode.
         */
        private Duration tierWindow = Duration.ofMinutes(5);

        private TierSelectionMode tierSelection = TierSelectionMode.WINDOW;

        /**
         * Answer given by the member's client when asked for notification consent.
         */
        private boolean grantPermissionOnRequest = true;

        private Duration groupReadTimeout = Duration.ofSeconds(15);

        private List<String> watchedGroups = new ArrayList<>();
    }

    @Data
    public static class BootstrapConfig {
        private boolean runOnStartup = false;

        /**
         * Number of most recent groups to wire; 0 or less means all groups.
         */
        private int recentGroupLimit = 5;

        /**
         * Automation balance below which a warning is logged (default 0.01 ETH).
         */
        private BigInteger lowBalanceThresholdWei = new BigInteger("10000000000000000");
    }

    public enum TierSelectionMode {
        /**
         * Fire a tier only while time remaining sits inside the window below its threshold.
         */
        WINDOW,
        /**
         * Fire the most urgent tier whose threshold has been crossed and not yet delivered.
         */
        CROSSING
    }
}
