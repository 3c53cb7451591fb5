package com.z254.concord.conductor.config;

import com.z254.concord.conductor.domain.model.AgentCapability;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for CONDUCTOR service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "concord")
public class ConductorProperties {

    private List<AgentProperties> agents = new ArrayList<>();
    private RoutingProperties routing = new RoutingProperties();
    private LLMProperties llm = new LLMProperties();
    private DelegationProperties delegation = new DelegationProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private LedgerProperties ledger = new LedgerProperties();
    private StoreProperties store = new StoreProperties();
    private NetworkProperties network = new NetworkProperties();
    private KafkaProperties kafka = new KafkaProperties();

    public enum AgentKind {
        ORCHESTRATOR,
        SPECIALIST
    }

    @Data
    public static class AgentProperties {
        private String slug;
        private String name;
        private AgentKind kind = AgentKind.SPECIALIST;
        private String pubkey;
        private String role;
        private Set<AgentCapability> capabilities = new HashSet<>();
    }

    @Data
    public static class RoutingProperties {
        private String model;                 // falls back to llm.openai.model
        private double temperature = 0.2;
        private int maxDecisionAttempts = 1;  // 1 = no retry on a malformed decision
        private int maxIterations = 25;
    }

    @Data
    public static class LLMProperties {
        private OpenAIProperties openai = new OpenAIProperties();

        @Data
        public static class OpenAIProperties {
            private String apiKey;
            private String baseUrl = "https://api.openai.com/v1";
            private String model = "gpt-4o-mini";
            private int maxTokens = 2048;
            private double temperature = 0.7;
            private Duration timeout = Duration.ofSeconds(120);
        }
    }

    @Data
    public static class DelegationProperties {
        /**
         * Optional bound applied by the routing loop around each delegation wait.
         * Null means wait until every recipient replies or the wait is cancelled.
         */
        private Duration waitTimeout;
        private int publishRetries = 3;
        private Duration publishBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class IngestionProperties {
        private boolean autoStart = true;
        private boolean verifySignatures = true;
        private String subscriptionLabel = "conductor-ingestion";
        private Set<String> userPubkeys = new HashSet<>();
        private Integer replayLimit;
        private Duration shutdownFlushTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class LedgerProperties {
        private String store = "file"; // file, redis
        private String directory = "./data/ledger";
        private long flushIntervalMs = 2000;
        private String redisKeyPrefix = "concord:processed-events:";
    }

    @Data
    public static class StoreProperties {
        private String type = "file"; // memory, file
        private String directory = "./data/conversations";
    }

    @Data
    public static class NetworkProperties {
        private String transport = "memory"; // memory, kafka
        private int relays = 1;
        private int historySize = 1000;
        private IdentityProperties identity = new IdentityProperties();

        @Data
        public static class IdentityProperties {
            private String privateKey;
            private String publicKey;
        }
    }

    @Data
    public static class KafkaProperties {
        private TopicProperties topics = new TopicProperties();
        private int partitions = 3;

        /**
         * How long the listener waits for ingestion to confirm a record before the record is
         * redelivered.
         */
        private Duration handoffTimeout = Duration.ofSeconds(30);
        private Duration redeliveryBackoff = Duration.ofSeconds(1);

        @Data
        public static class TopicProperties {
            private String events = "concord.network.events";
        }
    }
}
