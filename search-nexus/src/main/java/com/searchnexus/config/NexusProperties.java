package com.searchnexus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "nexus")
public class NexusProperties {

    private String basePath = "search-nodes";
    private String registryFile = "configs/node-registry.json";
    private String defaultCluster = "search-cluster";

    private Defaults defaults = new Defaults();
    private Validation validation = new Validation();
    private Reconcile reconcile = new Reconcile();
    private Monitor monitor = new Monitor();
    private Engine engine = new Engine();

    @Data
    public static class Defaults {
        private String host = "localhost";
        private int httpPort = 9200;
        private int transportPort = 9300;
        private String heapSize = "1g";
    }

    @Data
    public static class Validation {
        private double heapMaxFraction = 0.75;
        private int portSearchWindow = 1000;
        private int nameSuggestions = 3;
        private EmptyRolesPolicy emptyRolesPolicy = EmptyRolesPolicy.WARN;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Reconcile {
        private int startAttempts = 20;
        private Duration startInterval = Duration.ofSeconds(3);
        private int stopAttempts = 10;
        private Duration stopInterval = Duration.ofSeconds(2);
        private Duration taskRetention = Duration.ofMinutes(5);
    }

    @Data
    public static class Monitor {
        private Duration refreshInterval = Duration.ofSeconds(15);
        private Duration probeTimeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Engine {
        private String home;
        private String executable; // overrides <home>/bin/elasticsearch when set
    }

    public enum EmptyRolesPolicy {
        ALLOW,
        WARN,
        REJECT
    }
}
