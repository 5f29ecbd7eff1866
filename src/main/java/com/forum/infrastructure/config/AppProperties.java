package com.forum.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Outbox outbox = new Outbox();
    private Discussions discussions = new Discussions();
    private Kafka kafka = new Kafka();

    public Outbox getOutbox() {
        return outbox;
    }

    public void setOutbox(Outbox outbox) {
        this.outbox = outbox;
    }

    public Discussions getDiscussions() {
        return discussions;
    }

    public void setDiscussions(Discussions discussions) {
        this.discussions = discussions;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public void setKafka(Kafka kafka) {
        this.kafka = kafka;
    }

    public static class Outbox {
        private long pollIntervalMs;
        private int batchSize;
        private int retentionHours = 24;
        private long sendTimeoutMs = 10000;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getRetentionHours() {
            return retentionHours;
        }

        public void setRetentionHours(int retentionHours) {
            this.retentionHours = retentionHours;
        }

        public long getSendTimeoutMs() {
            return sendTimeoutMs;
        }

        public void setSendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
        }
    }

    public static class Discussions {
        private int defaultPageSize = 50;
        private int maxPageSize = 100;
        private String contentSubset = "all";
        // Host name -> content subset, checked before contentSubset
        private Map<String, String> subsetByHost = new LinkedHashMap<>();

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public String getContentSubset() {
            return contentSubset;
        }

        public void setContentSubset(String contentSubset) {
            this.contentSubset = contentSubset;
        }

        public Map<String, String> getSubsetByHost() {
            return subsetByHost;
        }

        public void setSubsetByHost(Map<String, String> subsetByHost) {
            this.subsetByHost = subsetByHost;
        }
    }

    public static class Kafka {
        private String topic;

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }
    }
}
