package com.wall.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Feed feed = new Feed();
    private Metrics metrics = new Metrics();
    private Traffic traffic = new Traffic();
    private Cors cors = new Cors();
    private Auth auth = new Auth();

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Traffic getTraffic() {
        return traffic;
    }

    public void setTraffic(Traffic traffic) {
        this.traffic = traffic;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public static class Feed {
        private int defaultPageSize = 10;
        private int maxPageSize = 50;
        private Cache cache = new Cache();

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

        public Cache getCache() {
            return cache;
        }

        public void setCache(Cache cache) {
            this.cache = cache;
        }
    }

    public static class Cache {
        /**
         * redis, memory or none.
         */
        private String type = "redis";
        private Duration ttl = Duration.ofSeconds(5);
        private long maxEntries = 1000;
        private boolean invalidateOnComment = true;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(long maxEntries) {
            this.maxEntries = maxEntries;
        }

        public boolean isInvalidateOnComment() {
            return invalidateOnComment;
        }

        public void setInvalidateOnComment(boolean invalidateOnComment) {
            this.invalidateOnComment = invalidateOnComment;
        }
    }

    public static class Metrics {
        private String namespace = "";
        private Map<String, String> tags = new LinkedHashMap<>();

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Map<String, String> getTags() {
            return tags;
        }

        public void setTags(Map<String, String> tags) {
            this.tags = tags;
        }
    }

    public static class Traffic {
        private boolean enabled;
        private String baseUrl = "http://localhost:8080";
        private long intervalMs = 750;
        private String authorName = "load-bot";
        private double postProbability = 0.35;
        private double commentProbability = 0.25;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public String getAuthorName() {
            return authorName;
        }

        public void setAuthorName(String authorName) {
            this.authorName = authorName;
        }

        public double getPostProbability() {
            return postProbability;
        }

        public void setPostProbability(double postProbability) {
            this.postProbability = postProbability;
        }

        public double getCommentProbability() {
            return commentProbability;
        }

        public void setCommentProbability(double commentProbability) {
            this.commentProbability = commentProbability;
        }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }

    public static class Auth {
        /**
         * HMAC key for access tokens; at least 32 bytes.
         */
        private String tokenSecret = "dev-only-token-secret-change-me-0123456789";
        private Duration tokenTtl = Duration.ofHours(24);

        public String getTokenSecret() {
            return tokenSecret;
        }

        public void setTokenSecret(String tokenSecret) {
            this.tokenSecret = tokenSecret;
        }

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }
    }
}
