package com.agentide.core.config;

import com.agentide.core.review.ApprovalMatching;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the plan-execution state machine, bound from {@code agentide.*}.
 */
@Component
@ConfigurationProperties(prefix = "agentide")
public class AgentIdeProperties {

    private Engine engine = new Engine();
    private Planner planner = new Planner();
    private Worker worker = new Worker();
    private Review review = new Review();
    private Checkpoint checkpoint = new Checkpoint();

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Planner getPlanner() {
        return planner;
    }

    public void setPlanner(Planner planner) {
        this.planner = planner;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public static class Engine {

        /** Ceiling on component invocations per session, counted across resumes. */
        private int maxSteps = 50;

        /** Sessions that may execute at the same time. */
        private int maxConcurrentSessions = 4;

        public int getMaxSteps() {
            return maxSteps;
        }

        public void setMaxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
        }

        public int getMaxConcurrentSessions() {
            return maxConcurrentSessions;
        }

        public void setMaxConcurrentSessions(int maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
        }
    }

    public static class Planner {

        private int maxAttempts = 3;
        private String fallbackArtifact = "output.py";

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public String getFallbackArtifact() {
            return fallbackArtifact;
        }

        public void setFallbackArtifact(String fallbackArtifact) {
            this.fallbackArtifact = fallbackArtifact;
        }
    }

    public static class Worker {

        private int maxAttempts = 5;
        private Duration timeBudget = Duration.ofMinutes(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getTimeBudget() {
            return timeBudget;
        }

        public void setTimeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
        }
    }

    public static class Review {

        private ApprovalMatching approvalMatching = ApprovalMatching.WHOLE_PHRASE;
        private List<String> vocabulary = new ArrayList<>(List.of(
                "looks good", "approve", "approved", "done", "ok", "good", "lgtm", "perfect"));

        public ApprovalMatching getApprovalMatching() {
            return approvalMatching;
        }

        public void setApprovalMatching(ApprovalMatching approvalMatching) {
            this.approvalMatching = approvalMatching;
        }

        public List<String> getVocabulary() {
            return vocabulary;
        }

        public void setVocabulary(List<String> vocabulary) {
            this.vocabulary = vocabulary;
        }
    }

    public static class Checkpoint {

        /** JDBC URL of the PostgreSQL checkpoint database; blank selects the in-memory store. */
        private String jdbcUrl = "";
        private String username = "";
        private String password = "";
        private int maxPoolSize = 5;

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public boolean isJdbcConfigured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }
    }
}
