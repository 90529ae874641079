package com.codesmith.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the attempt-orchestration engine, bound from {@code codesmith.*}.
 *
 * Defaults match the values the engine was calibrated with; every one can be
 * overridden in application.yml or through environment variables.
 */
@ConfigurationProperties(prefix = "codesmith")
public class CodesmithProperties {

    private Jobs jobs = new Jobs();
    private Escalation escalation = new Escalation();
    private Budget budget = new Budget();
    private Conversation conversation = new Conversation();

    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }
    public Escalation getEscalation() { return escalation; }
    public void setEscalation(Escalation escalation) { this.escalation = escalation; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
    public Conversation getConversation() { return conversation; }
    public void setConversation(Conversation conversation) { this.conversation = conversation; }

    public static class Jobs {
        private int defaultMaxIterations = 10;
        private String defaultLanguage = "java";
        private int workerThreads = 4;
        private int historyWindow = 3;
        // Zero keeps terminal jobs until they are deleted through the API.
        private Duration retention = Duration.ZERO;

        public int getDefaultMaxIterations() { return defaultMaxIterations; }
        public void setDefaultMaxIterations(int v) { this.defaultMaxIterations = v; }
        public String getDefaultLanguage() { return defaultLanguage; }
        public void setDefaultLanguage(String v) { this.defaultLanguage = v; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int v) { this.workerThreads = v; }
        public int getHistoryWindow() { return historyWindow; }
        public void setHistoryWindow(int v) { this.historyWindow = v; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration v) { this.retention = v; }
    }

    public static class Escalation {
        private double highBar = 8.0;
        private double acceptableBar = 6.5;
        private int minAttemptsBeforeAccept = 3;
        // First attempt number of each tier above the cheapest one.
        private List<Integer> tierBoundaries = new ArrayList<>(List.of(4, 7));

        public double getHighBar() { return highBar; }
        public void setHighBar(double v) { this.highBar = v; }
        public double getAcceptableBar() { return acceptableBar; }
        public void setAcceptableBar(double v) { this.acceptableBar = v; }
        public int getMinAttemptsBeforeAccept() { return minAttemptsBeforeAccept; }
        public void setMinAttemptsBeforeAccept(int v) { this.minAttemptsBeforeAccept = v; }
        public List<Integer> getTierBoundaries() { return tierBoundaries; }
        public void setTierBoundaries(List<Integer> v) { this.tierBoundaries = v; }
    }

    public static class Budget {
        private int totalTokens = 16_000;
        private int minOverviewTokens = 256;
        private double overviewShare = 0.20;
        private double summaryShare = 0.30;
        private double explorationShare = 0.25;
        private double generationShare = 0.20;
        private int searchLimit = 10;
        private int charsPerToken = 4;

        public int getTotalTokens() { return totalTokens; }
        public void setTotalTokens(int v) { this.totalTokens = v; }
        public int getMinOverviewTokens() { return minOverviewTokens; }
        public void setMinOverviewTokens(int v) { this.minOverviewTokens = v; }
        public double getOverviewShare() { return overviewShare; }
        public void setOverviewShare(double v) { this.overviewShare = v; }
        public double getSummaryShare() { return summaryShare; }
        public void setSummaryShare(double v) { this.summaryShare = v; }
        public double getExplorationShare() { return explorationShare; }
        public void setExplorationShare(double v) { this.explorationShare = v; }
        public double getGenerationShare() { return generationShare; }
        public void setGenerationShare(double v) { this.generationShare = v; }
        public int getSearchLimit() { return searchLimit; }
        public void setSearchLimit(int v) { this.searchLimit = v; }
        public int getCharsPerToken() { return charsPerToken; }
        public void setCharsPerToken(int v) { this.charsPerToken = v; }
    }

    public static class Conversation {
        private Duration answerTimeout = Duration.ofMinutes(5);
        private Duration idleTimeout = Duration.ofMinutes(30);
        private int maxQuestions = 3;
        private boolean enabled = true;

        public Duration getAnswerTimeout() { return answerTimeout; }
        public void setAnswerTimeout(Duration v) { this.answerTimeout = v; }
        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration v) { this.idleTimeout = v; }
        public int getMaxQuestions() { return maxQuestions; }
        public void setMaxQuestions(int v) { this.maxQuestions = v; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean v) { this.enabled = v; }
    }
}
