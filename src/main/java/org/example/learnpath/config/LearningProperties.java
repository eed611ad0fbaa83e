package org.example.learnpath.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "learning")
public class LearningProperties {

    private Generation generation = new Generation();
    private Plan plan = new Plan();
    private Answers answers = new Answers();
    private Evaluation evaluation = new Evaluation();

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation == null ? new Generation() : generation;
    }

    public Plan getPlan() {
        return plan;
    }

    public void setPlan(Plan plan) {
        this.plan = plan == null ? new Plan() : plan;
    }

    public Answers getAnswers() {
        return answers;
    }

    public void setAnswers(Answers answers) {
        this.answers = answers == null ? new Answers() : answers;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(Evaluation evaluation) {
        this.evaluation = evaluation == null ? new Evaluation() : evaluation;
    }

    public static class Generation {
        private boolean enabled = true;
        private int defaultQuestionCount = 10;
        private int minQuestionCount = 1;
        private int maxQuestionCount = 20;
        private Duration timeout = Duration.ofSeconds(90);
        private int recentWindow = 5;
        private double adaptiveTemperature = 0.9;
        private int adaptiveMaxTokens = 3000;
        private double customTemperature = 0.9;
        private int customMaxTokens = 3500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDefaultQuestionCount() {
            return defaultQuestionCount;
        }

        public void setDefaultQuestionCount(int defaultQuestionCount) {
            this.defaultQuestionCount = defaultQuestionCount;
        }

        public int getMinQuestionCount() {
            return minQuestionCount;
        }

        public void setMinQuestionCount(int minQuestionCount) {
            this.minQuestionCount = minQuestionCount;
        }

        public int getMaxQuestionCount() {
            return maxQuestionCount;
        }

        public void setMaxQuestionCount(int maxQuestionCount) {
            this.maxQuestionCount = maxQuestionCount;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout == null ? Duration.ofSeconds(90) : timeout;
        }

        public int getRecentWindow() {
            return recentWindow;
        }

        public void setRecentWindow(int recentWindow) {
            this.recentWindow = recentWindow;
        }

        public double getAdaptiveTemperature() {
            return adaptiveTemperature;
        }

        public void setAdaptiveTemperature(double adaptiveTemperature) {
            this.adaptiveTemperature = adaptiveTemperature;
        }

        public int getAdaptiveMaxTokens() {
            return adaptiveMaxTokens;
        }

        public void setAdaptiveMaxTokens(int adaptiveMaxTokens) {
            this.adaptiveMaxTokens = adaptiveMaxTokens;
        }

        public double getCustomTemperature() {
            return customTemperature;
        }

        public void setCustomTemperature(double customTemperature) {
            this.customTemperature = customTemperature;
        }

        public int getCustomMaxTokens() {
            return customMaxTokens;
        }

        public void setCustomMaxTokens(int customMaxTokens) {
            this.customMaxTokens = customMaxTokens;
        }
    }

    public static class Plan {
        private double temperature = 0.8;
        private int maxTokens = 6000;

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Answers {
        // 0 means unlimited re-attempts
        private int maxAttempts = 0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Evaluation {
        private double temperature = 0.3;
        private int maxTokens = 2000;

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }
}
