package org.example.learnpath.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class LearningMetricsService {

    private final LongAdder generationRequested = new LongAdder();
    private final LongAdder generationCompleted = new LongAdder();
    private final LongAdder generationFallbackCompleted = new LongAdder();
    private final LongAdder generationFailed = new LongAdder();
    private final LongAdder generationRaceLost = new LongAdder();
    private final LongAdder regenerationCompleted = new LongAdder();
    private final LongAdder planFallbackDays = new LongAdder();
    private final LongAdder answersSubmitted = new LongAdder();
    private final LongAdder answersCorrect = new LongAdder();
    private final LongAdder attemptLimitRejected = new LongAdder();
    private final AtomicLong generationLatencyTotalMs = new AtomicLong(0);

    public void recordGenerationRequested() {
        generationRequested.increment();
    }

    public void recordGenerationCompleted(boolean fallbackUsed, long durationMs) {
        generationCompleted.increment();
        if (fallbackUsed) {
            generationFallbackCompleted.increment();
        }
        if (durationMs > 0) {
            generationLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordGenerationFailed(long durationMs) {
        generationFailed.increment();
        if (durationMs > 0) {
            generationLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordGenerationRaceLost() {
        generationRaceLost.increment();
    }

    public void recordRegenerationCompleted() {
        regenerationCompleted.increment();
    }

    public void recordPlanFallbackDays(int days) {
        if (days > 0) {
            planFallbackDays.add(days);
        }
    }

    public void recordAnswerSubmitted(boolean correct) {
        answersSubmitted.increment();
        if (correct) {
            answersCorrect.increment();
        }
    }

    public void recordAttemptLimitRejected() {
        attemptLimitRejected.increment();
    }

    public Map<String, Object> snapshot() {
        long completed = generationCompleted.sum();
        long failed = generationFailed.sum();
        long measured = completed + failed;
        long avgLatencyMs = measured == 0 ? 0 : generationLatencyTotalMs.get() / measured;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("generationRequested", generationRequested.sum());
        metrics.put("generationCompleted", completed);
        metrics.put("generationFallbackCompleted", generationFallbackCompleted.sum());
        metrics.put("generationFailed", failed);
        metrics.put("generationRaceLost", generationRaceLost.sum());
        metrics.put("generationAverageLatencyMs", avgLatencyMs);
        metrics.put("regenerationCompleted", regenerationCompleted.sum());
        metrics.put("planFallbackDays", planFallbackDays.sum());
        metrics.put("answersSubmitted", answersSubmitted.sum());
        metrics.put("answersCorrect", answersCorrect.sum());
        metrics.put("attemptLimitRejected", attemptLimitRejected.sum());
        return metrics;
    }
}
