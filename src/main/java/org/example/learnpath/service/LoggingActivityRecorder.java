package org.example.learnpath.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Writes activity events to the {@code learnpath.activity} logger, one line per event.
 */
@Component
public class LoggingActivityRecorder implements ActivityRecorder {

    static final String LOGGER_NAME = "learnpath.activity";

    private static final Logger activityLog = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void record(String learnerId, String event, Map<String, Object> details) {
        if (!activityLog.isInfoEnabled()) {
            return;
        }
        Map<String, Object> sorted = details == null ? Map.of() : new TreeMap<>(details);
        activityLog.info("event={} learner={} details={}", event, learnerId, sorted);
    }
}
