package org.example.learnpath.service;

import java.util.Map;

/**
 * Sink for learner activity events such as registrations, generated days and submitted answers.
 */
public interface ActivityRecorder {

    void record(String learnerId, String event, Map<String, Object> details);
}
