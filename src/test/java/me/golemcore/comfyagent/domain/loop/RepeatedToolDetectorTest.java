package me.golemcore.comfyagent.domain.loop;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RepeatedToolDetectorTest {

    @Test
    void shouldWarnAfterThresholdIdenticalCalls() {
        RepeatedToolDetector detector = new RepeatedToolDetector(3);

        detector.record("get_queue");
        detector.record("get_queue");
        assertTrue(detector.warning().isEmpty());

        detector.record("get_queue");
        Optional<String> warning = detector.warning();

        assertTrue(warning.isPresent());
        assertTrue(warning.get().startsWith("LOOP DETECTED: You have called 'get_queue' 3 times in a row."));
    }

    @Test
    void shouldNotWarnWhenToolsAlternate() {
        RepeatedToolDetector detector = new RepeatedToolDetector(3);

        detector.record("get_queue");
        detector.record("get_history");
        detector.record("get_queue");

        assertTrue(detector.warning().isEmpty());
    }

    @Test
    void shouldBeDisabledForThresholdOfOne() {
        RepeatedToolDetector detector = new RepeatedToolDetector(1);

        detector.record("get_queue");

        assertTrue(detector.warning().isEmpty());
    }
}
