package com.lbg.markets.surveillance.pipeline.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VerificationReportTest {

    private static final String KEY = "2025/01/15/14/30/45/550e8400-e29b-41d4-a716-446655440000";

    private FileTask task(String id) {
        return FileTask.ready(id, "file_" + id + ".pdf", new ObjectLocation("src", "k" + id), "dest", Map.of());
    }

    @Test
    void shouldCountSuccessesAndFailures() {
        FileTask ok = task("1").transferred(KEY).registered(UUID.fromString("550e8400-e29b-41d4-a716-446655440000"));
        FileTask failed = task("2").failed(PipelineStage.TRANSFER, "boom");

        VerificationReport report = VerificationReport.of(2, List.of(ok, failed));

        assertEquals(2, report.expected());
        assertEquals(2, report.processed());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(0, report.missing());
        assertEquals(List.of(failed), report.failures());
        assertTrue(report.isComplete());
        assertFalse(report.isClean());
    }

    @Test
    void shouldReportMissingTasks() {
        FileTask failed = task("1").failed(PipelineStage.TRANSFER, "boom");

        VerificationReport report = VerificationReport.of(3, List.of(failed));

        assertEquals(2, report.missing());
        assertFalse(report.isComplete());
    }

    @Test
    void shouldBeCleanForEmptyBatch() {
        VerificationReport report = VerificationReport.of(0, List.of());

        assertEquals(0, report.processed());
        assertTrue(report.isClean());
    }

    @Test
    void shouldRejectInconsistentCounts() {
        assertThrows(IllegalArgumentException.class, () -> new VerificationReport(2, 2, 1, 0, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new VerificationReport(-1, 0, 0, 0, List.of()));
    }
}
