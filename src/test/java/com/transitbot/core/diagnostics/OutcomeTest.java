package com.transitbot.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void success_shouldCarryValueAndNoCause() {
        Outcome<Double> out = Outcome.success(1.5, "timing_fit");

        assertTrue(out.success);
        assertEquals(1.5, out.value, 0.0);
        assertEquals(CauseCode.NONE, out.causeCode);
        assertEquals("Outcome[success, owner=timing_fit]", out.toString());
    }

    @Test
    void failure_shouldKeepCauseAndDetails() {
        Outcome<Double> out = Outcome.failure(CauseCode.FIT_NOT_CONVERGED, "timing_fit", Map.of("starts", 5));

        assertFalse(out.success);
        assertNull(out.value);
        assertEquals(5, out.details.get("starts"));
        assertTrue(out.toString().contains("FIT_NOT_CONVERGED"));
    }
}
