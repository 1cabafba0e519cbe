package org.scenic.timing.solar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("TimingUnavailableException Tests")
class TimingUnavailableExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessageFormat() {
        TimingUnavailableException ex = new TimingUnavailableException("SOLAR_TEST", "something failed");
        assertEquals("SOLAR_TEST", ex.getReasonCode());
        assertEquals("[SOLAR_TEST] something failed", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("root");
        TimingUnavailableException ex = new TimingUnavailableException("SOLAR_TEST", "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or missing reason codes are rejected")
    void testReasonCodeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TimingUnavailableException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new TimingUnavailableException(null, "msg"));
        assertThrows(NullPointerException.class, () -> new TimingUnavailableException("CODE", null));
    }
}
