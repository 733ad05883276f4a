package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.DisputeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Dispute warning and auto-resolve deadlines")
class DisputeDeadlineTest {

    private static final LocalDateTime OPENED = LocalDateTime.of(2026, 3, 1, 12, 0);
    private static final Duration WARNING_PERIOD = Duration.ofDays(3);

    private Dispute dispute;

    @BeforeEach
    void setUp() {
        dispute = new Dispute();
        dispute.setStatus(DisputeStatus.OPEN);
        dispute.setCreatedAt(OPENED);
        dispute.setAutoResolveAt(OPENED.plusDays(10));
    }

    @Test
    @DisplayName("DDL-001: No warning while the deadline is further away than the warning period")
    void noWarningBeforePeriod() {
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(6).plusHours(23), WARNING_PERIOD)).isFalse();
    }

    @Test
    @DisplayName("DDL-002: Warning due exactly at and after the start of the warning period")
    void warningWithinPeriod() {
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(7), WARNING_PERIOD)).isTrue();
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(9), WARNING_PERIOD)).isTrue();
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(11), WARNING_PERIOD)).isTrue();
    }

    @Test
    @DisplayName("DDL-003: Warned or resolved disputes are not warned again")
    void warningOnlyOnceAndOnlyWhenOpen() {
        dispute.setWarningSentAt(OPENED.plusDays(7));
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(8), WARNING_PERIOD)).isFalse();

        dispute.setWarningSentAt(null);
        dispute.setStatus(DisputeStatus.RESOLVED);
        assertThat(dispute.shouldSendWarning(OPENED.plusDays(8), WARNING_PERIOD)).isFalse();
    }

    @Test
    @DisplayName("DDL-004: Auto-resolve is due from the deadline on")
    void autoResolveAtDeadline() {
        assertThat(dispute.shouldAutoResolve(OPENED.plusDays(10).minusSeconds(1))).isFalse();
        assertThat(dispute.shouldAutoResolve(OPENED.plusDays(10))).isTrue();
    }
}
