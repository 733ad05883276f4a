package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.DisputeStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Dispute over an order. At most one per order.
 *
 * <p>Lifecycle: OPEN → RESOLVED (terminal). The resolution is stored in its string form
 * ({@code buyer_full}, {@code split_70_30}, ...) through {@link DisputeResolutionConverter}.
 */
@Entity
@Table(name = "disputes")
@Getter
@Setter
@NoArgsConstructor
public class Dispute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false, unique = true)
    private UUID orderId;

    @Column(name = "escrow_id", nullable = false, updatable = false)
    private UUID escrowId;

    @Column(name = "initiated_by", nullable = false, updatable = false)
    private String initiatedBy;

    @Column(name = "reason", nullable = false, length = 2000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DisputeStatus status;

    @Convert(converter = DisputeResolutionConverter.class)
    @Column(name = "resolution")
    private DisputeResolution resolution;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "warning_sent_at")
    private LocalDateTime warningSentAt;

    @Column(name = "auto_resolve_at", nullable = false)
    private LocalDateTime autoResolveAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public boolean isOpen() {
        return status == DisputeStatus.OPEN;
    }

    /**
     * Open and past its auto-resolve deadline.
     */
    public boolean shouldAutoResolve(LocalDateTime now) {
        return isOpen() && !autoResolveAt.isAfter(now);
    }

    /**
     * Open, not yet warned, and within {@code warningPeriod} of its auto-resolve deadline.
     */
    public boolean shouldSendWarning(LocalDateTime now, Duration warningPeriod) {
        return isOpen()
                && warningSentAt == null
                && Duration.between(now, autoResolveAt).compareTo(warningPeriod) <= 0;
    }
}
