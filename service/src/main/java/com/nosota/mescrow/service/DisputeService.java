package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.DisputeStatus;
import com.nosota.mescrow.api.model.EvidenceType;
import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.config.MarketplaceProperties;
import com.nosota.mescrow.error.DisputeAlreadyResolvedException;
import com.nosota.mescrow.error.DisputeNotFoundException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.InvalidResolutionException;
import com.nosota.mescrow.error.OrderCannotBeDisputedException;
import com.nosota.mescrow.error.OrderNotFoundException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.Dispute;
import com.nosota.mescrow.model.DisputeEvidence;
import com.nosota.mescrow.model.DisputeResolution;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.ResolutionSplit;
import com.nosota.mescrow.repository.DisputeEvidenceRepository;
import com.nosota.mescrow.repository.DisputeRepository;
import com.nosota.mescrow.repository.OrderRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Dispute lifecycle: open → evidence → resolve.
 *
 * <p>Opening a dispute freezes the order's escrow (HELD → DISPUTED). Resolving it hands the
 * parsed resolution to {@link EscrowService#resolveDispute}, which moves the money.
 *
 * <p>Disputes carry an auto-resolve deadline. This service only answers whether a dispute is due
 * for a warning or for auto-resolution; picking an outcome for an overdue dispute is left to
 * the adjudicator.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    private final DisputeRepository disputeRepository;
    private final DisputeEvidenceRepository disputeEvidenceRepository;
    private final OrderRepository orderRepository;
    private final EscrowService escrowService;
    private final MarketplaceProperties marketplaceProperties;
    private final Clock clock;

    /**
     * Opens a dispute on an order.
     *
     * <p>Steps, all in one transaction:
     * <ol>
     *   <li>Escrow HELD → DISPUTED (conditional update, locks the escrow row)</li>
     *   <li>Lock the order and check it is PENDING or SHIPPED</li>
     *   <li>Persist an OPEN dispute with {@code autoResolveAt = now + disputeWindowDays}</li>
     *   <li>Order → DISPUTED</li>
     * </ol>
     *
     * @param orderId     Order being disputed
     * @param initiatorId User opening the dispute
     * @param reason      Reason for the dispute
     * @return Created dispute
     * @throws OrderNotFoundException         if the order does not exist
     * @throws OrderCannotBeDisputedException if the order is not PENDING/SHIPPED or already has a dispute
     */
    @Transactional(rollbackFor = Exception.class)
    public Dispute open(@NotNull UUID orderId, @NotBlank String initiatorId, @NotBlank @Size(max = 2000) String reason)
            throws OrderNotFoundException, OrderCannotBeDisputedException, EscrowNotFoundException {
        UUID escrowId = orderRepository.findEscrowIdById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        escrowService.markDisputed(escrowId);

        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.getStatus() != OrderStatus.PENDING && order.getStatus() != OrderStatus.SHIPPED) {
            log.info("Dispute rejected: orderId={}, status={}", orderId, order.getStatus());
            throw new OrderCannotBeDisputedException(orderId);
        }
        if (disputeRepository.existsByOrderId(orderId)) {
            log.info("Dispute rejected, already disputed: orderId={}", orderId);
            throw new OrderCannotBeDisputedException(orderId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Dispute dispute = new Dispute();
        dispute.setOrderId(orderId);
        dispute.setEscrowId(escrowId);
        dispute.setInitiatedBy(initiatorId);
        dispute.setReason(reason);
        dispute.setStatus(DisputeStatus.OPEN);
        dispute.setAutoResolveAt(now.plusDays(marketplaceProperties.disputeWindowDays()));
        dispute.setCreatedAt(now);
        dispute = disputeRepository.save(dispute);

        order.setStatus(OrderStatus.DISPUTED);
        orderRepository.save(order);

        log.info("Opened dispute: disputeId={}, orderId={}, escrowId={}, initiatedBy={}, autoResolveAt={}",
                dispute.getId(), orderId, escrowId, initiatorId, dispute.getAutoResolveAt());
        return dispute;
    }

    /**
     * Attaches evidence to an open dispute. Evidence is never modified or removed.
     *
     * @throws DisputeNotFoundException        if the dispute does not exist
     * @throws DisputeAlreadyResolvedException if the dispute is no longer open
     */
    @Transactional(rollbackFor = Exception.class)
    public DisputeEvidence submitEvidence(@NotNull UUID disputeId, @NotBlank String submitterId,
                                          @NotNull EvidenceType type, @NotBlank String content)
            throws DisputeNotFoundException, DisputeAlreadyResolvedException {
        Dispute dispute = getDispute(disputeId);
        if (!dispute.isOpen()) {
            throw new DisputeAlreadyResolvedException(disputeId);
        }

        DisputeEvidence evidence = new DisputeEvidence();
        evidence.setDisputeId(disputeId);
        evidence.setSubmittedBy(submitterId);
        evidence.setType(type);
        evidence.setContent(content);
        evidence.setCreatedAt(LocalDateTime.now(clock));
        evidence = disputeEvidenceRepository.save(evidence);

        log.info("Evidence submitted: disputeId={}, evidenceId={}, submittedBy={}, type={}",
                disputeId, evidence.getId(), submitterId, type);
        return evidence;
    }

    /**
     * Resolves an open dispute.
     *
     * <p>The resolution string is parsed before anything changes, so a malformed string leaves the
     * dispute, escrow and wallets untouched.
     *
     * @param disputeId     Dispute ID
     * @param resolution    {@code buyer_full}, {@code seller_full}, {@code burn} or {@code split_<b>_<s>}
     * @param adjudicatorId User resolving the dispute (privilege checked by the caller)
     * @param notes         Optional resolution notes
     * @return Resolved dispute and the computed split
     * @throws DisputeNotFoundException        if the dispute does not exist
     * @throws DisputeAlreadyResolvedException if the dispute is already resolved
     * @throws InvalidResolutionException      if {@code resolution} is malformed
     */
    @Transactional(rollbackFor = Exception.class)
    public Resolved resolve(@NotNull UUID disputeId, @NotBlank String resolution,
                            @NotBlank String adjudicatorId, String notes)
            throws DisputeNotFoundException, DisputeAlreadyResolvedException, InvalidResolutionException,
            EscrowNotFoundException, UserNotFoundException {
        Dispute dispute = disputeRepository.findByIdForUpdate(disputeId)
                .orElseThrow(() -> new DisputeNotFoundException(disputeId));
        if (!dispute.isOpen()) {
            throw new DisputeAlreadyResolvedException(disputeId);
        }

        DisputeResolution parsed = DisputeResolution.parse(resolution);
        ResolutionSplit split = escrowService.resolveDispute(dispute.getEscrowId(), parsed);

        dispute.setStatus(DisputeStatus.RESOLVED);
        dispute.setResolution(parsed);
        dispute.setResolvedBy(adjudicatorId);
        dispute.setResolutionNotes(notes);
        dispute.setResolvedAt(LocalDateTime.now(clock));
        dispute = disputeRepository.save(dispute);

        log.info("Resolved dispute: disputeId={}, escrowId={}, resolution={}, resolvedBy={}",
                disputeId, dispute.getEscrowId(), parsed, adjudicatorId);
        return new Resolved(dispute, split);
    }

    /**
     * Records that the auto-resolve warning for a dispute was delivered.
     */
    @Transactional(rollbackFor = Exception.class)
    public Dispute markWarningSent(@NotNull UUID disputeId) throws DisputeNotFoundException {
        Dispute dispute = disputeRepository.findByIdForUpdate(disputeId)
                .orElseThrow(() -> new DisputeNotFoundException(disputeId));
        if (dispute.getWarningSentAt() == null) {
            dispute.setWarningSentAt(LocalDateTime.now(clock));
            dispute = disputeRepository.save(dispute);
            log.info("Dispute warning recorded: disputeId={}", disputeId);
        }
        return dispute;
    }

    public boolean shouldAutoResolve(Dispute dispute) {
        return dispute.shouldAutoResolve(LocalDateTime.now(clock));
    }

    public boolean shouldSendWarning(Dispute dispute) {
        return dispute.shouldSendWarning(LocalDateTime.now(clock), warningPeriod());
    }

    /**
     * Open disputes past their auto-resolve deadline.
     */
    @Transactional(readOnly = true)
    public List<Dispute> findDueForAutoResolve() {
        return disputeRepository.findDueForAutoResolve(DisputeStatus.OPEN, LocalDateTime.now(clock));
    }

    /**
     * Open disputes that have not been warned and are within the warning period of their deadline.
     */
    @Transactional(readOnly = true)
    public List<Dispute> findDueForWarning() {
        LocalDateTime threshold = LocalDateTime.now(clock).plus(warningPeriod());
        return disputeRepository.findDueForWarning(DisputeStatus.OPEN, threshold);
    }

    @Transactional(readOnly = true)
    public Dispute getDispute(@NotNull UUID disputeId) throws DisputeNotFoundException {
        return disputeRepository.findById(disputeId)
                .orElseThrow(() -> new DisputeNotFoundException(disputeId));
    }

    @Transactional(readOnly = true)
    public List<DisputeEvidence> listEvidence(@NotNull UUID disputeId) throws DisputeNotFoundException {
        if (!disputeRepository.existsById(disputeId)) {
            throw new DisputeNotFoundException(disputeId);
        }
        return disputeEvidenceRepository.findByDisputeIdOrderByCreatedAtAsc(disputeId);
    }

    /**
     * Open disputes, nearest auto-resolve deadline first.
     */
    @Transactional(readOnly = true)
    public List<Dispute> listOpen() {
        return disputeRepository.findByStatusOrderByAutoResolveAtAsc(DisputeStatus.OPEN);
    }

    @Transactional(readOnly = true)
    public long countOpen() {
        return disputeRepository.countByStatus(DisputeStatus.OPEN);
    }

    private Duration warningPeriod() {
        return Duration.ofDays(marketplaceProperties.disputeWarningDays());
    }

    /**
     * Result of {@link #resolve}.
     */
    public record Resolved(Dispute dispute, ResolutionSplit split) {
    }
}
