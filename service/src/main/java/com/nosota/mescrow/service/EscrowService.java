package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.EscrowStatus;
import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.config.MarketplaceProperties;
import com.nosota.mescrow.error.EscrowAlreadyRefundedException;
import com.nosota.mescrow.error.EscrowAlreadyReleasedException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.MarketplaceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.DisputeResolution;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.ResolutionSplit;
import com.nosota.mescrow.repository.EscrowRepository;
import com.nosota.mescrow.repository.OrderRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Escrow engine. The only component that moves escrowed funds.
 *
 * <p>Operations:
 * <ul>
 *   <li>{@link #createEscrow} - debit buyer (ESCROW_HOLD), persist HELD escrow</li>
 *   <li>{@link #release} - HELD → RELEASED, credit seller (ESCROW_RELEASE), order COMPLETED</li>
 *   <li>{@link #refund} - HELD/DISPUTED → REFUNDED, credit buyer (ESCROW_REFUND), order REFUNDED</li>
 *   <li>{@link #markDisputed} - HELD → DISPUTED, no money moves</li>
 *   <li>{@link #resolveDispute} - DISPUTED → RELEASED/REFUNDED, credit buyer and/or seller per resolution</li>
 *   <li>{@link #processAutoReleases} - release every HELD escrow past its auto-release moment</li>
 * </ul>
 *
 * <p>Every status check runs under a row lock on the escrow. Locks are taken escrow first,
 * then the linked order, then users.
 * Ledger entries created here carry the escrow ID as their reference.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final EscrowRepository escrowRepository;
    private final OrderRepository orderRepository;
    private final WalletLedgerService walletLedgerService;
    private final EscrowStateMachine escrowStateMachine;
    private final MarketplaceProperties marketplaceProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Creates a HELD escrow with the default hold period.
     *
     * @see #createEscrow(String, String, long, int)
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow createEscrow(@NotBlank String buyerId, @NotBlank String sellerId, long amount)
            throws UserNotFoundException, InsufficientBalanceException {
        return createEscrow(buyerId, sellerId, amount, marketplaceProperties.escrowHoldDays());
    }

    /**
     * Creates a HELD escrow.
     *
     * <p>The buyer is debited {@code amount} (kind ESCROW_HOLD, referenceId = escrow ID) and the
     * escrow is persisted with {@code autoReleaseAt = now + holdDays}. Either both happen or neither.
     *
     * @param buyerId  Buyer whose wallet is debited
     * @param sellerId Seller who receives the funds on release
     * @param amount   Amount in sats
     * @param holdDays Days until auto-release
     * @return Created escrow
     * @throws IllegalArgumentException     if {@code amount} is not positive or {@code holdDays} is negative
     * @throws UserNotFoundException        if the buyer or the seller does not exist
     * @throws InsufficientBalanceException if the buyer cannot cover {@code amount}
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow createEscrow(@NotBlank String buyerId, @NotBlank String sellerId, long amount, int holdDays)
            throws UserNotFoundException, InsufficientBalanceException {
        if (amount <= 0) {
            throw new IllegalArgumentException("Escrow amount must be positive: " + amount);
        }
        if (holdDays < 0) {
            throw new IllegalArgumentException("Hold days must not be negative: " + holdDays);
        }

        walletLedgerService.requireUser(sellerId);

        UUID escrowId = UUID.randomUUID();
        walletLedgerService.debit(buyerId, amount, WalletTransactionKind.ESCROW_HOLD, escrowId.toString(),
                "Escrow hold for seller " + sellerId);

        LocalDateTime now = LocalDateTime.now(clock);
        Escrow escrow = new Escrow();
        escrow.setId(escrowId);
        escrow.setBuyerId(buyerId);
        escrow.setSellerId(sellerId);
        escrow.setAmount(amount);
        escrow.setStatus(EscrowStatus.HELD);
        escrow.setAutoReleaseAt(now.plusDays(holdDays));
        escrow.setCreatedAt(now);
        escrow = escrowRepository.save(escrow);

        log.info("Created escrow: escrowId={}, buyerId={}, sellerId={}, amount={}, autoReleaseAt={}",
                escrowId, buyerId, sellerId, amount, escrow.getAutoReleaseAt());
        return escrow;
    }

    /**
     * Releases a HELD escrow to the seller and completes the linked order.
     *
     * @param escrowId Escrow ID
     * @return Released escrow
     * @throws EscrowNotFoundException        if the escrow does not exist
     * @throws EscrowAlreadyReleasedException if the escrow is not HELD
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow release(@NotNull UUID escrowId)
            throws EscrowNotFoundException, EscrowAlreadyReleasedException, UserNotFoundException {
        Escrow escrow = lockEscrow(escrowId);

        if (escrow.getStatus() != EscrowStatus.HELD) {
            log.debug("Release rejected: escrowId={}, status={}", escrowId, escrow.getStatus());
            throw new EscrowAlreadyReleasedException(escrowId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        transition(escrow, EscrowStatus.RELEASED, now);
        updateOrder(escrowId, OrderStatus.COMPLETED, now);

        walletLedgerService.credit(escrow.getSellerId(), escrow.getAmount(),
                WalletTransactionKind.ESCROW_RELEASE, escrowId.toString());

        log.info("Released escrow: escrowId={}, sellerId={}, amount={}",
                escrowId, escrow.getSellerId(), escrow.getAmount());
        return escrow;
    }

    /**
     * Returns a HELD or DISPUTED escrow to the buyer and marks the linked order REFUNDED.
     *
     * @param escrowId Escrow ID
     * @return Refunded escrow
     * @throws EscrowNotFoundException        if the escrow does not exist
     * @throws EscrowAlreadyReleasedException if the escrow is already RELEASED
     * @throws EscrowAlreadyRefundedException if the escrow is already REFUNDED
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow refund(@NotNull UUID escrowId)
            throws EscrowNotFoundException, EscrowAlreadyReleasedException, EscrowAlreadyRefundedException,
            UserNotFoundException {
        Escrow escrow = lockEscrow(escrowId);

        if (escrowStateMachine.isFinalState(escrow.getStatus())) {
            log.debug("Refund rejected: escrowId={}, status={}", escrowId, escrow.getStatus());
            if (escrow.getStatus() == EscrowStatus.RELEASED) {
                throw new EscrowAlreadyReleasedException(escrowId);
            }
            throw new EscrowAlreadyRefundedException(escrowId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        transition(escrow, EscrowStatus.REFUNDED, now);
        updateOrder(escrowId, OrderStatus.REFUNDED, now);

        walletLedgerService.credit(escrow.getBuyerId(), escrow.getAmount(),
                WalletTransactionKind.ESCROW_REFUND, escrowId.toString());

        log.info("Refunded escrow: escrowId={}, buyerId={}, amount={}",
                escrowId, escrow.getBuyerId(), escrow.getAmount());
        return escrow;
    }

    /**
     * Moves a HELD escrow to DISPUTED. Any other status is left alone.
     *
     * @param escrowId Escrow ID
     * @return true if the escrow changed to DISPUTED
     * @throws EscrowNotFoundException if the escrow does not exist
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean markDisputed(@NotNull UUID escrowId) throws EscrowNotFoundException {
        int updated = escrowRepository.transitionStatus(escrowId, EscrowStatus.HELD, EscrowStatus.DISPUTED);
        if (updated == 1) {
            log.info("Escrow disputed: escrowId={}", escrowId);
            return true;
        }

        if (!escrowRepository.existsById(escrowId)) {
            throw new EscrowNotFoundException(escrowId);
        }
        log.debug("markDisputed skipped, escrow not HELD: escrowId={}", escrowId);
        return false;
    }

    /**
     * Settles a DISPUTED escrow according to an adjudicator's resolution.
     *
     * <p>Nonzero buyer and seller shares are credited (ESCROW_REFUND / ESCROW_RELEASE).
     * Whatever is left (burn, split rounding) is credited to nobody.
     * The escrow ends REFUNDED for {@code buyer_full} and RELEASED otherwise; the order follows
     * (REFUNDED or COMPLETED).
     *
     * @param escrowId   Escrow ID
     * @param resolution Adjudicator decision
     * @return Computed split
     * @throws EscrowNotFoundException if the escrow does not exist or is not DISPUTED
     */
    @Transactional(rollbackFor = Exception.class)
    public ResolutionSplit resolveDispute(@NotNull UUID escrowId, @NotNull DisputeResolution resolution)
            throws EscrowNotFoundException, UserNotFoundException {
        Escrow escrow = escrowRepository.findByIdForUpdate(escrowId)
                .filter(e -> e.getStatus() == EscrowStatus.DISPUTED)
                .orElseThrow(() -> new EscrowNotFoundException(
                        "Escrow not found in disputed state: " + escrowId));

        ResolutionSplit split = resolution.apply(escrow.getAmount());

        LocalDateTime now = LocalDateTime.now(clock);
        if (resolution.isFullRefund()) {
            transition(escrow, EscrowStatus.REFUNDED, now);
            updateOrder(escrowId, OrderStatus.REFUNDED, now);
        } else {
            transition(escrow, EscrowStatus.RELEASED, now);
            updateOrder(escrowId, OrderStatus.COMPLETED, now);
        }

        // both parties, in id order, before either credit
        walletLedgerService.lockUsers(escrow.getBuyerId(), escrow.getSellerId());
        if (split.buyer() > 0) {
            walletLedgerService.credit(escrow.getBuyerId(), split.buyer(),
                    WalletTransactionKind.ESCROW_REFUND, escrowId.toString(), "Dispute resolution: " + resolution);
        }
        if (split.seller() > 0) {
            walletLedgerService.credit(escrow.getSellerId(), split.seller(),
                    WalletTransactionKind.ESCROW_RELEASE, escrowId.toString(), "Dispute resolution: " + resolution);
        }
        if (split.destroyed() > 0) {
            log.warn("Escrow funds destroyed by resolution: escrowId={}, resolution={}, destroyed={}",
                    escrowId, resolution, split.destroyed());
        }

        log.info("Resolved disputed escrow: escrowId={}, resolution={}, buyer={}, seller={}, destroyed={}",
                escrowId, resolution, split.buyer(), split.seller(), split.destroyed());
        return split;
    }

    /**
     * Releases every HELD escrow whose {@code autoReleaseAt} is at or before now.
     *
     * <p>Each escrow is released in its own transaction. An escrow that stopped being HELD since
     * the query (confirmed by the buyer, disputed, released by another instance) is skipped;
     * any other failure is logged and the sweep moves on.
     *
     * @return Number of escrows released by this call
     */
    public int processAutoReleases() {
        List<UUID> due = escrowRepository.findIdsDueForAutoRelease(EscrowStatus.HELD, LocalDateTime.now(clock));
        if (due.isEmpty()) {
            return 0;
        }

        log.info("Auto-release sweep: dueCount={}", due.size());
        int released = 0;
        for (UUID escrowId : due) {
            try {
                Boolean done = transactionTemplate.execute(status -> releaseIfStillHeld(escrowId));
                if (Boolean.TRUE.equals(done)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("Auto-release failed: escrowId={}, error={}", escrowId, e.getMessage(), e);
            }
        }

        log.info("Auto-release sweep finished: released={}, due={}", released, due.size());
        return released;
    }

    @Transactional(readOnly = true)
    public Escrow getEscrow(@NotNull UUID escrowId) throws EscrowNotFoundException {
        return escrowRepository.findById(escrowId)
                .orElseThrow(() -> new EscrowNotFoundException(escrowId));
    }

    /**
     * Funds currently locked in escrow (HELD or DISPUTED).
     */
    @Transactional(readOnly = true)
    public long totalHeld() {
        return escrowRepository.sumAmountByStatusIn(List.of(EscrowStatus.HELD, EscrowStatus.DISPUTED));
    }

    private boolean releaseIfStillHeld(UUID escrowId) {
        try {
            release(escrowId);
            return true;
        } catch (EscrowAlreadyReleasedException e) {
            log.debug("Auto-release skipped, escrow no longer held: escrowId={}", escrowId);
            return false;
        } catch (MarketplaceException e) {
            throw new IllegalStateException("Auto-release of escrow " + escrowId + " failed: " + e.getMessage(), e);
        }
    }

    private Escrow lockEscrow(UUID escrowId) throws EscrowNotFoundException {
        return escrowRepository.findByIdForUpdate(escrowId)
                .orElseThrow(() -> new EscrowNotFoundException(escrowId));
    }

    private void transition(Escrow escrow, EscrowStatus target, LocalDateTime now) {
        escrowStateMachine.validateTransition(escrow.getStatus(), target);
        escrow.setStatus(target);
        escrow.setResolvedAt(now);
        escrowRepository.save(escrow);
    }

    private void updateOrder(UUID escrowId, OrderStatus status, LocalDateTime now) {
        Order order = orderRepository.findByEscrowIdForUpdate(escrowId).orElse(null);
        if (order == null) {
            // escrows created directly (not through checkout) have no order
            log.debug("No order linked to escrow: escrowId={}", escrowId);
            return;
        }

        order.setStatus(status);
        if (status == OrderStatus.COMPLETED) {
            order.setCompletedAt(now);
        }
        orderRepository.save(order);
        log.info("Order updated from escrow: orderId={}, escrowId={}, status={}", order.getId(), escrowId, status);
    }
}
