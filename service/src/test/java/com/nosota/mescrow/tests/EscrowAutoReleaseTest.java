package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.EscrowStatus;
import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.model.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Auto-release sweep, driven directly with a shifted clock. Other tests' escrows share the
 * database, so assertions target the escrows created here.
 */
@DisplayName("Escrow auto-release")
public class EscrowAutoReleaseTest extends TestBase {

    @Test
    @DisplayName("AUT-001: Escrow past its hold period is released to the seller")
    void releasesDueEscrow() throws Exception {
        // Arrange
        String buyer = createBuyer(1010);
        String seller = createSeller();
        Order order = purchase(buyer, seller, 1000);

        // Act
        clock.advance(Duration.ofDays(11));
        int released = escrowService.processAutoReleases();

        // Assert
        assertThat(released).isGreaterThanOrEqualTo(1);
        assertThat(escrowService.getEscrow(order.getEscrowId()).getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(orderService.getOrder(order.getId()).getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(balanceOf(seller)).isEqualTo(1000);
    }

    @Test
    @DisplayName("AUT-002: Escrow still inside its hold period is left alone")
    void keepsEscrowBeforeDeadline() throws Exception {
        String buyer = createBuyer(1000);
        String seller = createSeller();
        Escrow escrow = escrowService.createEscrow(buyer, seller, 1000, 10);

        clock.advance(Duration.ofDays(9));
        escrowService.processAutoReleases();

        assertThat(escrowService.getEscrow(escrow.getId()).getStatus()).isEqualTo(EscrowStatus.HELD);
        assertThat(balanceOf(seller)).isZero();
    }

    @Test
    @DisplayName("AUT-003: Repeated sweeps release an escrow once")
    void sweepIsIdempotent() throws Exception {
        String buyer = createBuyer(700);
        String seller = createSeller();
        Escrow escrow = escrowService.createEscrow(buyer, seller, 700, 0);

        clock.advance(Duration.ofSeconds(1));
        escrowService.processAutoReleases();
        escrowService.processAutoReleases();

        assertThat(escrowService.getEscrow(escrow.getId()).getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(balanceOf(seller)).isEqualTo(700);
    }

    @Test
    @DisplayName("AUT-004: Refunded escrows are never released")
    void refundedEscrowSkipped() throws Exception {
        String buyer = createBuyer(400);
        String seller = createSeller();
        Escrow escrow = escrowService.createEscrow(buyer, seller, 400, 1);
        escrowService.refund(escrow.getId());

        clock.advance(Duration.ofDays(2));
        escrowService.processAutoReleases();

        assertThat(escrowService.getEscrow(escrow.getId()).getStatus()).isEqualTo(EscrowStatus.REFUNDED);
        assertThat(balanceOf(seller)).isZero();
        assertThat(balanceOf(buyer)).isEqualTo(400);
    }

    @Test
    @DisplayName("AUT-005: One sweep releases the due HELD escrow and skips the due DISPUTED one")
    void sweepSkipsDisputedInSameTick() throws Exception {
        // Release whatever other tests left due, so the count below covers only this test
        clock.advance(Duration.ofDays(365));
        escrowService.processAutoReleases();

        String buyer = createBuyer(1000);
        String seller = createSeller();
        Escrow held = escrowService.createEscrow(buyer, seller, 600, 0);
        Escrow disputed = escrowService.createEscrow(buyer, seller, 400, 0);
        escrowService.markDisputed(disputed.getId());

        // Act
        clock.advance(Duration.ofSeconds(1));
        int released = escrowService.processAutoReleases();

        // Assert
        assertThat(released).isEqualTo(1);
        assertThat(escrowService.getEscrow(held.getId()).getStatus()).isEqualTo(EscrowStatus.RELEASED);
        Escrow untouched = escrowService.getEscrow(disputed.getId());
        assertThat(untouched.getStatus()).isEqualTo(EscrowStatus.DISPUTED);
        assertThat(untouched.getResolvedAt()).isNull();
        assertThat(balanceOf(seller)).isEqualTo(600);
        assertThat(balanceOf(buyer)).isZero();
    }
}
