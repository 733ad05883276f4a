package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.SellerCategory;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.api.request.PurchaseBondRequest;
import com.nosota.mescrow.api.response.SellerBondResponse;
import com.nosota.mescrow.error.CategoryAlreadyBondedException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.SellerBond;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.service.SellerBondService.BondPurchase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Seller category bonds paid from the wallet. Prices are the defaults: 250000 per category,
 * 600000 for ALL.
 */
@DisplayName("Seller bonds")
public class SellerBondTest extends TestBase {

    @Test
    @DisplayName("BND-001: Paying a category bond debits the wallet and makes the buyer a seller")
    void purchaseSingleCategory() throws Exception {
        // Arrange
        String userId = createBuyer(300_000);

        // Act
        BondPurchase purchase = sellerBondService.purchaseBond(userId, SellerCategory.DIGITAL);

        // Assert
        assertThat(purchase.bondPaid()).isEqualTo(250_000);
        assertThat(purchase.walletBalance()).isEqualTo(50_000);
        assertThat(purchase.role()).isEqualTo(UserRole.SELLER);
        assertThat(walletLedgerService.getUser(userId).getRole()).isEqualTo(UserRole.SELLER);
        assertThat(balanceOf(userId)).isEqualTo(50_000);

        List<WalletTransaction> entries = walletTransactionRepository.findByReferenceIdAndKind(
                "bond-digital", WalletTransactionKind.BOND);
        assertThat(entries).filteredOn(e -> e.getUserId().equals(userId))
                .singleElement()
                .satisfies(e -> assertThat(e.getAmount()).isEqualTo(-250_000));

        assertThat(sellerBondService.canSellIn(userId, SellerCategory.DIGITAL)).isTrue();
        assertThat(sellerBondService.canSellIn(userId, SellerCategory.PHYSICAL)).isFalse();
        assertThat(walletLedgerService.reconcile(userId).consistent()).isTrue();
    }

    @Test
    @DisplayName("BND-002: The ALL bond unlocks the three categories in one debit")
    void purchaseAllCategories() throws Exception {
        String userId = createBuyer(600_000);

        BondPurchase purchase = sellerBondService.purchaseBond(userId, SellerCategory.ALL);

        assertThat(purchase.walletBalance()).isZero();
        assertThat(purchase.categories()).extracting(SellerBond::getCategory)
                .containsExactlyInAnyOrder(SellerCategory.DIGITAL, SellerCategory.PHYSICAL, SellerCategory.SERVICES);
        assertThat(purchase.categories()).extracting(SellerBond::getBondPaid)
                .containsOnly(200_000L);
        assertThat(sellerBondService.canSellIn(userId, SellerCategory.ALL)).isTrue();
        assertThat(sellerBondService.canSellIn(userId, SellerCategory.SERVICES)).isTrue();
    }

    @Test
    @DisplayName("BND-003: A held category cannot be bought again, nor ALL on top of it")
    void duplicateCategoryRejected() throws Exception {
        String userId = createBuyer(1_000_000);
        sellerBondService.purchaseBond(userId, SellerCategory.PHYSICAL);

        assertThatThrownBy(() -> sellerBondService.purchaseBond(userId, SellerCategory.PHYSICAL))
                .isInstanceOf(CategoryAlreadyBondedException.class);
        assertThatThrownBy(() -> sellerBondService.purchaseBond(userId, SellerCategory.ALL))
                .isInstanceOf(CategoryAlreadyBondedException.class);

        assertThat(balanceOf(userId)).isEqualTo(750_000);
        assertThat(sellerBondService.listCategories(userId)).extracting(SellerBond::getCategory)
                .containsExactly(SellerCategory.PHYSICAL);

        // other categories can still be added one by one
        sellerBondService.purchaseBond(userId, SellerCategory.SERVICES);
        assertThat(balanceOf(userId)).isEqualTo(500_000);
    }

    @Test
    @DisplayName("BND-004: A wallet that cannot cover the bond changes nothing")
    void insufficientBalance() throws Exception {
        String userId = createBuyer(249_999);

        assertThatThrownBy(() -> sellerBondService.purchaseBond(userId, SellerCategory.SERVICES))
                .isInstanceOf(InsufficientBalanceException.class)
                .satisfies(e -> {
                    assertThat(((InsufficientBalanceException) e).getNeeded()).isEqualTo(250_000);
                    assertThat(((InsufficientBalanceException) e).getAvailable()).isEqualTo(249_999);
                });

        assertThat(balanceOf(userId)).isEqualTo(249_999);
        assertThat(walletLedgerService.getUser(userId).getRole()).isEqualTo(UserRole.BUYER);
        assertThat(sellerBondService.listCategories(userId)).isEmpty();
    }

    @Test
    @DisplayName("BND-005: Unknown users are rejected")
    void unknownUser() {
        assertThatThrownBy(() -> sellerBondService.purchaseBond("nobody-" + System.nanoTime(), SellerCategory.DIGITAL))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("BND-006: Sellers and admins keep their role when paying a bond")
    void roleKeptForSellerAndAdmin() throws Exception {
        String seller = createUserWithBalance(UserRole.SELLER, 250_000);
        String admin = createUserWithBalance(UserRole.ADMIN, 250_000);

        assertThat(sellerBondService.purchaseBond(seller, SellerCategory.DIGITAL).role()).isEqualTo(UserRole.SELLER);
        assertThat(sellerBondService.purchaseBond(admin, SellerCategory.DIGITAL).role()).isEqualTo(UserRole.ADMIN);
        assertThat(walletLedgerService.getUser(admin).getRole()).isEqualTo(UserRole.ADMIN);
    }

    @Test
    @DisplayName("BND-007: Concurrent purchases of one category debit once")
    void concurrentPurchases() throws Exception {
        // Arrange
        String userId = createBuyer(1_000_000);
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // Act
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                startSignal.await();
                try {
                    sellerBondService.purchaseBond(userId, SellerCategory.DIGITAL);
                    return true;
                } catch (CategoryAlreadyBondedException e) {
                    return false;
                }
            }));
        }
        startSignal.countDown();

        int succeeded = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        executor.shutdown();

        // Assert
        assertThat(succeeded).isEqualTo(1);
        assertThat(balanceOf(userId)).isEqualTo(750_000);
        assertThat(sellerBondService.listCategories(userId)).hasSize(1);
    }

    @Test
    @DisplayName("BND-008: Bonds over HTTP: 201, then 409 on repeat, 400 on an unknown category")
    void bondsOverHttp() throws Exception {
        String userId = createBuyer(260_000);

        MvcResult result = mockMvc.perform(post("/api/v1/sellers/{userId}/bonds", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PurchaseBondRequest(SellerCategory.SERVICES))))
                .andExpect(status().isCreated())
                .andReturn();

        SellerBondResponse response = objectMapper.readValue(
                result.getResponse().getContentAsString(), SellerBondResponse.class);
        assertThat(response.role()).isEqualTo(UserRole.SELLER);
        assertThat(response.walletBalance()).isEqualTo(10_000);
        assertThat(response.categories()).hasSize(1);

        mockMvc.perform(post("/api/v1/sellers/{userId}/bonds", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new PurchaseBondRequest(SellerCategory.SERVICES))))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/sellers/{userId}/bonds", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"jewelry\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/sellers/{userId}/categories", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].category").value("SERVICES"))
                .andExpect(jsonPath("$[0].bondPaid").value(250_000));
    }
}
