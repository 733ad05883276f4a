package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.SellerCategory;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.config.SellerBondProperties;
import com.nosota.mescrow.error.CategoryAlreadyBondedException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.SellerBond;
import com.nosota.mescrow.repository.SellerBondRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Seller category bonds.
 *
 * <p>A bond is a wallet debit (BOND, referenceId {@code bond-<category>}) that unlocks one
 * listing category, or all three at the ALL price. Paying the first bond turns a BUYER into a
 * SELLER. Bonds are not refundable.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SellerBondService {

    private static final List<SellerCategory> LISTING_CATEGORIES =
            List.of(SellerCategory.DIGITAL, SellerCategory.PHYSICAL, SellerCategory.SERVICES);

    private final SellerBondRepository sellerBondRepository;
    private final WalletLedgerService walletLedgerService;
    private final SellerBondProperties sellerBondProperties;
    private final Clock clock;

    /**
     * Debits the bond for {@code category} and records the unlocked categories.
     *
     * <p>ALL is only sold to users who hold none of the three categories yet. The ALL price is
     * recorded as three equal shares, the first one taking the remainder.
     *
     * @param userId   Paying user
     * @param category Category to unlock
     * @return Debited amount, role and balance afterwards, and every category the user holds
     * @throws UserNotFoundException          if the user does not exist
     * @throws CategoryAlreadyBondedException if the user already holds the category (or any, for ALL)
     * @throws InsufficientBalanceException   if the wallet does not cover the bond
     */
    @Transactional(rollbackFor = Exception.class)
    public BondPurchase purchaseBond(@NotBlank String userId, @NotNull SellerCategory category)
            throws UserNotFoundException, CategoryAlreadyBondedException, InsufficientBalanceException {
        // serializes purchases of the same user before the ownership check
        walletLedgerService.lockBalance(userId);

        boolean alreadyHeld = category == SellerCategory.ALL
                ? sellerBondRepository.existsByUserId(userId)
                : sellerBondRepository.existsByUserIdAndCategory(userId, category);
        if (alreadyHeld) {
            log.info("Bond rejected, category already held: userId={}, category={}", userId, category);
            throw new CategoryAlreadyBondedException(userId, category);
        }

        long amount = sellerBondProperties.bondFor(category);
        long balance = amount > 0
                ? walletLedgerService.debit(userId, amount, WalletTransactionKind.BOND,
                        "bond-" + category.name().toLowerCase(), "Seller bond for " + category + " category")
                : walletLedgerService.lockBalance(userId);

        LocalDateTime now = LocalDateTime.now(clock);
        if (category == SellerCategory.ALL) {
            long share = amount / LISTING_CATEGORIES.size();
            long remainder = amount % LISTING_CATEGORIES.size();
            for (SellerCategory listingCategory : LISTING_CATEGORIES) {
                saveBond(userId, listingCategory, share + remainder, now);
                remainder = 0;
            }
        } else {
            saveBond(userId, category, amount, now);
        }

        UserRole role = walletLedgerService.promoteToSeller(userId);

        log.info("Seller bond paid: userId={}, category={}, amount={}, role={}, balance={}",
                userId, category, amount, role, balance);
        return new BondPurchase(userId, role, amount, balance, listCategories(userId));
    }

    @Transactional(readOnly = true)
    public List<SellerBond> listCategories(@NotBlank String userId) throws UserNotFoundException {
        walletLedgerService.requireUser(userId);
        return sellerBondRepository.findByUserIdOrderByCategoryAsc(userId);
    }

    /**
     * Whether the user holds a bond for {@code category}. For ALL, whether it holds all three.
     */
    @Transactional(readOnly = true)
    public boolean canSellIn(@NotBlank String userId, @NotNull SellerCategory category) {
        if (category != SellerCategory.ALL) {
            return sellerBondRepository.existsByUserIdAndCategory(userId, category);
        }
        List<SellerCategory> held = new ArrayList<>();
        for (SellerBond bond : sellerBondRepository.findByUserIdOrderByCategoryAsc(userId)) {
            held.add(bond.getCategory());
        }
        return held.containsAll(LISTING_CATEGORIES);
    }

    private void saveBond(String userId, SellerCategory category, long bondPaid, LocalDateTime now) {
        SellerBond bond = new SellerBond();
        bond.setUserId(userId);
        bond.setCategory(category);
        bond.setBondPaid(bondPaid);
        bond.setPaidAt(now);
        sellerBondRepository.save(bond);
    }

    /**
     * Result of {@link #purchaseBond}.
     */
    public record BondPurchase(String userId, UserRole role, long bondPaid, long walletBalance,
                               List<SellerBond> categories) {
    }
}
