package com.nosota.mescrow.payment;

import com.nosota.mescrow.error.PaymentFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline payment processor.
 *
 * <p>Tokens have the form {@code cashuA<amount>_<random>_mock}; each can be redeemed once.
 * Invoices have the form {@code lnbc<amount>n1mock<hash>} and every payout succeeds.
 *
 * <p>Configuration:
 * <pre>
 * payment:
 *   processor:
 *     mode: mock   # default
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "payment.processor.mode",
        havingValue = "mock",
        matchIfMissing = true
)
public class MockPaymentProcessor implements PaymentProcessor {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("cashuA(\\d{1,18})_([A-Za-z0-9]+)_mock");
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;

    private final Set<String> spentTokens = ConcurrentHashMap.newKeySet();

    @Override
    public long redeemToken(String token) throws PaymentFailedException {
        Matcher matcher = TOKEN_PATTERN.matcher(token == null ? "" : token);
        if (!matcher.matches()) {
            throw new PaymentFailedException("Invalid token");
        }

        long amount = Long.parseLong(matcher.group(1));
        if (amount <= 0) {
            throw new PaymentFailedException("Invalid token amount");
        }

        if (!spentTokens.add(matcher.group(2))) {
            throw new PaymentFailedException("Token already spent");
        }

        log.info("Redeemed mock token: amount={}", amount);
        return amount;
    }

    @Override
    public DepositInvoice createInvoice(long amount) {
        String hash = randomHex(32);
        String paymentRequest = "lnbc" + amount + "n1mock" + hash.substring(0, 16);
        LocalDateTime expiresAt = LocalDateTime.now(clock).plusHours(1);

        log.info("Created mock deposit invoice: amount={}, paymentHash={}", amount, hash);
        return new DepositInvoice(paymentRequest, hash, amount, expiresAt);
    }

    @Override
    public void payInvoice(String invoice, long amount) throws PaymentFailedException {
        if (invoice == null || !(invoice.startsWith("lnbc") || invoice.startsWith("lntb"))) {
            throw new PaymentFailedException("Invalid invoice format");
        }
        log.info("Paid mock invoice: amount={}", amount);
    }

    /**
     * Issues a fresh, unspent token worth {@code amount} sats.
     */
    public String issueToken(long amount) {
        return "cashuA" + amount + "_" + randomHex(16) + "_mock";
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }
}
