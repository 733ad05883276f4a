package com.nosota.mescrow.api;

import com.nosota.mescrow.api.dto.PagedResponse;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.request.DepositInvoiceRequest;
import com.nosota.mescrow.api.request.DepositTokenRequest;
import com.nosota.mescrow.api.request.RegisterUserRequest;
import com.nosota.mescrow.api.request.WithdrawalRequest;
import com.nosota.mescrow.api.response.DepositInvoiceResponse;
import com.nosota.mescrow.api.response.UserWalletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of WalletApi for consuming the escrow service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MEscrowClientConfig {
 *     @Bean
 *     public WebClient mescrowWebClient(WebClient.Builder builder,
 *                                       @Value("${services.mescrow.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public WalletClient walletClient(WebClient mescrowWebClient) {
 *         return new WalletClient(mescrowWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<UserWalletResponse> registerUser(RegisterUserRequest request) {
        log.debug("Calling registerUser: userId={}, role={}", request.userId(), request.role());

        return webClient.post()
                .uri("/api/v1/wallets/users")
                .bodyValue(request)
                .retrieve()
                .toEntity(UserWalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UserWalletResponse> getWallet(String userId) {
        log.debug("Calling getWallet: userId={}", userId);

        return webClient.get()
                .uri("/api/v1/wallets/users/{userId}", userId)
                .retrieve()
                .toEntity(UserWalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(String userId, int page, int size) {
        log.debug("Calling getTransactions: userId={}, page={}, size={}", userId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/wallets/users/{userId}/transactions")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(userId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WalletTransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<UserWalletResponse> depositToken(String userId, DepositTokenRequest request) {
        log.debug("Calling depositToken: userId={}", userId);

        return webClient.post()
                .uri("/api/v1/wallets/users/{userId}/deposit-token", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(UserWalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DepositInvoiceResponse> createDepositInvoice(String userId, DepositInvoiceRequest request) {
        log.debug("Calling createDepositInvoice: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri("/api/v1/wallets/users/{userId}/deposit-invoice", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(DepositInvoiceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UserWalletResponse> withdraw(String userId, WithdrawalRequest request) {
        log.debug("Calling withdraw: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri("/api/v1/wallets/users/{userId}/withdraw", userId)
                .bodyValue(request)
                .retrieve()
                .toEntity(UserWalletResponse.class)
                .block();
    }
}
