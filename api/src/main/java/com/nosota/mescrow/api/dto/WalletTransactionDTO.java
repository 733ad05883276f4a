package com.nosota.mescrow.api.dto;

import com.nosota.mescrow.api.model.WalletTransactionKind;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class WalletTransactionDTO {
    private UUID id;
    private String userId;
    private WalletTransactionKind kind;
    private Long amount;
    private Long balanceAfter;
    private String referenceId;
    private String description;
    private LocalDateTime createdAt;
}
