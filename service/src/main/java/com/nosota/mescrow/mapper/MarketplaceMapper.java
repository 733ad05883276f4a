package com.nosota.mescrow.mapper;

import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.response.CheckoutItemResponse;
import com.nosota.mescrow.api.response.DisputeResponse;
import com.nosota.mescrow.api.response.EscrowResponse;
import com.nosota.mescrow.api.response.EvidenceResponse;
import com.nosota.mescrow.api.response.OrderResponse;
import com.nosota.mescrow.api.response.SellerBondResponse;
import com.nosota.mescrow.api.response.SellerCategoryResponse;
import com.nosota.mescrow.api.response.UserWalletResponse;
import com.nosota.mescrow.model.CheckoutItem;
import com.nosota.mescrow.model.Dispute;
import com.nosota.mescrow.model.DisputeEvidence;
import com.nosota.mescrow.model.DisputeResolution;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.SellerBond;
import com.nosota.mescrow.model.User;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.service.SellerBondService.BondPurchase;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from entities to API responses.
 */
@Mapper
public interface MarketplaceMapper {

    MarketplaceMapper INSTANCE = Mappers.getMapper(MarketplaceMapper.class);

    UserWalletResponse toWalletResponse(User user);

    WalletTransactionDTO toDTO(WalletTransaction transaction);

    List<WalletTransactionDTO> toDTOList(List<WalletTransaction> transactions);

    EscrowResponse toEscrowResponse(Escrow escrow);

    OrderResponse toOrderResponse(Order order);

    List<OrderResponse> toOrderResponseList(List<Order> orders);

    DisputeResponse toDisputeResponse(Dispute dispute);

    List<DisputeResponse> toDisputeResponseList(List<Dispute> disputes);

    EvidenceResponse toEvidenceResponse(DisputeEvidence evidence);

    List<EvidenceResponse> toEvidenceResponseList(List<DisputeEvidence> evidence);

    CheckoutItemResponse toCheckoutItemResponse(CheckoutItem item);

    List<CheckoutItemResponse> toCheckoutItemResponseList(List<CheckoutItem> items);

    SellerCategoryResponse toSellerCategoryResponse(SellerBond bond);

    List<SellerCategoryResponse> toSellerCategoryResponseList(List<SellerBond> bonds);

    SellerBondResponse toSellerBondResponse(BondPurchase purchase);

    default String resolutionToString(DisputeResolution resolution) {
        return resolution == null ? null : resolution.asString();
    }
}
