package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.TradeOffer;
import com.athl3t.backend.model.TradeOfferAsset;
import com.athl3t.backend.model.TradeOfferStatus;
import com.athl3t.backend.service.TradeOfferDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOfferResponse {

    private Long id;
    private Long initiatorId;
    private Long counterpartyId;
    private String description;
    private TradeOfferStatus status;
    private Long acceptedBy;
    private List<Asset> offered;
    private List<Asset> requested;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static TradeOfferResponse from(TradeOfferDetails details) {
        TradeOffer offer = details.offer();
        return TradeOfferResponse.builder()
                .id(offer.getId())
                .initiatorId(offer.getInitiatorId())
                .counterpartyId(offer.getCounterpartyId())
                .description(offer.getDescription())
                .status(offer.getStatus())
                .acceptedBy(offer.getAcceptedBy())
                .offered(details.offered().stream().map(Asset::from).toList())
                .requested(details.requested().stream().map(Asset::from).toList())
                .createdAt(offer.getCreatedAt())
                .updatedAt(offer.getUpdatedAt())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Asset {
        private AssetType assetType;
        private String assetName;
        private int quantity;

        static Asset from(TradeOfferAsset asset) {
            return new Asset(asset.getAssetType(), asset.getAssetName(), asset.getQuantity());
        }
    }
}
