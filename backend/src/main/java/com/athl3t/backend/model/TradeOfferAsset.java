package com.athl3t.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "trade_offer_assets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOfferAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "offer_id", nullable = false)
    private Long offerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Direction direction;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, length = 20)
    private AssetType assetType;

    @Column(name = "asset_name", nullable = false, length = 100)
    private String assetName;

    @Column(name = "qty", nullable = false)
    private Integer quantity;

    public enum Direction {
        /** Moves from the initiator to the acceptor. */
        OFFERED,
        /** Moves from the acceptor to the initiator. */
        REQUESTED
    }
}
