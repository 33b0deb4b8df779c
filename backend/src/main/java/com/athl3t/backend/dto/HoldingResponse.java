package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.Holding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingResponse {

    private AssetType assetType;
    private String assetName;
    private int quantity;

    public static HoldingResponse from(Holding holding) {
        return new HoldingResponse(holding.getAssetType(), holding.getAssetName(), holding.getQuantity());
    }
}
