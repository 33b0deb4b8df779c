package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import com.athl3t.backend.model.TradeSide;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Buy or sell at the market price quoted by the caller's price feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotNull
    private AssetType assetType;

    @NotBlank
    @Size(max = 100)
    private String assetName;

    @NotNull
    private TradeSide side;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal unitPrice;

    @Min(1)
    private int quantity;
}
