package com.athl3t.backend.dto;

import com.athl3t.backend.model.AssetType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOfferRequest {

    /** Leave empty for an open offer. */
    private Long counterpartyId;

    @Size(max = 500)
    private String description;

    @Valid
    @Builder.Default
    private List<Asset> offered = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<Asset> requested = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Asset {
        @NotNull
        private AssetType assetType;

        @NotBlank
        @Size(max = 100)
        private String assetName;

        @Min(1)
        private int quantity;
    }
}
