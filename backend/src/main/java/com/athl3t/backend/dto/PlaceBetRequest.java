package com.athl3t.backend.dto;

import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceBetRequest {

    @NotNull
    private Long gameId;

    @NotNull
    private BetType betType;

    @NotNull
    private BetPick pick;

    // minimum enforced by the service so it reports INVALID_STAKE
    @NotNull
    private BigDecimal stake;
}
