package com.athl3t.backend.dto;

import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateParlayRequest {

    @NotNull
    private BigDecimal stake;

    @NotEmpty
    @Valid
    private List<@NotNull Leg> legs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Leg {
        @NotNull
        private Long gameId;

        @NotNull
        private BetType betType;

        @NotNull
        private BetPick pick;
    }
}
