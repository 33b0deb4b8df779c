package com.athl3t.backend.dto;

import com.athl3t.backend.model.Bet;
import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.BetType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BetResponse {

    private Long id;
    private Long userId;
    private Long gameId;
    private BetType betType;
    private BetPick pick;
    private BigDecimal stake;
    private BigDecimal odds;
    private BigDecimal potentialPayout;
    private BetStatus status;
    private LocalDateTime placedAt;
    private LocalDateTime settledAt;

    public static BetResponse from(Bet bet) {
        return BetResponse.builder()
                .id(bet.getId())
                .userId(bet.getUserId())
                .gameId(bet.getGameId())
                .betType(bet.getBetType())
                .pick(bet.getPick())
                .stake(bet.getStake())
                .odds(bet.getOdds())
                .potentialPayout(bet.getPotentialPayout())
                .status(bet.getStatus())
                .placedAt(bet.getPlacedAt())
                .settledAt(bet.getSettledAt())
                .build();
    }
}
