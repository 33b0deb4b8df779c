package com.athl3t.backend.dto;

import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Parlay;
import com.athl3t.backend.model.ParlayLeg;
import com.athl3t.backend.service.ParlayTicket;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParlayResponse {

    private Long id;
    private Long userId;
    private BigDecimal stake;
    private BigDecimal combinedOdds;
    private BigDecimal potentialPayout;
    private BigDecimal payout;
    private BetStatus status;
    private LocalDateTime placedAt;
    private LocalDateTime settledAt;
    private List<Leg> legs;

    public static ParlayResponse from(ParlayTicket ticket) {
        Parlay parlay = ticket.parlay();
        return ParlayResponse.builder()
                .id(parlay.getId())
                .userId(parlay.getUserId())
                .stake(parlay.getStake())
                .combinedOdds(parlay.getCombinedOdds())
                .potentialPayout(parlay.getPotentialPayout())
                .payout(parlay.getPayout())
                .status(parlay.getStatus())
                .placedAt(parlay.getPlacedAt())
                .settledAt(parlay.getSettledAt())
                .legs(ticket.legs().stream().map(Leg::from).toList())
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Leg {
        private Long id;
        private Long gameId;
        private BetType betType;
        private BetPick pick;
        private BigDecimal odds;
        private BetStatus status;

        static Leg from(ParlayLeg leg) {
            return new Leg(leg.getId(), leg.getGameId(), leg.getBetType(), leg.getPick(), leg.getOdds(), leg.getStatus());
        }
    }
}
