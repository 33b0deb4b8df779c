package com.athl3t.backend.dto;

import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.GameStatus;
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
public class GameResponse {

    private Long id;
    private String homeTeam;
    private String awayTeam;
    private LocalDateTime scheduledAt;
    private BigDecimal homeOdds;
    private BigDecimal awayOdds;
    private BigDecimal spread;
    private BigDecimal totalLine;
    private GameStatus status;
    private Integer homeScore;
    private Integer awayScore;

    public static GameResponse from(Game game) {
        return GameResponse.builder()
                .id(game.getId())
                .homeTeam(game.getHomeTeam())
                .awayTeam(game.getAwayTeam())
                .scheduledAt(game.getScheduledAt())
                .homeOdds(game.getHomeOdds())
                .awayOdds(game.getAwayOdds())
                .spread(game.getSpread())
                .totalLine(game.getTotalLine())
                .status(game.getStatus())
                .homeScore(game.getHomeScore())
                .awayScore(game.getAwayScore())
                .build();
    }
}
