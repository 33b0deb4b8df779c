package com.athl3t.backend.service;

import com.athl3t.backend.model.BetPick;
import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.BetType;
import com.athl3t.backend.model.Game;

import java.math.BigDecimal;

/**
 * Final result of a game and the rule that turns it into a wager outcome.
 *
 * @param homeCovered home score plus spread beats the away score
 * @param spreadPush  home score plus spread equals the away score
 */
public record GameOutcome(int homeScore,
                          int awayScore,
                          BetPick moneylineWinner,
                          boolean homeCovered,
                          boolean spreadPush,
                          boolean over,
                          boolean totalPush) {

    public static GameOutcome of(Game game, int homeScore, int awayScore) {
        return of(homeScore, awayScore, game.getSpread(), game.getTotalLine());
    }

    public static GameOutcome of(int homeScore, int awayScore, BigDecimal spread, BigDecimal totalLine) {
        // a tied game goes to the away side on the moneyline
        BetPick winner = homeScore > awayScore ? BetPick.HOME : BetPick.AWAY;
        int spreadCompare = BigDecimal.valueOf(homeScore).add(spread).compareTo(BigDecimal.valueOf(awayScore));
        int totalCompare = BigDecimal.valueOf((long) homeScore + awayScore).compareTo(totalLine);
        return new GameOutcome(homeScore, awayScore, winner,
                spreadCompare > 0, spreadCompare == 0,
                totalCompare > 0, totalCompare == 0);
    }

    public BetStatus resultFor(BetType betType, BetPick pick) {
        return switch (betType) {
            case MONEYLINE -> won(pick == moneylineWinner);
            case SPREAD -> {
                if (spreadPush) {
                    yield BetStatus.PUSH;
                }
                yield won(pick == BetPick.HOME ? homeCovered : !homeCovered);
            }
            case OVER_UNDER -> {
                if (totalPush) {
                    yield BetStatus.PUSH;
                }
                yield won(pick == BetPick.OVER ? over : !over);
            }
        };
    }

    private static BetStatus won(boolean won) {
        return won ? BetStatus.WON : BetStatus.LOST;
    }
}
