package com.athl3t.backend.service;

import java.math.BigDecimal;

public record SettlementReport(Long gameId,
                               int homeScore,
                               int awayScore,
                               int betsWon,
                               int betsLost,
                               int betsPushed,
                               int legsResolved,
                               int parlaysDecided,
                               BigDecimal totalCredited) {
}
