package com.athl3t.backend.controller;

import com.athl3t.backend.dto.GameResponse;
import com.athl3t.backend.dto.ScheduleGameRequest;
import com.athl3t.backend.dto.SettleGameRequest;
import com.athl3t.backend.service.GameService;
import com.athl3t.backend.service.SettlementReport;
import com.athl3t.backend.service.SettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Game schedule and results. Scheduling and settlement are fed by the odds and
 * score providers rather than end users.
 */
@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@Tag(name = "Games")
public class GameController {

    private final GameService gameService;
    private final SettlementService settlementService;

    @GetMapping("/upcoming")
    @Operation(summary = "Scheduled games open for betting")
    public List<GameResponse> upcoming(@RequestParam(defaultValue = "20") int limit) {
        return gameService.upcomingGames(limit).stream().map(GameResponse::from).toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get game")
    public GameResponse getGame(@PathVariable Long id) {
        return GameResponse.from(gameService.getGame(id));
    }

    @PostMapping
    @Operation(summary = "Schedule game with posted odds and lines")
    public ResponseEntity<GameResponse> schedule(@Valid @RequestBody ScheduleGameRequest request) {
        GameResponse game = GameResponse.from(gameService.scheduleGame(request.getHomeTeam(), request.getAwayTeam(),
                request.getScheduledAt(), request.getHomeOdds(), request.getAwayOdds(), request.getSpread(),
                request.getTotalLine()));
        return ResponseEntity.status(HttpStatus.CREATED).body(game);
    }

    @PostMapping("/{id}/settlement")
    @Operation(summary = "Record final score and settle every open wager on the game")
    public SettlementReport settle(@PathVariable Long id, @Valid @RequestBody SettleGameRequest request) {
        log.info("Settlement requested for game {} at {}-{}", id, request.getHomeScore(), request.getAwayScore());
        return settlementService.settleGame(id, request.getHomeScore(), request.getAwayScore());
    }
}
