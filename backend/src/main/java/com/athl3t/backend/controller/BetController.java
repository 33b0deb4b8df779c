package com.athl3t.backend.controller;

import com.athl3t.backend.dto.BetResponse;
import com.athl3t.backend.dto.PlaceBetRequest;
import com.athl3t.backend.service.BetService;
import com.athl3t.backend.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.athl3t.backend.config.OpenApiConfig.USER_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/bets")
@RequiredArgsConstructor
@Tag(name = "Bets")
public class BetController {

    private final BetService betService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    @Operation(summary = "Place bet")
    public ResponseEntity<BetResponse> placeBet(@RequestHeader(USER_HEADER) Long userId,
                                                @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
                                                @Valid @RequestBody PlaceBetRequest request) {
        BetResponse bet = idempotencyService.execute(userId, "PLACE_BET", idempotencyKey, request, BetResponse.class,
                () -> BetResponse.from(betService.placeBet(userId, request.getGameId(), request.getBetType(),
                        request.getPick(), request.getStake())));
        return ResponseEntity.status(HttpStatus.CREATED).body(bet);
    }

    @GetMapping
    @Operation(summary = "List my bets")
    public List<BetResponse> myBets(@RequestHeader(USER_HEADER) Long userId) {
        return betService.betsForUser(userId).stream().map(BetResponse::from).toList();
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Cancel a pending bet before the game starts")
    public BetResponse cancel(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return BetResponse.from(betService.cancelBet(userId, id));
    }
}
