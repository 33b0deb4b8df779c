package com.athl3t.backend.controller;

import com.athl3t.backend.dto.CreateParlayRequest;
import com.athl3t.backend.dto.ParlayResponse;
import com.athl3t.backend.service.ParlayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.athl3t.backend.config.OpenApiConfig.USER_HEADER;

@RestController
@RequestMapping("/api/parlays")
@RequiredArgsConstructor
@Tag(name = "Parlays")
public class ParlayController {

    private final ParlayService parlayService;

    @PostMapping
    @Operation(summary = "Create parlay")
    public ResponseEntity<ParlayResponse> create(@RequestHeader(USER_HEADER) Long userId,
                                                 @Valid @RequestBody CreateParlayRequest request) {
        List<ParlayService.LegSelection> legs = request.getLegs().stream()
                .map(leg -> new ParlayService.LegSelection(leg.getGameId(), leg.getBetType(), leg.getPick()))
                .toList();
        ParlayResponse parlay = ParlayResponse.from(parlayService.createParlay(userId, legs, request.getStake()));
        return ResponseEntity.status(HttpStatus.CREATED).body(parlay);
    }

    @GetMapping
    @Operation(summary = "List my parlays with legs")
    public List<ParlayResponse> myParlays(@RequestHeader(USER_HEADER) Long userId) {
        return parlayService.parlaysForUser(userId).stream().map(ParlayResponse::from).toList();
    }
}
