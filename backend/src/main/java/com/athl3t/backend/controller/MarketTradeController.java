package com.athl3t.backend.controller;

import com.athl3t.backend.dto.TradeRequest;
import com.athl3t.backend.dto.TransactionResponse;
import com.athl3t.backend.service.IdempotencyService;
import com.athl3t.backend.service.MarketTradeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.athl3t.backend.config.OpenApiConfig.USER_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Tag(name = "Trades")
public class MarketTradeController {

    private final MarketTradeService marketTradeService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    @Operation(summary = "Buy or sell shares at the quoted price")
    public ResponseEntity<TransactionResponse> trade(@RequestHeader(USER_HEADER) Long userId,
                                                     @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
                                                     @Valid @RequestBody TradeRequest request) {
        log.info("Trade request from user {}: {} {} x{} {}", userId, request.getSide(), request.getAssetType(),
                request.getQuantity(), request.getAssetName());
        TransactionResponse response = idempotencyService.execute(userId, "TRADE", idempotencyKey, request,
                TransactionResponse.class,
                () -> TransactionResponse.from(marketTradeService.executeTrade(userId, request.getAssetType(),
                        request.getAssetName(), request.getSide(), request.getUnitPrice(), request.getQuantity())));
        return ResponseEntity.ok(response);
    }
}
