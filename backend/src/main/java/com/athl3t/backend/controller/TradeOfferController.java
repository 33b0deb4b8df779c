package com.athl3t.backend.controller;

import com.athl3t.backend.dto.CreateOfferRequest;
import com.athl3t.backend.dto.TradeOfferResponse;
import com.athl3t.backend.service.TradeOfferService;
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
@RequestMapping("/api/offers")
@RequiredArgsConstructor
@Tag(name = "Trade offers")
public class TradeOfferController {

    private final TradeOfferService tradeOfferService;

    @PostMapping
    @Operation(summary = "Offer assets to another user, or to anyone when no counterparty is given")
    public ResponseEntity<TradeOfferResponse> create(@RequestHeader(USER_HEADER) Long userId,
                                                     @Valid @RequestBody CreateOfferRequest request) {
        TradeOfferResponse offer = TradeOfferResponse.from(tradeOfferService.createOffer(userId,
                toAssets(request.getOffered()), toAssets(request.getRequested()),
                request.getCounterpartyId(), request.getDescription()));
        return ResponseEntity.status(HttpStatus.CREATED).body(offer);
    }

    @GetMapping("/pending")
    @Operation(summary = "Pending offers I can accept")
    public List<TradeOfferResponse> pending(@RequestHeader(USER_HEADER) Long userId) {
        return tradeOfferService.pendingOffersFor(userId).stream().map(TradeOfferResponse::from).toList();
    }

    @GetMapping("/mine")
    @Operation(summary = "Offers I created")
    public List<TradeOfferResponse> mine(@RequestHeader(USER_HEADER) Long userId) {
        return tradeOfferService.offersBy(userId).stream().map(TradeOfferResponse::from).toList();
    }

    @PostMapping("/{id}/accept")
    @Operation(summary = "Accept offer and swap the assets")
    public TradeOfferResponse accept(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return TradeOfferResponse.from(tradeOfferService.acceptOffer(id, userId));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject an offer addressed to me")
    public TradeOfferResponse reject(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return TradeOfferResponse.from(tradeOfferService.rejectOffer(id, userId));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Withdraw my offer")
    public TradeOfferResponse cancel(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return TradeOfferResponse.from(tradeOfferService.cancelOffer(id, userId));
    }

    private static List<TradeOfferService.OfferAsset> toAssets(List<CreateOfferRequest.Asset> assets) {
        if (assets == null) {
            return List.of();
        }
        return assets.stream()
                .map(asset -> new TradeOfferService.OfferAsset(asset.getAssetType(), asset.getAssetName(), asset.getQuantity()))
                .toList();
    }
}
