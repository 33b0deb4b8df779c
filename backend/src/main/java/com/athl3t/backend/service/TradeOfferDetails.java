package com.athl3t.backend.service;

import com.athl3t.backend.model.TradeOffer;
import com.athl3t.backend.model.TradeOfferAsset;

import java.util.List;

public record TradeOfferDetails(TradeOffer offer, List<TradeOfferAsset> offered, List<TradeOfferAsset> requested) {
}
