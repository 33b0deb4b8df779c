package com.athl3t.backend.repository;

import com.athl3t.backend.model.TradeOfferAsset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface TradeOfferAssetRepository extends JpaRepository<TradeOfferAsset, Long> {

    List<TradeOfferAsset> findByOfferIdOrderByIdAsc(Long offerId);

    List<TradeOfferAsset> findByOfferIdInOrderByIdAsc(Collection<Long> offerIds);
}
