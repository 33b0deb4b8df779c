package com.athl3t.backend.repository;

import com.athl3t.backend.model.TradeOffer;
import com.athl3t.backend.model.TradeOfferStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TradeOfferRepository extends JpaRepository<TradeOffer, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from TradeOffer o where o.id = :id")
    Optional<TradeOffer> findByIdForUpdate(@Param("id") Long id);

    /** Offers a user may act on: addressed to them, or open offers from someone else. */
    @Query("select o from TradeOffer o where o.status = :status and o.initiatorId <> :userId "
            + "and (o.counterpartyId = :userId or o.counterpartyId is null) order by o.createdAt desc, o.id desc")
    List<TradeOffer> findActionableFor(@Param("userId") Long userId, @Param("status") TradeOfferStatus status);

    List<TradeOffer> findByInitiatorIdOrderByCreatedAtDescIdDesc(Long initiatorId);
}
