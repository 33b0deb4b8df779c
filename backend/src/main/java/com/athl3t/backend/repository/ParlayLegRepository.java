package com.athl3t.backend.repository;

import com.athl3t.backend.model.BetStatus;
import com.athl3t.backend.model.ParlayLeg;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ParlayLegRepository extends JpaRepository<ParlayLeg, Long> {

    List<ParlayLeg> findByParlayIdOrderByIdAsc(Long parlayId);

    List<ParlayLeg> findByParlayIdInOrderByIdAsc(Collection<Long> parlayIds);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from ParlayLeg l where l.gameId = :gameId and l.status = :status order by l.id")
    List<ParlayLeg> findByGameIdAndStatusForUpdate(@Param("gameId") Long gameId, @Param("status") BetStatus status);
}
