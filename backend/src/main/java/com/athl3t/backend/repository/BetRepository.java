package com.athl3t.backend.repository;

import com.athl3t.backend.model.Bet;
import com.athl3t.backend.model.BetStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BetRepository extends JpaRepository<Bet, Long> {

    List<Bet> findByUserIdOrderByPlacedAtDescIdDesc(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Bet b where b.gameId = :gameId and b.status = :status order by b.id")
    List<Bet> findByGameIdAndStatusForUpdate(@Param("gameId") Long gameId, @Param("status") BetStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Bet b where b.id = :id")
    Optional<Bet> findByIdForUpdate(@Param("id") Long id);
}
