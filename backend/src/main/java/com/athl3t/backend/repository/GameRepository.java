package com.athl3t.backend.repository;

import com.athl3t.backend.model.Game;
import com.athl3t.backend.model.GameStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface GameRepository extends JpaRepository<Game, Long> {

    List<Game> findByStatusAndScheduledAtAfterOrderByScheduledAtAsc(GameStatus status, LocalDateTime after, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from Game g where g.id = :id")
    Optional<Game> findByIdForUpdate(@Param("id") Long id);

    /** Shared lock taken by wager placement so it cannot interleave with settlement. */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select g from Game g where g.id = :id")
    Optional<Game> findByIdForShare(@Param("id") Long id);
}
