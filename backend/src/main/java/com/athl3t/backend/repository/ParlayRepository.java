package com.athl3t.backend.repository;

import com.athl3t.backend.model.Parlay;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ParlayRepository extends JpaRepository<Parlay, Long> {

    List<Parlay> findByUserIdOrderByPlacedAtDescIdDesc(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Parlay p where p.id = :id")
    Optional<Parlay> findByIdForUpdate(@Param("id") Long id);
}
