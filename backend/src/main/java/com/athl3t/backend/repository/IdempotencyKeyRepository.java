package com.athl3t.backend.repository;

import com.athl3t.backend.model.IdempotencyKey;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface IdempotencyKeyRepository extends JpaRepository<IdempotencyKey, Long> {
    Optional<IdempotencyKey> findByUserIdAndOperationAndIdempotencyKey(Long userId, String operation, String idempotencyKey);
}
