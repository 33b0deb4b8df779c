package com.athl3t.backend.service;

import com.athl3t.backend.exception.ConflictException;
import com.athl3t.backend.model.IdempotencyKey;
import com.athl3t.backend.repository.IdempotencyKeyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Replays the stored response of a request retried with the same
 * {@code Idempotency-Key}. The key is claimed and finalized in their own short
 * transactions so the claim is visible to concurrent retries while the
 * business operation runs in its own transaction.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final int MAX_ERROR_LENGTH = 500;

    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    public IdempotencyService(IdempotencyKeyRepository idempotencyKeyRepository,
                              ObjectMapper objectMapper,
                              PlatformTransactionManager transactionManager,
                              LedgerMetrics ledgerMetrics,
                              Clock clock) {
        this.idempotencyKeyRepository = idempotencyKeyRepository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ledgerMetrics = ledgerMetrics;
        this.clock = clock;
    }

    public <T> T execute(Long userId, String operation, String idempotencyKey, Object request,
                         Class<T> responseType, Supplier<T> supplier) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return supplier.get();
        }
        String key = idempotencyKey.trim();
        String requestHash = hashRequest(request);
        Optional<IdempotencyKey> existing = idempotencyKeyRepository
                .findByUserIdAndOperationAndIdempotencyKey(userId, operation, key);
        if (existing.isPresent()) {
            return replay(existing.get(), requestHash, responseType);
        }
        IdempotencyKey claim;
        try {
            claim = requiresNew.execute(status -> idempotencyKeyRepository.saveAndFlush(IdempotencyKey.builder()
                    .userId(userId)
                    .operation(operation)
                    .idempotencyKey(key)
                    .requestHash(requestHash)
                    .state(IdempotencyKey.State.IN_PROGRESS)
                    .requestId(MDC.get("requestId"))
                    .createdAt(LocalDateTime.now(clock))
                    .updatedAt(LocalDateTime.now(clock))
                    .build()));
        } catch (DataIntegrityViolationException ex) {
            IdempotencyKey winner = idempotencyKeyRepository
                    .findByUserIdAndOperationAndIdempotencyKey(userId, operation, key)
                    .orElseThrow(() -> new ConflictException("Idempotency key collision"));
            return replay(winner, requestHash, responseType);
        }

        T response;
        try {
            response = supplier.get();
        } catch (RuntimeException ex) {
            finish(claim, IdempotencyKey.State.FAILED, null, truncate(ex.getMessage()));
            throw ex;
        }
        finish(claim, IdempotencyKey.State.COMPLETED, serialize(response), null);
        return response;
    }

    private <T> T replay(IdempotencyKey stored, String requestHash, Class<T> responseType) {
        if (!stored.getRequestHash().equals(requestHash)) {
            throw new ConflictException("Idempotency key reused with different payload");
        }
        if (stored.getState() == IdempotencyKey.State.IN_PROGRESS) {
            throw new ConflictException("Idempotency key already in progress");
        }
        if (stored.getState() == IdempotencyKey.State.FAILED) {
            String message = stored.getErrorMessage() != null ? stored.getErrorMessage() : "Idempotent request previously failed";
            throw new ConflictException(message);
        }
        ledgerMetrics.recordIdempotentReplay();
        log.info("Replaying {} response for user {} key {}", stored.getOperation(), stored.getUserId(),
                stored.getIdempotencyKey());
        return deserialize(stored.getResponsePayload(), responseType);
    }

    private void finish(IdempotencyKey claim, IdempotencyKey.State state, String payload, String error) {
        claim.setState(state);
        claim.setResponsePayload(payload);
        claim.setErrorMessage(error);
        claim.setUpdatedAt(LocalDateTime.now(clock));
        requiresNew.executeWithoutResult(status -> idempotencyKeyRepository.save(claim));
    }

    private String hashRequest(Object request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(objectMapper.writeValueAsString(request).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash idempotent request", e);
        }
    }

    private String serialize(Object response) {
        try {
            return response == null ? null : objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize idempotent response", e);
        }
    }

    private <T> T deserialize(String payload, Class<T> responseType) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, responseType);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize idempotent response: {}", e.getMessage());
            throw new ConflictException("Stored idempotent response unreadable");
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
