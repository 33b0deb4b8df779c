package com.athl3t.backend.exception;

import com.athl3t.backend.dto.ApiError;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void lockFailuresBecomeRetryableConflicts() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/games/1/settlement");

        ResponseEntity<ApiError> deadlock = handler.handleConcurrency(
                new CannotAcquireLockException("deadlock detected"), request);
        ResponseEntity<ApiError> timeout = handler.handleConcurrency(
                new PessimisticLockingFailureException("lock wait timeout"), request);

        assertThat(deadlock.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(deadlock.getBody()).isNotNull();
        assertThat(deadlock.getBody().getErrorCode()).isEqualTo("CONCURRENT_UPDATE");
        assertThat(deadlock.getBody().getPath()).isEqualTo("/api/games/1/settlement");
        assertThat(timeout.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(timeout.getBody().getErrorCode()).isEqualTo("CONCURRENT_UPDATE");
    }
}
