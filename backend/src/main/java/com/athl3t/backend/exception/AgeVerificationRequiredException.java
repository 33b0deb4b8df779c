package com.athl3t.backend.exception;

public class AgeVerificationRequiredException extends ForbiddenException {

    public AgeVerificationRequiredException(Long userId, int minimumAge) {
        super("AGE_VERIFICATION_REQUIRED", "User " + userId + " must be verified as " + minimumAge + "+ to wager");
    }
}
