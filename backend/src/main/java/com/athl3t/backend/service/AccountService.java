package com.athl3t.backend.service;

import com.athl3t.backend.config.BettingProperties;
import com.athl3t.backend.config.LedgerProperties;
import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.ConflictException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Account;
import com.athl3t.backend.repository.AccountRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

@Service
@Slf4j
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository accountRepository;
    private final AccountLedgerService ledger;
    private final LedgerProperties ledgerProperties;
    private final BettingProperties bettingProperties;
    private final Clock clock;

    @Transactional
    public Account openAccount(String username, LocalDate birthdate) {
        if (username == null || username.isBlank()) {
            throw new BadRequestException("Username is required");
        }
        String normalized = username.trim();
        if (accountRepository.existsByUsername(normalized)) {
            throw new ConflictException("Username already taken: " + normalized);
        }
        validateBirthdate(birthdate);
        Account account = Account.builder()
                .username(normalized)
                .cashBalance(MoneyUtils.scale(ledgerProperties.getAccount().getStartingBalance()))
                .birthdate(birthdate)
                .verifiedAdult(isAdult(birthdate))
                .build();
        Account saved = accountRepository.save(account);
        log.info("Opened account {} for {} with balance {}", saved.getId(), normalized, saved.getCashBalance());
        return saved;
    }

    @Transactional
    public Account deposit(Long userId, BigDecimal amount) {
        if (!MoneyUtils.isPositive(amount)) {
            throw new BadRequestException("Deposit amount must be greater than zero");
        }
        ledger.credit(userId, amount);
        log.info("Deposited {} into account {}", MoneyUtils.scale(amount), userId);
        return getAccount(userId);
    }

    @Transactional
    public Account verifyAge(Long userId, LocalDate birthdate) {
        if (birthdate == null) {
            throw new BadRequestException("Birthdate is required");
        }
        validateBirthdate(birthdate);
        Account account = ledger.lockAccount(userId);
        account.setBirthdate(birthdate);
        account.setVerifiedAdult(isAdult(birthdate));
        Account saved = accountRepository.save(account);
        log.info("Age verification for account {}: adult={}", userId, saved.isVerifiedAdult());
        return saved;
    }

    @Transactional(readOnly = true)
    public Account getAccount(Long userId) {
        return accountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + userId));
    }

    boolean isAdult(LocalDate birthdate) {
        if (birthdate == null) {
            return false;
        }
        LocalDate cutoff = LocalDate.now(clock).minusYears(bettingProperties.getMinimumAge());
        return !birthdate.isAfter(cutoff);
    }

    private void validateBirthdate(LocalDate birthdate) {
        if (birthdate != null && birthdate.isAfter(LocalDate.now(clock))) {
            throw new BadRequestException("Birthdate cannot be in the future");
        }
    }
}
