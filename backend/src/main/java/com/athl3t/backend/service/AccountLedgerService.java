package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.InsufficientFundsException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Account;
import com.athl3t.backend.repository.AccountRepository;
import com.athl3t.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The only writer of {@link Account#getCashBalance()}. Mutations lock the
 * account row and must join a transaction opened by the calling service, which
 * is responsible for invoking them exactly once per business event.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AccountLedgerService {

    private final AccountRepository accountRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal debit(Long userId, BigDecimal amount) {
        BigDecimal value = requireAmount(amount);
        Account account = lock(userId);
        if (value.signum() == 0) {
            return account.getCashBalance();
        }
        BigDecimal balance = MoneyUtils.scale(account.getCashBalance());
        if (balance.compareTo(value) < 0) {
            throw new InsufficientFundsException(userId, value, balance);
        }
        account.setCashBalance(MoneyUtils.subtract(balance, value));
        accountRepository.save(account);
        log.debug("Debited {} from account {} (balance {})", value, userId, account.getCashBalance());
        return account.getCashBalance();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal credit(Long userId, BigDecimal amount) {
        BigDecimal value = requireAmount(amount);
        Account account = lock(userId);
        if (value.signum() == 0) {
            return account.getCashBalance();
        }
        account.setCashBalance(MoneyUtils.add(account.getCashBalance(), value));
        accountRepository.save(account);
        log.debug("Credited {} to account {} (balance {})", value, userId, account.getCashBalance());
        return account.getCashBalance();
    }

    /**
     * Locks the account row for the rest of the caller's transaction. Callers
     * that read account state before debiting take the lock here first so the
     * balance they later mutate is not a stale copy.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Account lockAccount(Long userId) {
        return lock(userId);
    }

    /**
     * Locks several accounts in ascending id order. Returns them in that order.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Account> lockAccounts(Long... userIds) {
        List<Long> ordered = Arrays.stream(userIds)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
        List<Account> locked = new ArrayList<>(ordered.size());
        for (Long userId : ordered) {
            locked.add(lock(userId));
        }
        return locked;
    }

    @Transactional(readOnly = true)
    public BigDecimal balance(Long userId) {
        return accountRepository.findById(userId)
                .map(Account::getCashBalance)
                .orElseThrow(() -> new NotFoundException("Account not found: " + userId));
    }

    private Account lock(Long userId) {
        if (userId == null) {
            throw new BadRequestException("User id is required");
        }
        return accountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new NotFoundException("Account not found: " + userId));
    }

    private BigDecimal requireAmount(BigDecimal amount) {
        if (amount == null || MoneyUtils.isNegative(amount)) {
            throw new BadRequestException("Amount must be zero or positive");
        }
        return MoneyUtils.scale(amount);
    }
}
