package com.athl3t.backend.service;

import com.athl3t.backend.exception.BadRequestException;
import com.athl3t.backend.exception.InsufficientFundsException;
import com.athl3t.backend.exception.NotFoundException;
import com.athl3t.backend.model.Account;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountLedgerServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void debitAndCreditAdjustTheBalance() {
        Account account = newAdult();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        tx.executeWithoutResult(status -> {
            ledger.debit(account.getId(), money("40.25"));
            ledger.credit(account.getId(), money("10.00"));
        });

        assertThat(balance(account.getId())).isEqualByComparingTo("119.75");
    }

    @Test
    void debitBeyondBalanceIsRejected() {
        Account account = newAdult();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> ledger.debit(account.getId(), money("150.01"))))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(balance(account.getId())).isEqualByComparingTo("150.00");
    }

    @Test
    void zeroIsANoOpAndNegativeIsRejected() {
        Account account = newAdult();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        tx.executeWithoutResult(status -> ledger.debit(account.getId(), money("0")));
        assertThat(balance(account.getId())).isEqualByComparingTo("150.00");

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> ledger.credit(account.getId(), money("-1"))))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void mutationsRequireAnEnclosingTransaction() {
        Account account = newAdult();

        assertThatThrownBy(() -> ledger.credit(account.getId(), money("5.00")))
                .isInstanceOf(IllegalTransactionStateException.class);
    }

    @Test
    void lockAccountsReturnsAscendingOrder() {
        Account first = newAdult();
        Account second = newAdult();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        List<Long> ids = tx.execute(status -> ledger.lockAccounts(second.getId(), first.getId()).stream()
                .map(Account::getId)
                .toList());

        assertThat(ids).containsExactly(first.getId(), second.getId());
    }

    @Test
    void unknownAccountIsNotFound() {
        assertThatThrownBy(() -> ledger.balance(-1L)).isInstanceOf(NotFoundException.class);
    }
}
