package com.athl3t.backend.controller;

import com.athl3t.backend.dto.AccountResponse;
import com.athl3t.backend.dto.AgeVerificationRequest;
import com.athl3t.backend.dto.DepositRequest;
import com.athl3t.backend.dto.HoldingResponse;
import com.athl3t.backend.dto.OpenAccountRequest;
import com.athl3t.backend.dto.PerformanceSummary;
import com.athl3t.backend.dto.TransactionResponse;
import com.athl3t.backend.exception.ForbiddenException;
import com.athl3t.backend.service.AccountService;
import com.athl3t.backend.service.HoldingsRegistry;
import com.athl3t.backend.service.PerformanceService;
import com.athl3t.backend.service.TransactionLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.athl3t.backend.config.OpenApiConfig.USER_HEADER;

@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts")
public class AccountController {

    private final AccountService accountService;
    private final HoldingsRegistry holdingsRegistry;
    private final TransactionLogService transactionLogService;
    private final PerformanceService performanceService;

    @PostMapping
    @Operation(summary = "Open account with the starting balance")
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        AccountResponse account = AccountResponse.from(
                accountService.openAccount(request.getUsername(), request.getBirthdate()));
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get account and cash balance")
    public ResponseEntity<AccountResponse> getAccount(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        requireSelf(userId, id);
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(id)));
    }

    @PostMapping("/{id}/deposits")
    @Operation(summary = "Add funds")
    public ResponseEntity<AccountResponse> deposit(@RequestHeader(USER_HEADER) Long userId,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody DepositRequest request) {
        requireSelf(userId, id);
        return ResponseEntity.ok(AccountResponse.from(accountService.deposit(id, request.getAmount())));
    }

    @PostMapping("/{id}/age-verification")
    @Operation(summary = "Record birthdate for the wagering age check")
    public ResponseEntity<AccountResponse> verifyAge(@RequestHeader(USER_HEADER) Long userId,
                                                     @PathVariable Long id,
                                                     @Valid @RequestBody AgeVerificationRequest request) {
        requireSelf(userId, id);
        return ResponseEntity.ok(AccountResponse.from(accountService.verifyAge(id, request.getBirthdate())));
    }

    @GetMapping("/{id}/holdings")
    @Operation(summary = "List holdings")
    public List<HoldingResponse> holdings(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        requireSelf(userId, id);
        return holdingsRegistry.holdings(id).stream().map(HoldingResponse::from).toList();
    }

    @GetMapping("/{id}/transactions")
    @Operation(summary = "Transaction history, newest first")
    public List<TransactionResponse> transactions(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        requireSelf(userId, id);
        return transactionLogService.history(id).stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/{id}/performance")
    @Operation(summary = "Realized trading performance")
    public PerformanceSummary performance(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        requireSelf(userId, id);
        return performanceService.summary(id);
    }

    private void requireSelf(Long userId, Long accountId) {
        if (!accountId.equals(userId)) {
            throw new ForbiddenException("Account " + accountId + " belongs to another user");
        }
    }
}
