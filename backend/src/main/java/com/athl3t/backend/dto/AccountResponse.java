package com.athl3t.backend.dto;

import com.athl3t.backend.model.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    private Long id;
    private String username;
    private BigDecimal cashBalance;
    private LocalDate birthdate;
    private boolean verifiedAdult;
    private LocalDateTime createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
                .id(account.getId())
                .username(account.getUsername())
                .cashBalance(account.getCashBalance())
                .birthdate(account.getBirthdate())
                .verifiedAdult(account.isVerifiedAdult())
                .createdAt(account.getCreatedAt())
                .build();
    }
}
