package com.athl3t.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
@Validated
public class LedgerProperties {

    @Valid
    private Account account = new Account();

    @Data
    public static class Account {
        @NotNull
        @DecimalMin("0.00")
        private BigDecimal startingBalance = new BigDecimal("150.00");
    }
}
