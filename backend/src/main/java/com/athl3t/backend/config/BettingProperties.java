package com.athl3t.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "betting")
@Data
@Validated
public class BettingProperties {

    @NotNull
    @DecimalMin("0.01")
    private BigDecimal minimumStake = new BigDecimal("5.00");

    /** Decimal odds applied to spread and over/under wagers. */
    @NotNull
    @DecimalMin(value = "1.0", inclusive = false)
    private BigDecimal standardOdds = new BigDecimal("1.91");

    /** How long before kickoff wagers stop being accepted. */
    @NotNull
    private Duration closeCutoff = Duration.ZERO;

    @Min(0)
    private int minimumAge = 21;

    private boolean requireAgeVerification = true;

    @Valid
    private Parlay parlay = new Parlay();

    @Data
    public static class Parlay {
        @Min(2)
        private int minLegs = 2;

        @Min(2)
        private int maxLegs = 10;
    }
}
