package com.athl3t.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleGameRequest {

    @NotBlank
    @Size(max = 100)
    private String homeTeam;

    @NotBlank
    @Size(max = 100)
    private String awayTeam;

    @NotNull
    private LocalDateTime scheduledAt;

    @NotNull
    @DecimalMin(value = "1.0", inclusive = false)
    private BigDecimal homeOdds;

    @NotNull
    @DecimalMin(value = "1.0", inclusive = false)
    private BigDecimal awayOdds;

    private BigDecimal spread;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal totalLine;
}
