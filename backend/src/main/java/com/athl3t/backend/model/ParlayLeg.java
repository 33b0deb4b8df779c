package com.athl3t.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "parlay_legs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParlayLeg {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parlay_id", nullable = false)
    private Long parlayId;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Enumerated(EnumType.STRING)
    @Column(name = "bet_type", nullable = false, length = 20)
    private BetType betType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private BetPick pick;

    @Column(nullable = false, precision = 10, scale = 4)
    private BigDecimal odds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BetStatus status;
}
