package com.athl3t.backend.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void betPlacedAndSettledOverHttp() throws Exception {
        long userId = openAccount();
        long gameId = scheduleGame(LocalDateTime.now().plusDays(2));

        mockMvc.perform(post("/api/bets")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"gameId": %d, "betType": "MONEYLINE", "pick": "HOME", "stake": 10.00}
                                """.formatted(gameId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.potentialPayout").value(19.1));

        mockMvc.perform(post("/api/games/" + gameId + "/settlement")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"homeScore": 27, "awayScore": 17}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/accounts/" + userId).header("X-User-Id", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cashBalance").value(159.1));
        mockMvc.perform(get("/api/bets").header("X-User-Id", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("WON"));

        mockMvc.perform(post("/api/games/" + gameId + "/settlement")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"homeScore": 0, "awayScore": 3}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_SETTLED"));
    }

    @Test
    void buyingPastTheBalanceIsUnprocessable() throws Exception {
        long userId = openAccount();

        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"assetType": "PLAYER", "assetName": "Saquon Barkley", "side": "BUY",
                                 "unitPrice": 2.00, "quantity": 100}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_FUNDS"));

        mockMvc.perform(get("/api/accounts/" + userId).header("X-User-Id", userId))
                .andExpect(jsonPath("$.cashBalance").value(150.0));
    }

    @Test
    void idempotentTradeIsExecutedOnce() throws Exception {
        long userId = openAccount();
        String trade = """
                {"assetType": "TEAM_FUND", "assetName": "Detroit Lions", "side": "BUY", "unitPrice": 25.00, "quantity": 2}
                """;

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/trades")
                            .header("X-User-Id", userId)
                            .header("Idempotency-Key", "buy-lions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(trade))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.kind").value("BUY"));
        }

        mockMvc.perform(get("/api/accounts/" + userId).header("X-User-Id", userId))
                .andExpect(jsonPath("$.cashBalance").value(100.0));
        mockMvc.perform(get("/api/accounts/" + userId + "/holdings").header("X-User-Id", userId))
                .andExpect(jsonPath("$[0].quantity").value(2));
    }

    @Test
    void stakeBelowMinimumIsRejected() throws Exception {
        long userId = openAccount();
        long gameId = scheduleGame(LocalDateTime.now().plusDays(2));

        mockMvc.perform(post("/api/bets")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"gameId": %d, "betType": "SPREAD", "pick": "AWAY", "stake": 4.99}
                                """.formatted(gameId)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_STAKE"));
    }

    @Test
    void requestsWithoutUserHeaderAreMalformed() throws Exception {
        mockMvc.perform(get("/api/bets").header("X-Request-Id", "req-ledger-1"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Request-Id", "req-ledger-1"))
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"))
                .andExpect(jsonPath("$.requestId").value("req-ledger-1"));
    }

    @Test
    void otherUsersAccountIsForbidden() throws Exception {
        long owner = openAccount();
        long other = openAccount();

        mockMvc.perform(get("/api/accounts/" + owner + "/transactions").header("X-User-Id", other))
                .andExpect(status().isForbidden());
    }

    @Test
    void invalidAccountPayloadFailsValidation() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": ""}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").isArray());
    }

    @Test
    void apiDocsAccessible() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());
    }

    private long openAccount() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "api-%s", "birthdate": "1988-02-14"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.cashBalance").value(150.0))
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id")).longValue();
    }

    private long scheduleGame(LocalDateTime kickoff) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"homeTeam": "Home %1$s", "awayTeam": "Away %1$s", "scheduledAt": "%2$s",
                                 "homeOdds": 1.91, "awayOdds": 2.05, "spread": -3.5, "totalLine": 44.5}
                                """.formatted(UUID.randomUUID(), kickoff.withNano(0))))
                .andExpect(status().isCreated())
                .andReturn();
        return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id")).longValue();
    }
}
