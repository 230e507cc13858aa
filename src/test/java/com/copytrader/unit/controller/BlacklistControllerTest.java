package com.copytrader.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.copytrader.api.controller.BlacklistController;
import com.copytrader.config.ApiResponseAdvice;
import com.copytrader.domain.enums.BlacklistReason;
import com.copytrader.domain.model.BlacklistEntry;
import com.copytrader.engine.BlacklistRegistry;
import com.copytrader.exception.GlobalExceptionHandler;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BlacklistControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BlacklistRegistry blacklistRegistry;

    @Mock
    private FollowerService followerService;

    @Mock
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        BlacklistController controller = new BlacklistController(blacklistRegistry, followerService, auditService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/blacklist filtered by follower")
    void listByFollower() throws Exception {
        when(blacklistRegistry.list("F1"))
                .thenReturn(List.of(BlacklistEntry.builder()
                        .followerId("F1")
                        .symbol("TSLA")
                        .reason(BlacklistReason.RECONCILIATION)
                        .createdAt(Instant.now())
                        .build()));

        mockMvc.perform(get("/api/blacklist").param("followerId", "F1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("TSLA"))
                .andExpect(jsonPath("$.data[0].reason").value("RECONCILIATION"));
    }

    @Test
    @DisplayName("POST /api/blacklist adds with MANUAL reason and audits")
    void addDefaultsToManual() throws Exception {
        when(blacklistRegistry.add("F1", "GME", BlacklistReason.MANUAL)).thenReturn(true);

        mockMvc.perform(post("/api/blacklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"followerId\":\"F1\",\"symbol\":\"GME\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.added").value(true));

        verify(auditService).log("BLACKLIST", "F1", "GME", "ADD", Map.of("reason", "MANUAL"));
    }

    @Test
    @DisplayName("POST /api/blacklist for an existing entry is not audited again")
    void addDuplicateNotAudited() throws Exception {
        when(blacklistRegistry.add("F1", "GME", BlacklistReason.MANUAL)).thenReturn(false);

        mockMvc.perform(post("/api/blacklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"followerId\":\"F1\",\"symbol\":\"GME\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.added").value(false));

        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("POST /api/blacklist for an unknown follower returns 404")
    void addUnknownFollower() throws Exception {
        when(followerService.require("F9")).thenThrow(new ResourceNotFoundException("Follower", "F9"));

        mockMvc.perform(post("/api/blacklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"followerId\":\"F9\",\"symbol\":\"GME\"}"))
                .andExpect(status().isNotFound());

        verify(blacklistRegistry, never()).add(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("POST /api/blacklist without a symbol fails validation")
    void addWithoutSymbol() throws Exception {
        mockMvc.perform(post("/api/blacklist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"followerId\":\"F1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.symbol").exists());
    }

    @Test
    @DisplayName("DELETE /api/blacklist/{followerId}/{symbol} removes and audits")
    void removeEntry() throws Exception {
        when(blacklistRegistry.remove("F1", "TSLA")).thenReturn(true);

        mockMvc.perform(delete("/api/blacklist/F1/TSLA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.removed").value(true));

        verify(auditService).log(eq("BLACKLIST"), eq("F1"), eq("TSLA"), eq("REMOVE"), any());
    }
}
