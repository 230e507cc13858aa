package com.copytrader.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.copytrader.api.controller.MultiplierController;
import com.copytrader.config.ApiResponseAdvice;
import com.copytrader.domain.enums.MultiplierSource;
import com.copytrader.domain.model.SymbolMultiplier;
import com.copytrader.engine.MultiplierResolver;
import com.copytrader.exception.GlobalExceptionHandler;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.service.AuditService;
import com.copytrader.service.FollowerService;
import java.math.BigDecimal;
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
class MultiplierControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MultiplierResolver multiplierResolver;

    @Mock
    private FollowerService followerService;

    @Mock
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        MultiplierController controller = new MultiplierController(multiplierResolver, followerService, auditService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static SymbolMultiplier override(String symbol, String value) {
        return SymbolMultiplier.builder()
                .followerId("F1")
                .symbol(symbol)
                .multiplier(new BigDecimal(value))
                .source(MultiplierSource.USER_OVERRIDE)
                .build();
    }

    @Test
    @DisplayName("GET /api/multipliers/{followerId} lists the follower's overrides")
    void listOverrides() throws Exception {
        when(multiplierResolver.overrides("F1")).thenReturn(List.of(override("AAPL", "1.5")));

        mockMvc.perform(get("/api/multipliers/F1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$.data[0].multiplier").value(1.5))
                .andExpect(jsonPath("$.data[0].source").value("USER_OVERRIDE"));
    }

    @Test
    @DisplayName("GET /api/multipliers/{followerId}/{symbol} reports the base multiplier when no override exists")
    void effectiveFallsBackToBase() throws Exception {
        when(multiplierResolver.resolve("F1", "MSFT"))
                .thenReturn(SymbolMultiplier.builder()
                        .followerId("F1")
                        .symbol("MSFT")
                        .multiplier(BigDecimal.valueOf(2))
                        .source(MultiplierSource.BASE)
                        .build());

        mockMvc.perform(get("/api/multipliers/F1/MSFT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.multiplier").value(2))
                .andExpect(jsonPath("$.data.source").value("BASE"));
    }

    @Test
    @DisplayName("PUT /api/multipliers/{followerId}/{symbol} sets an override and audits it")
    void setOverride() throws Exception {
        BigDecimal value = new BigDecimal("1.5");
        when(multiplierResolver.setOverride("F1", "AAPL", value)).thenReturn(override("AAPL", "1.5"));

        mockMvc.perform(put("/api/multipliers/F1/AAPL")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"multiplier\":1.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.multiplier").value(1.5));

        verify(auditService).log("MULTIPLIER", "F1", "AAPL", "SET", Map.of("multiplier", value));
    }

    @Test
    @DisplayName("PUT /api/multipliers rejects a non-positive multiplier")
    void rejectsNonPositive() throws Exception {
        mockMvc.perform(put("/api/multipliers/F1/AAPL")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"multiplier\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.multiplier").exists());

        verifyNoInteractions(multiplierResolver, auditService);
    }

    @Test
    @DisplayName("PUT /api/multipliers for an unknown follower returns 404 with the missing id")
    void unknownFollower() throws Exception {
        when(followerService.require("F9")).thenThrow(new ResourceNotFoundException("Follower", "F9"));

        mockMvc.perform(put("/api/multipliers/F9/AAPL")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"multiplier\":2}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.details.type").value("Follower"))
                .andExpect(jsonPath("$.error.details.id").value("F9"));

        verify(multiplierResolver, never()).setOverride(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("DELETE /api/multipliers/{followerId}/{symbol} clears and audits only when an override existed")
    void clearOverride() throws Exception {
        when(multiplierResolver.clearOverride("F1", "AAPL")).thenReturn(true);
        when(multiplierResolver.clearOverride("F1", "TSLA")).thenReturn(false);

        mockMvc.perform(delete("/api/multipliers/F1/AAPL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.cleared").value(true));
        mockMvc.perform(delete("/api/multipliers/F1/TSLA"))
                .andExpect(jsonPath("$.data.cleared").value(false));

        verify(auditService).log("MULTIPLIER", "F1", "AAPL", "CLEAR", null);
        verify(auditService, never()).log("MULTIPLIER", "F1", "TSLA", "CLEAR", null);
    }
}
