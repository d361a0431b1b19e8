package com.appetite.kitchen.controller;

import com.appetite.kitchen.model.dto.CacheStats;
import com.appetite.kitchen.service.bootstrap.TicketCacheBootstrapService;
import com.appetite.kitchen.service.bootstrap.WarmResult;
import com.appetite.kitchen.service.cache.TicketStateCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InternalController.class)
@DisplayName("InternalController Tests")
class InternalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TicketCacheBootstrapService bootstrapService;

    @MockBean
    private TicketStateCache ticketStateCache;

    @Test
    @DisplayName("Should reload the cache from the repository")
    void shouldReloadCache() throws Exception {
        when(bootstrapService.warmFromRepository()).thenReturn(new WarmResult(WarmResult.Source.REPOSITORY, 7));

        mockMvc.perform(post("/api/internal/reload-cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("REPOSITORY"))
                .andExpect(jsonPath("$.tickets").value(7));
    }

    @Test
    @DisplayName("Should report cache occupancy")
    void shouldReportStats() throws Exception {
        when(ticketStateCache.stats()).thenReturn(new CacheStats(3, Map.of("kitchen", 2, "bar", 1), Map.of("ready", 3), 2));

        mockMvc.perform(get("/api/internal/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tickets").value(3))
                .andExpect(jsonPath("$.byStation.kitchen").value(2))
                .andExpect(jsonPath("$.subscribers").value(2));
    }
}
