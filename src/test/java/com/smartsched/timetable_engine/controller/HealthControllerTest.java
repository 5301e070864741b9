package com.smartsched.timetable_engine.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.web.servlet.MockMvc;

import com.mongodb.client.MongoDatabase;
import com.smartsched.timetable_engine.service.GenerationService;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MongoTemplate mongoTemplate;

    @MockBean
    private GenerationService generationService;

    @Test
    void reportsStoreAndJobRegistry() throws Exception {
        MongoDatabase database = mock(MongoDatabase.class);
        when(database.getName()).thenReturn("timetable_engine");
        when(mongoTemplate.getDb()).thenReturn(database);
        when(generationService.jobCount()).thenReturn(3);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.jobs").value(3))
                .andExpect(jsonPath("$.mongodb.connected").value(true))
                .andExpect(jsonPath("$.mongodb.database").value("timetable_engine"));
    }

    @Test
    void staysUpWhenTheStoreIsUnreachable() throws Exception {
        when(mongoTemplate.getDb()).thenThrow(new IllegalStateException("connection refused"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mongodb.connected").value(false))
                .andExpect(jsonPath("$.mongodb.error").value("connection refused"));
    }
}
