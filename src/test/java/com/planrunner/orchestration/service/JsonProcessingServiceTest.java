package com.planrunner.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planrunner.orchestration.model.PlannerResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    @Test
    void testParseEmbeddedObject() {
        String raw = "Here is the plan: {\"requirements\":[\"fetch page X\"]} hope it helps.";
        PlannerResponse response = service.parseJsonResponse("planner", raw, PlannerResponse.class);
        assertNotNull(response);
        assertEquals(List.of("fetch page X"), response.requirements());
    }

    @Test
    void testParseCodeFence() {
        String raw = "```json\n{\"requirements\": []}\n```";
        PlannerResponse response = service.parseJsonResponse("planner", raw, PlannerResponse.class);
        assertNotNull(response);
        assertTrue(response.requirements().isEmpty());
    }

    @Test
    void testUnknownFieldsIgnored() {
        String raw = "{\"requirements\":[\"a\"],\"notes\":\"extra\"}";
        assertNotNull(service.parseJsonResponse("planner", raw, PlannerResponse.class));
    }

    @Test
    void testParseEmptyResponse() {
        assertNull(service.parseJsonResponse("planner", "", PlannerResponse.class));
    }

    @Test
    void testParseInvalidJson() {
        assertNull(service.parseJsonResponse("planner", "{requirements: [oops", PlannerResponse.class));
    }

    @Test
    void testTruncate() {
        assertEquals("one two", service.truncate("one\ntwo", 20));
        assertEquals("abc...", service.truncate("abcdef", 3));
    }

    @Test
    void testCompactJson() {
        assertEquals("{\"k\":1}", service.toCompactJson(Map.of("k", 1)));
    }
}
