package com.planrunner.tools.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.knowledge.InMemoryKnowledgeStore;
import com.planrunner.orchestration.PlanFixtures;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeToolsTest {

    private final InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(new PlanRunnerProperties());
    private final KnowledgeStoreTool storeTool = new KnowledgeStoreTool(store);
    private final KnowledgeSearchTool searchTool = new KnowledgeSearchTool(store, new JsonProcessingService(new ObjectMapper()));
    private final Plan plan = PlanFixtures.plan("q");

    @Test
    void storedFragmentIsSearchable() {
        ToolResult stored = storeTool.execute(plan,
                new KnowledgeStoreTool.Request("Acme pricing", "Acme charges per seat.", "https://acme.test"));
        assertTrue(stored.success());
        assertTrue(stored.content().startsWith("id: "));

        ToolResult found = searchTool.execute(plan, new KnowledgeSearchTool.Request("acme seat", null));

        assertTrue(found.success());
        assertTrue(found.content().startsWith("[1.00] Acme pricing (https://acme.test)"));
        assertTrue(found.summary().startsWith("1 fragment(s)"));
    }

    @Test
    void noMatchIsStillSuccess() {
        ToolResult result = searchTool.execute(plan, new KnowledgeSearchTool.Request("kubernetes", 3));

        assertTrue(result.success());
        assertEquals("", result.content());
    }

    @Test
    void blankInputsAreFailedResults() {
        assertFalse(storeTool.execute(plan, new KnowledgeStoreTool.Request("t", " ", null)).success());
        assertFalse(searchTool.execute(plan, new KnowledgeSearchTool.Request(null, 3)).success());
        assertEquals(0, store.size());
    }
}
