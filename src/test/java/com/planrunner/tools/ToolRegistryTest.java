package com.planrunner.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.PlanFixtures;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.exception.UnknownToolException;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.impl.KnowledgeSearchTool;
import com.planrunner.knowledge.InMemoryKnowledgeStore;
import com.planrunner.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ToolRegistry registry(PlanRunnerProperties properties, PlanTool... tools) {
        return new ToolRegistry(List.of(tools), properties, objectMapper);
    }

    @Test
    void resolvesCaseInsensitiveExactNames() {
        ToolRegistry registry = registry(new PlanRunnerProperties(), StubTool.succeeding(ToolName.DOCUMENT_FROM_WEB));

        assertEquals(ToolName.DOCUMENT_FROM_WEB, registry.require(" document_from_web "));
        assertTrue(registry.resolve("DOCUMENT_FROM").isEmpty());
        assertTrue(registry.resolve("KNOWLEDGE_STORE").isEmpty());
    }

    @Test
    void unknownToolCarriesName() {
        ToolRegistry registry = registry(new PlanRunnerProperties(), StubTool.succeeding(ToolName.KNOWLEDGE_STORE));

        UnknownToolException ex = assertThrows(UnknownToolException.class, () -> registry.require("WEB_SEARCH"));
        assertEquals("WEB_SEARCH", ex.getToolName());
        assertInstanceOf(PlanValidationException.class, ex);
    }

    @Test
    void disabledToolsAreNotRegistered() {
        PlanRunnerProperties properties = new PlanRunnerProperties();
        properties.getTools().setDisabled(List.of("knowledge_store"));

        ToolRegistry registry = registry(properties,
                StubTool.succeeding(ToolName.KNOWLEDGE_STORE), StubTool.succeeding(ToolName.KNOWLEDGE_SEARCH));

        assertEquals(Set.of(ToolName.KNOWLEDGE_SEARCH), registry.registeredNames());
        assertFalse(registry.isRegistered(ToolName.KNOWLEDGE_STORE));
    }

    @Test
    void duplicateRegistrationFails() {
        assertThrows(IllegalStateException.class, () -> registry(new PlanRunnerProperties(),
                StubTool.succeeding(ToolName.KNOWLEDGE_STORE), StubTool.succeeding(ToolName.KNOWLEDGE_STORE)));
    }

    @Test
    void consolidationMarkerCannotBeRegistered() {
        assertThrows(IllegalStateException.class, () -> registry(new PlanRunnerProperties(),
                StubTool.succeeding(ToolName.CONSOLIDATE_STEPS)));
    }

    @Test
    void structuredDispatchConvertsParameters() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(new PlanRunnerProperties());
        store.store("Vendor pricing", "Acme charges per seat", null, "c");
        KnowledgeSearchTool searchTool = new KnowledgeSearchTool(store, new JsonProcessingService(objectMapper));
        ToolRegistry registry = registry(new PlanRunnerProperties(), searchTool);

        ToolResult result = registry.execute(ToolName.KNOWLEDGE_SEARCH, PlanFixtures.plan("q"),
                new ToolRequest("search", Map.of("query", "acme pricing", "limit", 3), ""));

        assertTrue(result.success());
        assertTrue(result.content().contains("Vendor pricing"));
    }

    @Test
    void mismatchedParametersAreValidationErrors() {
        KnowledgeSearchTool searchTool = new KnowledgeSearchTool(new InMemoryKnowledgeStore(new PlanRunnerProperties()),
                new JsonProcessingService(objectMapper));
        ToolRegistry registry = registry(new PlanRunnerProperties(), searchTool);

        assertThrows(PlanValidationException.class, () -> registry.execute(ToolName.KNOWLEDGE_SEARCH,
                PlanFixtures.plan("q"), new ToolRequest("search", Map.of("limit", "many"), "")));
    }

    @Test
    void catalogListsEveryRegisteredTool() {
        ToolRegistry registry = registry(new PlanRunnerProperties(),
                StubTool.succeeding(ToolName.DOCUMENT_FROM_WEB), StubTool.succeeding(ToolName.KNOWLEDGE_STORE));

        String catalog = registry.renderCatalog();
        assertTrue(catalog.contains("- DOCUMENT_FROM_WEB: stub DOCUMENT_FROM_WEB"));
        assertTrue(catalog.contains("- KNOWLEDGE_STORE: stub KNOWLEDGE_STORE"));
        assertTrue(catalog.contains("parameters example: {\"example\":true}"));
        assertEquals(2, registry.describeTools().size());
        assertEquals("structured", registry.describeTools().get(0).invocation());
    }
}
