package com.planrunner.tools.impl;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.knowledge.InMemoryKnowledgeStore;
import com.planrunner.knowledge.KnowledgeHit;
import com.planrunner.orchestration.PlanFixtures;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.BackgroundTaskDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DocumentFromWebToolTest {

    private MockRestServiceServer server;
    private InMemoryKnowledgeStore knowledgeStore;
    private BackgroundTaskDispatcher dispatcher;
    private DocumentFromWebTool tool;
    private final Plan plan = PlanFixtures.plan("What does Acme sell?");

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        knowledgeStore = new InMemoryKnowledgeStore(new PlanRunnerProperties());
        dispatcher = mock(BackgroundTaskDispatcher.class);
        when(dispatcher.submit(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Runnable task = invocation.getArgument(2);
            task.run();
            return true;
        });
        tool = new DocumentFromWebTool(builder, knowledgeStore, dispatcher);
    }

    @Test
    void extractsVisibleTextAndIndexesIt() {
        server.expect(requestTo("https://acme.test/products"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("<html><head><title>Acme products</title><style>p{}</style></head>"
                        + "<body><p>Acme sells anvils.</p><script>track()</script></body></html>", MediaType.TEXT_HTML));

        ToolResult result = tool.execute(plan, new DocumentFromWebTool.Request("https://acme.test/products", null));

        assertTrue(result.success());
        assertEquals("Acme sells anvils.", result.content());
        assertTrue(result.summary().contains("Acme products"));
        assertTrue(result.summary().contains("indexing queued"));
        List<KnowledgeHit> hits = knowledgeStore.search("anvils", 5);
        assertEquals(1, hits.size());
        assertEquals("https://acme.test/products", hits.get(0).fragment().source());
        assertEquals("corr-test", hits.get(0).fragment().correlationId());
        server.verify();
    }

    @Test
    void httpErrorIsFailedResult() {
        server.expect(requestTo("https://acme.test/missing")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        ToolResult result = tool.execute(plan, new DocumentFromWebTool.Request("https://acme.test/missing", "Missing"));

        assertFalse(result.success());
        assertEquals("HTTP 404", result.errorMessage());
        assertEquals(0, knowledgeStore.size());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void nonHttpUrlIsRejected() {
        ToolResult result = tool.execute(plan, new DocumentFromWebTool.Request("file:///etc/passwd", null));

        assertFalse(result.success());
        server.verify();
    }

    @Test
    void missingUrlIsRejected() {
        assertFalse(tool.execute(plan, new DocumentFromWebTool.Request(" ", null)).success());
    }

    @Test
    void droppedIndexingStillReturnsContent() {
        doReturn(false).when(dispatcher).submit(anyString(), anyString(), any());
        server.expect(requestTo("https://acme.test/a"))
                .andRespond(withSuccess("<html><body>Plain page</body></html>", MediaType.TEXT_HTML));

        ToolResult result = tool.execute(plan, new DocumentFromWebTool.Request("https://acme.test/a", "A"));

        assertTrue(result.success());
        assertTrue(result.summary().contains("indexing skipped"));
        assertEquals(0, knowledgeStore.size());
    }
}
