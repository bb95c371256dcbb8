package com.planrunner.tools.impl;

import static com.planrunner.orchestration.OrchestrationConstants.KNOWLEDGE_SEARCH_DEFAULT_LIMIT;

import com.planrunner.knowledge.KnowledgeHit;
import com.planrunner.knowledge.KnowledgeStore;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.JsonProcessingService;
import com.planrunner.tools.StructuredTool;
import com.planrunner.tools.ToolName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class KnowledgeSearchTool implements StructuredTool<KnowledgeSearchTool.Request> {

    public record Request(String query, Integer limit) {
    }

    static final int MAX_LIMIT = 20;
    static final int EXCERPT_CHARS = 800;

    private final KnowledgeStore knowledgeStore;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public ToolName name() {
        return ToolName.KNOWLEDGE_SEARCH;
    }

    @Override
    public String description() {
        return "Searches the knowledge base for stored fragments matching the query terms.";
    }

    @Override
    public Request descriptionObject() {
        return new Request("streaming export release", KNOWLEDGE_SEARCH_DEFAULT_LIMIT);
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public ToolResult execute(Plan plan, Request request) {
        if (request == null || !StringUtils.hasText(request.query())) {
            return ToolResult.failure(name().name(), "No search query", "Parameter 'query' is required.");
        }
        int limit = request.limit() == null ? KNOWLEDGE_SEARCH_DEFAULT_LIMIT : Math.max(1, Math.min(request.limit(), MAX_LIMIT));
        List<KnowledgeHit> hits = knowledgeStore.search(request.query(), limit);
        if (hits.isEmpty()) {
            return ToolResult.success(name().name(), "No knowledge matched '" + request.query().trim() + "'", "");
        }
        StringBuilder content = new StringBuilder();
        for (KnowledgeHit hit : hits) {
            content.append("[").append(String.format(Locale.ROOT, "%.2f", hit.score())).append("] ")
                    .append(hit.fragment().title());
            if (StringUtils.hasText(hit.fragment().source())) {
                content.append(" (").append(hit.fragment().source()).append(")");
            }
            content.append("\n")
                    .append(jsonProcessingService.truncate(hit.fragment().content(), EXCERPT_CHARS))
                    .append("\n\n");
        }
        return ToolResult.success(name().name(),
                hits.size() + " fragment(s) matched '" + request.query().trim() + "'",
                content.toString().trim());
    }
}
