package com.planrunner.tools.impl;

import com.planrunner.knowledge.KnowledgeFragment;
import com.planrunner.knowledge.KnowledgeStore;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.StructuredTool;
import com.planrunner.tools.ToolName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class KnowledgeStoreTool implements StructuredTool<KnowledgeStoreTool.Request> {

    public record Request(String title, String content, String source) {
    }

    private final KnowledgeStore knowledgeStore;

    @Override
    public ToolName name() {
        return ToolName.KNOWLEDGE_STORE;
    }

    @Override
    public String description() {
        return "Stores a text fragment under a title in the knowledge base so later steps can search it.";
    }

    @Override
    public Request descriptionObject() {
        return new Request("Release notes 2.1", "Version 2.1 adds streaming exports.", "https://example.com/notes");
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public ToolResult execute(Plan plan, Request request) {
        if (request == null || !StringUtils.hasText(request.content())) {
            return ToolResult.failure(name().name(), "Nothing to store", "Parameter 'content' is required.");
        }
        String title = StringUtils.hasText(request.title()) ? request.title().trim() : "Untitled";
        KnowledgeFragment fragment = knowledgeStore.store(title, request.content(), request.source(), plan.getCorrelationId());
        return ToolResult.success(name().name(),
                "Stored '" + fragment.title() + "' (" + fragment.content().length() + " chars)",
                "id: " + fragment.id());
    }
}
