package com.planrunner.tools.impl;

import com.planrunner.knowledge.KnowledgeStore;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.BackgroundTaskDispatcher;
import com.planrunner.tools.StructuredTool;
import com.planrunner.tools.ToolName;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Fetches a web page and returns its visible text. Indexing the text into the knowledge store is
 * handed to the background pool so the step finishes as soon as the page is read.
 */
@Component
@Slf4j
public class DocumentFromWebTool implements StructuredTool<DocumentFromWebTool.Request> {

    public record Request(String url, String title) {
    }

    static final int MAX_CONTENT_CHARS = 20_000;

    private final RestClient restClient;
    private final KnowledgeStore knowledgeStore;
    private final BackgroundTaskDispatcher backgroundTaskDispatcher;

    public DocumentFromWebTool(RestClient.Builder restClientBuilder,
                               KnowledgeStore knowledgeStore,
                               BackgroundTaskDispatcher backgroundTaskDispatcher) {
        this.restClient = restClientBuilder.build();
        this.knowledgeStore = knowledgeStore;
        this.backgroundTaskDispatcher = backgroundTaskDispatcher;
    }

    @Override
    public ToolName name() {
        return ToolName.DOCUMENT_FROM_WEB;
    }

    @Override
    public String description() {
        return "Downloads a web page by URL and returns its text. The text is also indexed into the knowledge base.";
    }

    @Override
    public Request descriptionObject() {
        return new Request("https://example.com/docs/getting-started", "Getting started guide");
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public ToolResult execute(Plan plan, Request request) {
        if (request == null || !StringUtils.hasText(request.url())) {
            return ToolResult.failure(name().name(), "No URL to fetch", "Parameter 'url' is required.");
        }
        String url = request.url().trim();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException ex) {
            return ToolResult.failure(name().name(), "Invalid URL " + url, ex.getMessage());
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            return ToolResult.failure(name().name(), "Unsupported URL " + url, "Only http and https URLs can be fetched.");
        }

        String html;
        try {
            html = restClient.get()
                    .uri(uri)
                    .accept(MediaType.TEXT_HTML, MediaType.ALL)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException ex) {
            log.info("Fetching {} returned {} (correlationId={}).", url, ex.getStatusCode(), plan.getCorrelationId());
            return ToolResult.failure(name().name(), "Failed to fetch " + url, "HTTP " + ex.getStatusCode().value());
        } catch (ResourceAccessException ex) {
            log.info("Fetching {} failed (correlationId={}): {}", url, plan.getCorrelationId(), ex.getMessage());
            return ToolResult.failure(name().name(), "Failed to fetch " + url, ex.getMessage());
        }

        Document document = Jsoup.parse(html == null ? "" : html, url);
        document.select("script, style, noscript, template").remove();
        String text = document.body() != null ? document.body().text() : document.text();
        if (!StringUtils.hasText(text)) {
            return ToolResult.failure(name().name(), "No text content at " + url, "Page body is empty.");
        }
        String title = StringUtils.hasText(request.title()) ? request.title().trim()
                : StringUtils.hasText(document.title()) ? document.title().trim() : url;

        String correlationId = plan.getCorrelationId();
        boolean queued = backgroundTaskDispatcher.submit("index " + url, correlationId,
                () -> knowledgeStore.store(title, text, url, correlationId));

        boolean truncated = text.length() > MAX_CONTENT_CHARS;
        String content = truncated ? text.substring(0, MAX_CONTENT_CHARS) : text;
        String summary = "Fetched '" + title + "' (" + text.length() + " chars"
                + (truncated ? ", truncated" : "") + (queued ? ", indexing queued)" : ", indexing skipped)");
        return ToolResult.success(name().name(), summary, content);
    }
}
