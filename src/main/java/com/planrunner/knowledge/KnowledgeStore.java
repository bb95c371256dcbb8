package com.planrunner.knowledge;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Storage behind the knowledge tools. Implementations must be safe for concurrent plans.
 */
public interface KnowledgeStore {

    KnowledgeFragment store(String title, String content, @Nullable String source, String correlationId);

    List<KnowledgeHit> search(String query, int limit);

    int size();
}
