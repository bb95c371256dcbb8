package com.planrunner.knowledge;

public record KnowledgeHit(KnowledgeFragment fragment, double score) {
}
