package com.planrunner.knowledge;

import com.planrunner.config.PlanRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * Process-local knowledge store ranking fragments by query term overlap.
 * Holds at most {@code planrunner.knowledge.max-fragments} fragments; the oldest are evicted first.
 */
@Component
@Slf4j
public class InMemoryKnowledgeStore implements KnowledgeStore {

    private static final int MIN_TERM_LENGTH = 3;

    private final Map<UUID, KnowledgeFragment> fragments = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<UUID> insertionOrder = new ConcurrentLinkedDeque<>();
    private final int maxFragments;

    public InMemoryKnowledgeStore(PlanRunnerProperties properties) {
        int configured = properties.getKnowledge().getMaxFragments();
        if (configured < 1) {
            throw new IllegalArgumentException("planrunner.knowledge.max-fragments must be positive, got " + configured);
        }
        this.maxFragments = configured;
    }

    @Override
    public KnowledgeFragment store(String title, String content, @Nullable String source, String correlationId) {
        if (!StringUtils.hasText(content)) {
            throw new IllegalArgumentException("Knowledge content must not be blank.");
        }
        String resolvedTitle = StringUtils.hasText(title) ? title.trim() : "Untitled";
        KnowledgeFragment fragment = new KnowledgeFragment(UUID.randomUUID(), resolvedTitle, content.trim(),
                source, correlationId, Instant.now());
        fragments.put(fragment.id(), fragment);
        insertionOrder.addLast(fragment.id());
        evictOverflow(correlationId);
        log.debug("Stored knowledge fragment {} ({} chars) correlationId={}.", fragment.id(), content.length(), correlationId);
        return fragment;
    }

    @Override
    public List<KnowledgeHit> search(String query, int limit) {
        Set<String> queryTerms = terms(query);
        if (queryTerms.isEmpty() || limit <= 0) {
            return List.of();
        }
        return fragments.values().stream()
                .map(fragment -> new KnowledgeHit(fragment, score(queryTerms, fragment)))
                .filter(hit -> hit.score() > 0)
                .sorted(Comparator.comparingDouble(KnowledgeHit::score).reversed()
                        .thenComparing(hit -> hit.fragment().storedAt(), Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }

    @Override
    public int size() {
        return fragments.size();
    }

    private void evictOverflow(String correlationId) {
        int evicted = 0;
        while (fragments.size() > maxFragments) {
            UUID oldest = insertionOrder.pollFirst();
            if (oldest == null) {
                break;
            }
            if (fragments.remove(oldest) != null) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} oldest knowledge fragments, store is at its limit of {} correlationId={}.",
                    evicted, maxFragments, correlationId);
        }
    }

    private double score(Set<String> queryTerms, KnowledgeFragment fragment) {
        Set<String> fragmentTerms = terms(fragment.title() + " " + fragment.content());
        long matched = queryTerms.stream().filter(fragmentTerms::contains).count();
        return (double) matched / queryTerms.size();
    }

    private Set<String> terms(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(term -> term.length() >= MIN_TERM_LENGTH)
                .collect(Collectors.toSet());
    }
}
