package com.planrunner.knowledge;

import com.planrunner.config.PlanRunnerProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKnowledgeStoreTest {

    private final InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(new PlanRunnerProperties());

    @Test
    void ranksByTermOverlap() {
        store.store("Acme pricing", "Acme charges per seat with volume discounts.", "https://acme.test", "c1");
        store.store("Globex overview", "Globex sells streaming exports and per seat plans.", null, "c1");

        List<KnowledgeHit> hits = store.search("acme seat pricing", 5);

        assertEquals(2, hits.size());
        assertEquals("Acme pricing", hits.get(0).fragment().title());
        assertEquals(1.0, hits.get(0).score(), 1e-9);
        assertTrue(hits.get(1).score() < hits.get(0).score());
    }

    @Test
    void shortTermsAndNoMatchesYieldNothing() {
        store.store("Notes", "Nothing relevant here.", null, "c1");

        assertTrue(store.search("a of", 5).isEmpty());
        assertTrue(store.search("kubernetes", 5).isEmpty());
    }

    @Test
    void respectsLimit() {
        for (int i = 0; i < 4; i++) {
            store.store("Report " + i, "quarterly report numbers", null, "c1");
        }
        assertEquals(2, store.search("quarterly report", 2).size());
        assertEquals(4, store.size());
    }

    @Test
    void oldestFragmentsAreEvictedAtTheLimit() {
        PlanRunnerProperties properties = new PlanRunnerProperties();
        properties.getKnowledge().setMaxFragments(2);
        InMemoryKnowledgeStore capped = new InMemoryKnowledgeStore(properties);

        capped.store("First", "vendor pricing first", null, "c1");
        capped.store("Second", "vendor pricing second", null, "c1");
        capped.store("Third", "vendor pricing third", null, "c2");

        assertEquals(2, capped.size());
        assertEquals(List.of("Second", "Third"), capped.search("vendor pricing", 5).stream()
                .map(hit -> hit.fragment().title()).sorted().toList());
    }

    @Test
    void nonPositiveLimitIsRejected() {
        PlanRunnerProperties properties = new PlanRunnerProperties();
        properties.getKnowledge().setMaxFragments(0);

        assertThrows(IllegalArgumentException.class, () -> new InMemoryKnowledgeStore(properties));
    }

    @Test
    void blankContentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.store("t", " ", null, "c1"));
    }
}
