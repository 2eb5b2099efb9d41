package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static dev.badgersnacks.compendium.CompendiumFixtures.template;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpansionWorkerPoolTest {

    private final GenericVariantTemplate first = template("""
            {"name": "First", "requires": [{"weapon": true}], "inherits": {"namePrefix": "First ", "source": "DMG"}}
            """);
    private final GenericVariantTemplate second = template("""
            {"name": "Second", "requires": [{"armor": true}], "inherits": {"namePrefix": "Second ", "source": "DMG"}}
            """);

    @Test
    void outcomesFollowTemplateOrderAndRunOnDaemonWorkers() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        try (ExpansionWorkerPool pool = new ExpansionWorkerPool(2)) {
            List<TemplateOutcome> outcomes = pool.expandAll(List.of(first, second), template -> {
                Thread current = Thread.currentThread();
                threads.add(current.getName() + ":" + current.isDaemon());
                return List.of();
            });

            assertEquals(2, outcomes.size());
            assertEquals("First", outcomes.get(0).template().name());
            assertEquals("Second", outcomes.get(1).template().name());
            assertFalse(outcomes.get(0).isFailed());
            assertTrue(outcomes.get(0).elapsed().toNanos() >= 0);
        }
        assertFalse(threads.isEmpty());
        assertTrue(threads.stream().allMatch(t -> t.startsWith("expansion-worker-") && t.endsWith(":true")));
    }

    @Test
    void failingTemplateDoesNotAffectOthers() {
        try (ExpansionWorkerPool pool = new ExpansionWorkerPool(1)) {
            List<TemplateOutcome> outcomes = pool.expandAll(List.of(first, second), template -> {
                if (template == first) {
                    throw new IllegalStateException("unreadable template");
                }
                return List.of();
            });

            assertTrue(outcomes.get(0).isFailed());
            assertInstanceOf(IllegalStateException.class, outcomes.get(0).failure());
            assertTrue(outcomes.get(0).items().isEmpty());
            assertFalse(outcomes.get(1).isFailed());
        }
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ExpansionWorkerPool(0));
        assertTrue(ExpansionWorkerPool.defaultParallelism() >= 2);
    }
}
