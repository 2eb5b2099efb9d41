package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Daemon thread pool for the read-only matching phase of an expansion run. Templates are evaluated
 * concurrently; their outcomes are handed back in the order the templates were given.
 */
public class ExpansionWorkerPool implements AutoCloseable {

    private final ExecutorService executorService;
    private final int parallelism;

    public ExpansionWorkerPool() {
        this(defaultParallelism());
    }

    public ExpansionWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.parallelism = parallelism;
        this.executorService = Executors.newFixedThreadPool(parallelism, new ExpansionThreadFactory());
    }

    public static int defaultParallelism() {
        return Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    }

    public int parallelism() {
        return parallelism;
    }

    /**
     * Runs {@code expansion} once per template and waits for all of them. A template whose evaluation throws
     * yields a failed outcome; the others are unaffected.
     */
    List<TemplateOutcome> expandAll(List<GenericVariantTemplate> templates,
                                    Function<GenericVariantTemplate, List<ExpandedItem>> expansion) {
        Objects.requireNonNull(templates, "templates");
        Objects.requireNonNull(expansion, "expansion");
        List<CompletableFuture<TemplateOutcome>> pending = new ArrayList<>(templates.size());
        for (GenericVariantTemplate template : templates) {
            pending.add(CompletableFuture.supplyAsync(() -> {
                long started = System.nanoTime();
                List<ExpandedItem> items = expansion.apply(template);
                return TemplateOutcome.generated(template, items, Duration.ofNanos(System.nanoTime() - started));
            }, executorService));
        }

        List<TemplateOutcome> outcomes = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            try {
                outcomes.add(pending.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                outcomes.add(TemplateOutcome.failed(templates.get(i), cause));
            }
        }
        return outcomes;
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static final class ExpansionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "expansion-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
