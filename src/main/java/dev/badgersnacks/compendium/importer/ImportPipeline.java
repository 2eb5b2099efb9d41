package dev.badgersnacks.compendium.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.compendium.decode.CompendiumBundle;
import dev.badgersnacks.compendium.decode.CompendiumDecoder;
import dev.badgersnacks.compendium.logging.ImportActionLog;
import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.CatalogSource;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.model.ItemKey;
import dev.badgersnacks.compendium.persistence.CatalogDatabase;
import dev.badgersnacks.compendium.persistence.CatalogItemRow;
import dev.badgersnacks.compendium.persistence.CatalogPersistenceException;
import dev.badgersnacks.compendium.persistence.EngineSettings;
import dev.badgersnacks.compendium.persistence.ItemCatalogRepository;
import dev.badgersnacks.compendium.util.SourcedRef;
import dev.badgersnacks.compendium.variants.ExpansionOrchestrator;
import dev.badgersnacks.compendium.variants.ExpansionResult;
import dev.badgersnacks.compendium.variants.ExpansionWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Two-stage catalog import: {@link #ingest(CompendiumBundle)} once per requested source, then
 * {@link #expandVariants()} once all of them are in.
 *
 * <p>Expansion is global because a template from one source book combines with base items from another, so
 * ingesting after the expansion ran is rejected. Re-running {@code expandVariants()} is allowed and converges to
 * the same catalog.
 */
public final class ImportPipeline implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImportPipeline.class);

    private final CompendiumDecoder decoder = new CompendiumDecoder();
    private final ItemCatalogRepository repository;
    private final ObjectMapper mapper;
    private final ExpansionWorkerPool workers;
    private final ExpansionOrchestrator orchestrator;
    private final ImportActionLog actionLog;
    private final Map<String, StagedSource> staged = new LinkedHashMap<>();
    private boolean expanded;

    public ImportPipeline(ItemCatalogRepository repository,
                          ObjectMapper mapper,
                          ExpansionWorkerPool workers,
                          ImportActionLog actionLog) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.actionLog = actionLog;
        this.orchestrator = new ExpansionOrchestrator(repository, workers);
    }

    public static ImportPipeline open(EngineSettings settings, ImportActionLog actionLog) {
        Objects.requireNonNull(settings, "settings");
        ObjectMapper mapper = new ObjectMapper();
        ItemCatalogRepository repository = new ItemCatalogRepository(CatalogDatabase.from(settings), mapper);
        return new ImportPipeline(repository, mapper, new ExpansionWorkerPool(settings.parallelism()), actionLog);
    }

    /**
     * Writes a source's base items and plain items to the catalog, replacing what that source contributed
     * before, and stages its base items and templates for expansion.
     *
     * @throws IllegalStateException when {@link #expandVariants()} already ran for this pipeline
     */
    public synchronized IngestSummary ingest(CompendiumBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        CatalogSource source = bundle.source();
        if (expanded) {
            throw new IllegalStateException("Variant expansion already ran; cannot ingest " + source.code());
        }
        if (!source.enabled()) {
            LOGGER.info("Skipping disabled source {} ({})", source.code(), source.name());
            log("ingest:" + source.code(), "Source disabled, nothing ingested");
            return new IngestSummary(source.code(), 0, 0, 0);
        }

        List<BaseItem> baseItems = decoder.decodeBaseItems(bundle.baseItems(), source.code());
        List<GenericVariantTemplate> templates = decoder.decodeTemplates(bundle.variantTemplates());

        Map<ItemKey, CatalogItemRow> rows = new LinkedHashMap<>();
        for (BaseItem base : baseItems) {
            CatalogItemRow row = toRow(base.raw(), base.name(), base.source());
            rows.put(row.key(), row);
        }
        int plainItems = 0;
        for (JsonNode node : bundle.items()) {
            String name = node.path("name").asText(null);
            if (name == null || name.isBlank()) {
                LOGGER.warn("Skipping item without a name in source {}", source.code());
                continue;
            }
            String itemSource = node.path("source").asText(source.code());
            CatalogItemRow row = toRow(node, name, itemSource.isBlank() ? source.code() : itemSource);
            rows.put(row.key(), row);
            plainItems++;
        }

        try {
            repository.replaceIngestedItems(Set.of(source.code()), new ArrayList<>(rows.values()));
        } catch (CatalogPersistenceException e) {
            log("ingest:" + source.code(), "Ingest failed", e);
            throw e;
        }

        staged.put(source.code(), new StagedSource(source, baseItems, templates));
        IngestSummary summary = new IngestSummary(source.code(), baseItems.size(), templates.size(), plainItems);
        LOGGER.info("Ingested {}: {} base items, {} variant templates, {} items",
                source.code(), summary.baseItems(), summary.templates(), summary.items());
        log("ingest:" + source.code(), summary.baseItems() + " base items, " + summary.templates()
                + " variant templates, " + summary.items() + " items");
        return summary;
    }

    /**
     * Expands every staged template against every staged base item, across all ingested sources.
     *
     * @throws CatalogPersistenceException when the catalog write fails; the catalog keeps its previous rows
     */
    public synchronized ExpansionResult expandVariants() {
        Map<ItemKey, BaseItem> baseItems = new LinkedHashMap<>();
        List<GenericVariantTemplate> templates = new ArrayList<>();
        // walked by source code so a base item staged by two sources resolves the same way in any ingest order
        for (StagedSource source : new TreeMap<>(staged).values()) {
            source.baseItems().forEach(base -> baseItems.put(base.key(), base));
            templates.addAll(source.templates());
        }
        log("expand", "Expanding " + templates.size() + " variant templates against "
                + baseItems.size() + " base items from " + staged.keySet());
        ExpansionResult result;
        try {
            result = orchestrator.run(templates, baseItems.values());
        } catch (CatalogPersistenceException e) {
            log("expand", "Expansion aborted, catalog left unchanged", e);
            throw e;
        }
        expanded = true;
        log("expand", result.summary());
        if (actionLog != null) {
            actionLog.logWarnings("expand", result.warnings());
        }
        return result;
    }

    public synchronized List<CatalogSource> ingestedSources() {
        return staged.values().stream()
                .map(StagedSource::source)
                .collect(Collectors.toList());
    }

    public ItemCatalogRepository repository() {
        return repository;
    }

    @Override
    public void close() {
        workers.close();
    }

    private CatalogItemRow toRow(JsonNode node, String name, String source) {
        try {
            return CatalogItemRow.ingested(name,
                    source,
                    SourcedRef.strip(node.path("type").asText(null)),
                    node.path("rarity").asText(null),
                    mapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void log(String action, String message) {
        log(action, message, null);
    }

    private void log(String action, String message, Throwable error) {
        if (actionLog != null) {
            actionLog.log(action, message, error);
        }
    }

    private record StagedSource(CatalogSource source,
                                List<BaseItem> baseItems,
                                List<GenericVariantTemplate> templates) {
    }

    public record IngestSummary(String sourceCode, int baseItems, int templates, int items) {
    }
}
