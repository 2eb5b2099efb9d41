package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.BaseItem;
import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;
import dev.badgersnacks.compendium.model.ItemKey;
import dev.badgersnacks.compendium.model.Requirement;
import dev.badgersnacks.compendium.persistence.GeneratedItemStore;
import dev.badgersnacks.compendium.persistence.GeneratedItemStore.ReplaceOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expands every variant template against every base item and replaces the generated rows of the catalog with
 * the result.
 *
 * <p>Templates and base items are walked in {@code (name, source)} order, ties broken by their JSON text, so
 * runs over the same input are identical whatever order it arrives in. Matching runs in parallel, one task per
 * template; the results are collected in template order before the single batch write. When two pairs generate
 * the same {@code (name, source)}, the later pair wins.
 */
public class ExpansionOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpansionOrchestrator.class);

    static final Comparator<GenericVariantTemplate> TEMPLATE_ORDER = Comparator
            .comparing(GenericVariantTemplate::name)
            .thenComparing(template -> Objects.toString(template.effectiveSource(), ""))
            .thenComparing(template -> template.raw().toString());
    static final Comparator<BaseItem> BASE_ITEM_ORDER = Comparator
            .comparing(BaseItem::name)
            .thenComparing(BaseItem::source)
            .thenComparing(base -> base.raw().toString());

    private final NameComposer nameComposer;
    private final TemplateExpander expander;
    private final GeneratedItemStore store;
    private final ExpansionWorkerPool workers;

    public ExpansionOrchestrator(GeneratedItemStore store, ExpansionWorkerPool workers) {
        this(new MatchEngine(), new NameComposer(), new BlobMerger(), store, workers);
    }

    public ExpansionOrchestrator(MatchEngine matchEngine,
                                 NameComposer nameComposer,
                                 BlobMerger blobMerger,
                                 GeneratedItemStore store,
                                 ExpansionWorkerPool workers) {
        this.nameComposer = Objects.requireNonNull(nameComposer, "nameComposer");
        this.expander = new TemplateExpander(matchEngine, nameComposer, blobMerger);
        this.store = Objects.requireNonNull(store, "store");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Runs one full expansion and persists it.
     *
     * @throws dev.badgersnacks.compendium.persistence.CatalogPersistenceException when the write fails; the
     *                                                                              catalog is unchanged
     */
    public ExpansionResult run(Collection<GenericVariantTemplate> templates, Collection<BaseItem> baseItems) {
        Objects.requireNonNull(templates, "templates");
        Objects.requireNonNull(baseItems, "baseItems");
        List<String> warnings = new ArrayList<>();

        List<BaseItem> orderedBaseItems = baseItems.stream()
                .sorted(BASE_ITEM_ORDER)
                .collect(Collectors.toList());
        List<GenericVariantTemplate> validTemplates = new ArrayList<>();
        templates.stream()
                .sorted(TEMPLATE_ORDER)
                .forEach(template -> {
                    try {
                        validate(template, warnings);
                        validTemplates.add(template);
                    } catch (TemplateValidationException e) {
                        LOGGER.warn(e.getMessage());
                        warnings.add(e.getMessage());
                    }
                });

        List<TemplateOutcome> outcomes = workers.expandAll(validTemplates,
                template -> expander.expand(template, orderedBaseItems));

        Map<ItemKey, ExpandedItem> generated = new LinkedHashMap<>();
        int skipped = 0;
        int processed = 0;
        for (TemplateOutcome outcome : outcomes) {
            GenericVariantTemplate template = outcome.template();
            if (outcome.isFailed()) {
                Throwable cause = outcome.failure();
                String warning = "Skipping variant template '" + template.name() + "': expansion failed ("
                        + cause.getMessage() + ")";
                LOGGER.warn(warning, cause);
                warnings.add(warning);
                continue;
            }
            processed++;
            LOGGER.debug("Template {} produced {} items in {} ms",
                    template.displayId(), outcome.items().size(), outcome.elapsed().toMillis());
            for (ExpandedItem item : outcome.items()) {
                ExpandedItem previous = generated.put(item.key(), item);
                if (previous != null) {
                    skipped++;
                    String warning = "Duplicate generated item " + item.key().asString() + ": "
                            + describe(previous) + " replaced by " + describe(item);
                    LOGGER.warn(warning);
                    warnings.add(warning);
                }
            }
        }

        ReplaceOutcome replaced = store.replaceGeneratedItems(new ArrayList<>(generated.values()));
        for (ItemKey collision : replaced.collisions()) {
            skipped++;
            ExpandedItem blocked = generated.get(collision);
            String warning = "Generated item " + collision.asString() + " (" + describe(blocked)
                    + ") not stored: an existing catalog item has the same name and source";
            LOGGER.warn(warning);
            warnings.add(warning);
        }

        ExpansionResult expansion = new ExpansionResult(processed, orderedBaseItems.size(),
                replaced.inserted(), skipped, warnings);
        LOGGER.info("Expanded {} variant templates against {} base items: {}",
                processed, orderedBaseItems.size(), expansion.summary());
        return expansion;
    }

    /**
     * Rejects templates that cannot be expanded and records a warning for requirements that can never match.
     */
    void validate(GenericVariantTemplate template, List<String> warnings) throws TemplateValidationException {
        nameComposer.validate(template);
        if (template.effectiveSource() == null) {
            throw new TemplateValidationException(template.name(), "no source in inherits or on the template");
        }
        if (template.requires().isEmpty()) {
            throw new TemplateValidationException(template.name(), "requires is missing or empty");
        }
        List<String> problems = new ArrayList<>();
        int evaluable = 0;
        for (int i = 0; i < template.requires().size(); i++) {
            Requirement requirement = template.requires().get(i);
            if (requirement.isEvaluable()) {
                evaluable++;
            } else if (requirement.isMalformed()) {
                problems.add("requires[" + i + "] is a " + requirement.malformedShape());
            } else {
                problems.add("requires[" + i + "] has unsupported values for " + requirement.unsupportedKeys());
            }
        }
        if (evaluable == 0) {
            throw new TemplateValidationException(template.name(),
                    "no requirement can be evaluated (" + String.join("; ", problems) + ")");
        }
        if (!template.unsupportedExcludes().isEmpty()) {
            problems.add("excludes has unsupported values for " + template.unsupportedExcludes());
        }
        if (!problems.isEmpty()) {
            String warning = "Variant template '" + template.name() + "' treats unsupported rules as non-matching: "
                    + String.join("; ", problems);
            LOGGER.warn(warning);
            warnings.add(warning);
        }
    }

    private static String describe(ExpandedItem item) {
        if (item == null) {
            return "unknown";
        }
        return "'" + item.variantOf() + "' on " + item.baseItem();
    }
}
