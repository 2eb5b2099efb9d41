package dev.badgersnacks.compendium.variants;

import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.GenericVariantTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * What one template produced on a worker thread. {@code failure} is set when the evaluation threw; the items
 * are empty in that case.
 */
record TemplateOutcome(GenericVariantTemplate template, List<ExpandedItem> items, Duration elapsed,
                       Throwable failure) {

    TemplateOutcome {
        Objects.requireNonNull(template, "template");
        items = items == null ? List.of() : List.copyOf(items);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    static TemplateOutcome generated(GenericVariantTemplate template, List<ExpandedItem> items, Duration elapsed) {
        return new TemplateOutcome(template, items, elapsed, null);
    }

    static TemplateOutcome failed(GenericVariantTemplate template, Throwable failure) {
        return new TemplateOutcome(template, List.of(), Duration.ZERO, Objects.requireNonNull(failure, "failure"));
    }

    boolean isFailed() {
        return failure != null;
    }
}
