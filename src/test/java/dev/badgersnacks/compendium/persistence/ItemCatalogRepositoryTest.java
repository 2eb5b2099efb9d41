package dev.badgersnacks.compendium.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.badgersnacks.compendium.model.ExpandedItem;
import dev.badgersnacks.compendium.model.ItemKey;
import dev.badgersnacks.compendium.persistence.GeneratedItemStore.ReplaceOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static dev.badgersnacks.compendium.CompendiumFixtures.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemCatalogRepositoryTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ItemCatalogRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ItemCatalogRepository(CatalogDatabase.inMemory("catalog-" + UUID.randomUUID()), mapper);
    }

    @Test
    void replaceSwapsGeneratedRows() {
        repository.replaceGeneratedItems(List.of(generated("+1 Club"), generated("+1 Dagger")));
        ReplaceOutcome outcome = repository.replaceGeneratedItems(List.of(generated("+2 Club")));

        assertEquals(2, outcome.deleted());
        assertEquals(1, outcome.inserted());
        List<CatalogItemRow> rows = repository.listGeneratedItems();
        assertEquals(1, rows.size());
        assertEquals("+2 Club", rows.get(0).name());
        assertEquals("Test Template", rows.get(0).variantOf());
        assertEquals("Club|PHB", rows.get(0).baseItem());
    }

    @Test
    void replaceIsIdempotent() {
        List<ExpandedItem> items = List.of(generated("+1 Club"), generated("+1 Dagger"));
        repository.replaceGeneratedItems(items);
        List<CatalogItemRow> first = repository.listItems();
        repository.replaceGeneratedItems(items);

        assertEquals(first, repository.listItems());
        assertEquals(2, repository.countGenerated());
    }

    @Test
    void handAuthoredRowsAreNeverTouched() {
        CatalogItemRow authored = CatalogItemRow.ingested("+1 Club", "DMG", "M", "rare",
                "{\"name\":\"+1 Club\",\"source\":\"DMG\",\"custom\":true}");
        repository.insertItem(authored);

        ReplaceOutcome outcome = repository.replaceGeneratedItems(List.of(generated("+1 Club"), generated("+1 Mace")));
        assertEquals(List.of(new ItemKey("+1 Club", "DMG")), outcome.collisions());
        assertEquals(1, outcome.inserted());

        repository.replaceGeneratedItems(List.of());
        assertEquals(authored, repository.findItem(new ItemKey("+1 Club", "DMG")).orElseThrow());
        assertEquals(0, repository.countGenerated());
    }

    @Test
    void failedReplaceKeepsPreviousCatalog() {
        repository.replaceGeneratedItems(List.of(generated("+1 Club")));
        List<CatalogItemRow> before = repository.listItems();

        assertThrows(CatalogPersistenceException.class, () ->
                repository.replaceGeneratedItems(List.of(generated("+1 Dagger"), generated("+1 Dagger"))));
        assertEquals(before, repository.listItems());

        String tooLong = "X".repeat(600);
        assertThrows(CatalogPersistenceException.class, () ->
                repository.replaceGeneratedItems(List.of(generated(tooLong))));
        assertEquals(before, repository.listItems());
    }

    @Test
    void reingestReplacesSourceRowsAndDropsShadowedGeneratedRows() {
        repository.replaceIngestedItems(List.of("PHB"), List.of(
                CatalogItemRow.ingested("Club", "PHB", "M", "none", "{}"),
                CatalogItemRow.ingested("Dagger", "PHB", "M", "none", "{}")));
        repository.replaceGeneratedItems(List.of(generated("+1 Club")));

        repository.replaceIngestedItems(List.of("PHB"), List.of(
                CatalogItemRow.ingested("Club", "PHB", "M", "none", "{\"v\":2}"),
                CatalogItemRow.ingested("+1 Club", "DMG", "M", "rare", "{}")));

        assertTrue(repository.findItem(new ItemKey("Dagger", "PHB")).isEmpty());
        assertEquals("{\"v\":2}", repository.findItem(new ItemKey("Club", "PHB")).orElseThrow().data());
        CatalogItemRow shadowing = repository.findItem(new ItemKey("+1 Club", "DMG")).orElseThrow();
        assertNull(shadowing.variantOf());
        assertEquals(0, repository.countGenerated());
    }

    @Test
    void attunementClassesFollowTheirItem() {
        ExpandedItem holyAvenger = new ExpandedItem("Holy Avenger Longsword", "DMG", "M", "legendary",
                json("{\"name\": \"Holy Avenger Longsword\", \"reqAttune\": \"by a cleric or paladin\"}"),
                "Holy Avenger", "Longsword|PHB");
        ExpandedItem plain = new ExpandedItem("+1 Longsword", "DMG", "M", "uncommon",
                json("{\"name\": \"+1 Longsword\", \"reqAttune\": true}"), "+1 Weapon", "Longsword|PHB");

        repository.replaceGeneratedItems(List.of(holyAvenger, plain));

        assertEquals(List.of("cleric", "paladin"),
                repository.findAttunementClasses(new ItemKey("Holy Avenger Longsword", "DMG")));
        assertTrue(repository.findAttunementClasses(new ItemKey("+1 Longsword", "DMG")).isEmpty());

        repository.replaceGeneratedItems(List.of(plain));
        assertTrue(repository.findAttunementClasses(new ItemKey("Holy Avenger Longsword", "DMG")).isEmpty());
    }

    @Test
    void ingestedItemsIndexAttunementAndReplaceIt() {
        repository.replaceIngestedItems(List.of("DMG"), List.of(CatalogItemRow.ingested("Staff of Power", "DMG",
                "ST", "very rare", "{\"reqAttune\": \"by a sorcerer, warlock, or wizard\"}")));
        assertEquals(List.of("sorcerer", "warlock", "wizard"),
                repository.findAttunementClasses(new ItemKey("Staff of Power", "DMG")));

        repository.replaceIngestedItems(List.of("DMG"), List.of(CatalogItemRow.ingested("Staff of Power", "DMG",
                "ST", "very rare", "{\"reqAttune\": \"by a wizard\"}")));
        assertEquals(List.of("wizard"), repository.findAttunementClasses(new ItemKey("Staff of Power", "DMG")));
    }

    @Test
    void ingestRejectsGeneratedRows() {
        CatalogItemRow generatedRow = new CatalogItemRow("+1 Club", "DMG", "M", "uncommon", "{}", "T", "Club|PHB");
        assertThrows(IllegalArgumentException.class, () ->
                repository.replaceIngestedItems(List.of("DMG"), List.of(generatedRow)));
    }

    private static ExpandedItem generated(String name) {
        return new ExpandedItem(name, "DMG", "M", "uncommon",
                json("{\"name\": \"" + name + "\", \"source\": \"DMG\"}"), "Test Template", "Club|PHB");
    }
}
