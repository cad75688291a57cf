package com.example.Lily.repository;

import com.example.Lily.model.CatalogPart;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PartsCatalogRepositoryTest {

    private EmbeddedDatabase database;
    private PartsCatalogRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("parts-test.sql")
                .build();
        repository = new PartsCatalogRepository(new JdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void shouldFindByPartIdIgnoringCase() {
        List<CatalogPart> parts = repository.findByNumber(" ps11752778 ", null, 5);

        assertEquals(1, parts.size());
        CatalogPart bin = parts.get(0);
        assertEquals("Refrigerator Door Shelf Bin", bin.partName());
        assertEquals(0, new BigDecimal("44.95").compareTo(bin.partPrice()));
        assertEquals("Whirlpool", bin.brand());
    }

    @Test
    void shouldFindByManufacturerNumber() {
        List<CatalogPart> parts = repository.findByNumber(null, "wd08x10057", 5);

        assertEquals(List.of("PS3406971"), parts.stream().map(CatalogPart::partId).toList());
    }

    @Test
    void shouldReturnNothingWithoutNumbers() {
        assertTrue(repository.findByNumber(null, null, 5).isEmpty());
    }

    @Test
    void shouldRankNameMatchesFirst() {
        List<CatalogPart> parts = repository.search("leaking water", null, null, 5);

        assertEquals(3, parts.size());
        assertEquals("PS11722130", parts.get(0).partId());
    }

    @Test
    void shouldApplyApplianceAndBrandFilters() {
        List<CatalogPart> dishwasher = repository.search("leaking", "Dishwasher", null, 5);
        List<CatalogPart> geDishwasher = repository.search("leaking", "dishwasher", "ge", 5);

        assertEquals(2, dishwasher.size());
        assertEquals(List.of("PS3406971"), geDishwasher.stream().map(CatalogPart::partId).toList());
    }

    @Test
    void shouldHonourLimit() {
        assertEquals(1, repository.search("leaking", null, null, 1).size());
    }

    @Test
    void shouldExtractSearchTerms() {
        assertEquals(List.of("ice", "maker"), PartsCatalogRepository.terms("the ice maker"));
        assertEquals(List.of("fix", "fridge"), PartsCatalogRepository.terms("How do I fix my fridge?"));
        assertTrue(PartsCatalogRepository.terms("a an to").isEmpty());
        assertTrue(PartsCatalogRepository.terms(null).isEmpty());
    }
}
