package com.templatebinder.variables;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableRegistryTest {

    private final VariableRegistry registry = VariableRegistry.standard();

    @Test
    void loadsFullCatalog() {
        assertEquals(185, registry.size());
        assertEquals(185, registry.getNames().size());
    }

    @Test
    void categoryCountsMatchCatalog() {
        assertEquals(10, registry.getByCategory(VariableCategory.TEAM).size());
        assertEquals(15, registry.getByCategory(VariableCategory.SCORE).size());
        assertEquals(10, registry.getByCategory(VariableCategory.EVENT).size());
        assertEquals(135, registry.getByCategory(VariableCategory.PLAYER).size());
        assertEquals(6, registry.getByCategory(VariableCategory.TEMPLATE_CONTROL).size());
        assertEquals(9, registry.getByCategory(VariableCategory.MEDIA).size());
    }

    @Test
    void everyVariableResolvesByNameAndStoreName() {
        for (VariableDefinition variable : registry.getAll()) {
            assertEquals(variable, registry.getByName(variable.getName()).orElseThrow());
            assertEquals(variable, registry.getByName(variable.getStoreName()).orElseThrow());
        }
    }

    @Test
    void lookupIsCaseSensitive() {
        assertTrue(registry.exists("homeTeamName"));
        assertFalse(registry.exists("HomeTeamName"));
        assertFalse(registry.exists("hometeamname"));
    }

    @Test
    void stripsOnlyOneStorePrefix() {
        assertTrue(registry.getByName("zhomeTeamName").isPresent());
        assertTrue(registry.getByName("zzhomeTeamName").isEmpty());
    }

    @Test
    void unknownNameIsEmptyButRequireThrows() {
        assertTrue(registry.getByName("notAVariable").isEmpty());
        assertTrue(registry.getByName(null).isEmpty());
        UnknownVariableException e = assertThrows(UnknownVariableException.class,
            () -> registry.require("notAVariable"));
        assertEquals("notAVariable", e.getVariableName());
    }

    @Test
    void expandsPlayerFields() {
        VariableDefinition number = registry.require("player12Number");
        assertEquals(VariableCategory.PLAYER, number.getCategory());
        assertEquals(VariableDataType.NUMBER, number.getDataType());
        assertEquals("12", number.getDefaultValue());
        assertTrue(registry.exists("player15Stats"));
        assertFalse(registry.exists("player16Stats"));
    }

    @Test
    void dataTypesAreCarried() {
        assertEquals(VariableDataType.LOGO, registry.require("homeTeamLogo").getDataType());
        assertEquals(VariableDataType.COLOR, registry.require("homeTeamColor1").getDataType());
        assertEquals(VariableDataType.IMAGE, registry.require("featuredImage2").getDataType());
        assertFalse(registry.getByDataType(VariableDataType.TEXT).isEmpty());
    }

    @Test
    void storePrefixedNames() {
        assertTrue(registry.getNames(true).contains("zhomeTeamName"));
        assertFalse(registry.getNames(false).contains("zhomeTeamName"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void summaryCountsByCategoryAndType() {
        Map<String, Object> summary = registry.getSummary();
        assertEquals(185, summary.get("total"));
        Map<String, Integer> byCategory = (Map<String, Integer>) summary.get("byCategory");
        assertEquals(135, byCategory.get("player"));
        assertEquals(6, byCategory.get("templateControl"));
        Map<String, Integer> byType = (Map<String, Integer>) summary.get("byType");
        int total = byType.values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(185, total);
    }
}
