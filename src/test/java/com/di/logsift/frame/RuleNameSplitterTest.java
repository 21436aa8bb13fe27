package com.di.logsift.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuleNameSplitter Tests")
class RuleNameSplitterTest {

    // ============================================================================
    // Name cleanup
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "pds_fw_updatecase_0123456789abcdef0123456789abcdef, pds_fw_updatecase",
            "pds_fw_updatecase_0123456789abcdef0123456789abcdef_extra, pds_fw_updatecase",
            "pds_loadcase_1234567890, pds_loadcase",
            "pds_loadcase$1, pds_loadcase",
            "pds_loadcase_123, pds_loadcase_123",
            "plainname, plainname"
    })
    @DisplayName("Should strip hash, numeric and inner class suffixes")
    void testCleanRuleName(String input, String expected) {
        assertEquals(expected, RuleNameSplitter.cleanRuleName(input));
    }

    // ============================================================================
    // Class / name split
    // ============================================================================

    @Test
    @DisplayName("Should split at the last underscore")
    void testSplit_LastUnderscore() {
        assertArrayEquals(new String[]{"pds_fw_denovo", "updatecase"},
                RuleNameSplitter.splitClassAndName("pds_fw_denovo_updatecase"));
    }

    @Test
    @DisplayName("Should merge an action verb token into a short rule name")
    void testSplit_ShortNameWithVerb() {
        assertArrayEquals(new String[]{"pds_fw", "update_case"},
                RuleNameSplitter.splitClassAndName("pds_fw_update_case"));
    }

    @Test
    @DisplayName("Should keep a short rule name when the previous token is not a verb")
    void testSplit_ShortNameWithoutVerb() {
        assertArrayEquals(new String[]{"pds_claim", "item"},
                RuleNameSplitter.splitClassAndName("pds_claim_item"));
    }

    @Test
    @DisplayName("Should report an absent class for a non-class prefix")
    void testSplit_NonClassPrefix() {
        assertArrayEquals(new String[]{RuleFrame.ABSENT, "get_value"},
                RuleNameSplitter.splitClassAndName("get_value"));
        assertArrayEquals(new String[]{RuleFrame.ABSENT, "Step_validate"},
                RuleNameSplitter.splitClassAndName("Step_validate"));
    }

    @Test
    @DisplayName("Should report an absent class when there is no underscore")
    void testSplit_NoUnderscore() {
        assertArrayEquals(new String[]{RuleFrame.ABSENT, "Submit"}, RuleNameSplitter.splitClassAndName("Submit"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"update", "preUpdate", "Recalculate", "doRun", "SET"})
    @DisplayName("Should recognise action verb suffixes case-insensitively")
    void testEndsWithActionVerb(String token) {
        assertTrue(RuleNameSplitter.endsWithActionVerb(token));
    }

    @Test
    @DisplayName("Should not treat ordinary tokens as verbs")
    void testEndsWithActionVerb_Negative() {
        assertFalse(RuleNameSplitter.endsWithActionVerb("claim"));
        assertFalse(RuleNameSplitter.endsWithActionVerb("fw"));
    }
}
