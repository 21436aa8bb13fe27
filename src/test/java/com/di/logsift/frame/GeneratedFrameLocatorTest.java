package com.di.logsift.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GeneratedFrameLocator Tests")
class GeneratedFrameLocatorTest {

    private static final String HASH = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("Should locate a frame with source suffix and strip the class hash")
    void testLocate_WithSourceSuffix() {
        String trace = "java.lang.IllegalStateException: locked\n"
                + "\tat com.pegarules.generated.activity.ra_action_pds_fw_denovo_updatecase_" + HASH
                + ".perform(ra_action_pds_fw_denovo_updatecase_" + HASH + ".java:245)\n"
                + "\tat java.lang.Thread.run(Thread.java:829)";

        List<GeneratedFrame> frames = GeneratedFrameLocator.locate(trace);

        assertEquals(1, frames.size());
        GeneratedFrame frame = frames.get(0);
        assertEquals(1, frame.getSequenceOrder());
        assertEquals(2, frame.getLineNumber());
        assertEquals("com.pegarules.generated.activity", frame.getTypeOfRule());
        assertEquals("ra_action_pds_fw_denovo_updatecase", frame.getRuleGenerated());
        assertEquals("perform", frame.getFunctionInvoked());
        assertEquals("com.pegarules.generated.activity.ra_action_pds_fw_denovo_updatecase", frame.getClassGenerated());
        assertEquals("ra_action_pds_fw_denovo_updatecase_" + HASH, frame.getClassNameInParens());
    }

    @Test
    @DisplayName("Should render the summary entry and parse it back as a rule frame")
    void testSummarize_RoundTripsThroughParser() {
        String trace = "\tat com.pegarules.generated.activity.ra_action_pds_fw_denovo_updatecase_" + HASH
                + ".perform(ra_action_pds_fw_denovo_updatecase_" + HASH + ".java:245)\n"
                + "\tat com.pegarules.generated.activity.ra_action_pds_fw_claims_submitclaim_" + HASH
                + ".perform(ra_action_pds_fw_claims_submitclaim_" + HASH + ".java:88)";

        String summary = GeneratedFrameLocator.summarize(GeneratedFrameLocator.locate(trace));

        assertEquals("1:com.pegarules.generated.activity->ra_action_pds_fw_denovo_updatecase->perform"
                        + "->com.pegarules.generated.activity.ra_action_pds_fw_denovo_updatecase"
                        + " | 2:com.pegarules.generated.activity->ra_action_pds_fw_claims_submitclaim->perform"
                        + "->com.pegarules.generated.activity.ra_action_pds_fw_claims_submitclaim",
                summary);
        assertEquals(List.of(
                new RuleFrame("activity", "pds_fw_denovo", "updatecase"),
                new RuleFrame("activity", "pds_fw_claims", "submitclaim")), StackFrameParser.extractFrames(summary));
    }

    @Test
    @DisplayName("Should pick up bare occurrences without a source suffix")
    void testLocate_BareOccurrence() {
        String trace = "Failure in com.pegarules.generated.activity.ra_action_pds_fw_denovo_updatecase_" + HASH
                + ".perform while saving";

        List<GeneratedFrame> frames = GeneratedFrameLocator.locate(trace);

        assertEquals(1, frames.size());
        assertEquals("perform", frames.get(0).getFunctionInvoked());
        assertEquals("", frames.get(0).getClassNameInParens());
    }

    @Test
    @DisplayName("Should return nothing for traces without generated classes")
    void testLocate_NoGeneratedFrames() {
        assertTrue(GeneratedFrameLocator.locate("java.lang.NullPointerException\n\tat a.b.C.d(C.java:1)").isEmpty());
        assertTrue(GeneratedFrameLocator.locate(null).isEmpty());
        assertEquals("", GeneratedFrameLocator.summarize(List.of()));
    }
}
