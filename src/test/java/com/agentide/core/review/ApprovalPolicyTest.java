package com.agentide.core.review;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.model.ReviewAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalPolicyTest {

    private static final List<String> VOCABULARY = List.of("looks good", "approve", "ok", "lgtm", "done");

    @Nested
    @DisplayName("Whole-phrase matching")
    class WholePhrase {

        private final ApprovalPolicy policy = new ApprovalPolicy(ApprovalMatching.WHOLE_PHRASE, VOCABULARY);

        @ParameterizedTest
        @ValueSource(strings = {"looks good", "Looks good!", "LGTM.", "  ok  ", "approve"})
        @DisplayName("approves vocabulary phrases regardless of case and trailing punctuation")
        void approvesPhrases(String feedback) {
            assertTrue(policy.isApproval(feedback, Optional.empty()));
        }

        @ParameterizedTest
        @ValueSource(strings = {"not ok, add tests", "add a docstring", "this is done wrong", "book a flight"})
        @DisplayName("treats sentences containing approval words as revisions")
        void revisesSentences(String feedback) {
            assertFalse(policy.isApproval(feedback, Optional.empty()));
        }

        @Test
        @DisplayName("empty or missing feedback approves")
        void emptyApproves() {
            assertTrue(policy.isApproval("", Optional.empty()));
            assertTrue(policy.isApproval(null, Optional.empty()));
        }
    }

    @Test
    @DisplayName("substring matching reproduces the permissive behavior")
    void substringMatching() {
        var policy = new ApprovalPolicy(ApprovalMatching.SUBSTRING, VOCABULARY);

        assertTrue(policy.isApproval("book a flight", Optional.empty()));
        assertFalse(policy.isApproval("add tests", Optional.empty()));
    }

    @Nested
    @DisplayName("Explicit actions")
    class ExplicitActions {

        private final ApprovalPolicy policy = new ApprovalPolicy(ApprovalMatching.WHOLE_PHRASE, VOCABULARY);

        @Test
        @DisplayName("APPROVE approves whatever the text says")
        void approveWins() {
            assertTrue(policy.isApproval("please add tests", Optional.of(ReviewAction.APPROVE)));
        }

        @Test
        @DisplayName("REVISE with text revises even for vocabulary phrases")
        void reviseWins() {
            assertFalse(policy.isApproval("ok", Optional.of(ReviewAction.REVISE)));
        }
    }

    @Test
    @DisplayName("defaults come from properties")
    void defaultsFromProperties() {
        var policy = new ApprovalPolicy(new AgentIdeProperties());

        assertEquals(ApprovalMatching.WHOLE_PHRASE, policy.matching());
        assertTrue(policy.isApproval("Perfect!", Optional.empty()));
    }
}
