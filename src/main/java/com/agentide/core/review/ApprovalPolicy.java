package com.agentide.core.review;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.model.ReviewAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether reviewer feedback approves the session or asks for a revision.
 * <p>
 * An explicit {@link ReviewAction#APPROVE} always approves, as does empty feedback.
 * An explicit {@link ReviewAction#REVISE} with non-empty text always revises.
 * Otherwise the text is matched against the approval vocabulary.
 */
@Component
public class ApprovalPolicy {

    private final ApprovalMatching matching;
    private final List<String> vocabulary;

    public ApprovalPolicy(AgentIdeProperties properties) {
        this(properties.getReview().getApprovalMatching(), properties.getReview().getVocabulary());
    }

    public ApprovalPolicy(ApprovalMatching matching, List<String> vocabulary) {
        this.matching = matching;
        this.vocabulary = vocabulary.stream()
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .toList();
    }

    public boolean isApproval(String feedback, Optional<ReviewAction> action) {
        if (action.isPresent() && action.get() == ReviewAction.APPROVE) {
            return true;
        }
        String text = feedback == null ? "" : feedback.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) {
            return true;
        }
        if (action.isPresent()) {
            return false;
        }
        return switch (matching) {
            case SUBSTRING -> vocabulary.stream().anyMatch(text::contains);
            case WHOLE_PHRASE -> vocabulary.contains(stripTrailingPunctuation(text));
        };
    }

    public ApprovalMatching matching() {
        return matching;
    }

    private static String stripTrailingPunctuation(String text) {
        int end = text.length();
        while (end > 0 && ".!,;:)".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end).trim();
    }
}
