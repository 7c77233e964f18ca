package com.agentide.core.review;

/**
 * How reviewer feedback is matched against the approval vocabulary.
 */
public enum ApprovalMatching {
    /** The whole feedback, trimmed and without trailing punctuation, must equal a vocabulary entry. */
    WHOLE_PHRASE,
    /** Any vocabulary entry appearing anywhere in the feedback approves. */
    SUBSTRING
}
