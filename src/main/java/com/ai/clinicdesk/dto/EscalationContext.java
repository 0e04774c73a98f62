package com.ai.clinicdesk.dto;

import com.ai.clinicdesk.conversation.Intent;

import java.util.List;

/**
 * Everything the reply generator gets when a message cannot be answered from reference data.
 */
public record EscalationContext(Reason reason,
                                String userText,
                                Intent intent,
                                List<String> unresolvedFields,
                                List<String> recentTurns,
                                String clinicFacts) {

    public enum Reason {
        UNKNOWN_INTENT,
        LOW_CONFIDENCE,
        MULTIPLE_UNRESOLVED,
        REPEATED_CLARIFICATION,
        REFERENCE_DATA_UNAVAILABLE
    }

    public EscalationContext withConversation(String text, List<String> turns, String facts) {
        return new EscalationContext(reason, text, intent, unresolvedFields, turns, facts);
    }
}
