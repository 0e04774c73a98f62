package com.ai.clinicdesk.conversation;

import com.ai.clinicdesk.dto.ReferenceSnapshot;

import java.util.List;

/**
 * Inputs the classifier needs besides the raw text. Snapshot may be null when reference data
 * is not loaded yet.
 */
public record ClassificationContext(ReferenceSnapshot snapshot,
                                    List<String> recentTurns,
                                    PendingClarification pendingClarification,
                                    BookingStep pendingStep) {

    public static ClassificationContext of(ReferenceSnapshot snapshot) {
        return new ClassificationContext(snapshot, List.of(), null, null);
    }
}
