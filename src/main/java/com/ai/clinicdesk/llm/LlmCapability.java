package com.ai.clinicdesk.llm;

import com.ai.clinicdesk.dto.EscalationContext;

import java.util.List;

/**
 * Opaque language-model capability. Implementations must bound every call with a timeout
 * and report problems as {@link LlmFailure} values instead of throwing.
 */
public interface LlmCapability {

    LlmResult<LlmClassification> classify(String text, List<String> recentTurns);

    LlmResult<String> generate(EscalationContext context);
}
