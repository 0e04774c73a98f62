package com.ai.clinicdesk.llm;

public enum LlmFailure {
    /** No API key configured or endpoint unreachable. */
    UNAVAILABLE,
    TIMEOUT,
    /** Response did not match the requested structured-output schema. */
    SCHEMA_VIOLATION,
    EMPTY_RESPONSE,
    ERROR
}
