package com.ai.clinicdesk.conversation;

/**
 * Closed set of user intents the classifier can produce.
 */
public enum Intent {
    GREETING,
    BOOKING_REQUEST,
    AVAILABILITY_QUERY,
    PRICE_QUERY,
    INFO_QUERY,
    CLARIFICATION_ANSWER,
    UNKNOWN
}
