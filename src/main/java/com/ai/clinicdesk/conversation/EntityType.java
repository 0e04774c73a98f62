package com.ai.clinicdesk.conversation;

/**
 * Entity slots extracted from a message. DOCTOR, SERVICE and BRANCH are references
 * into the clinic reference data; TOPIC carries an {@link InfoTopic} or {@link GreetingKind} name.
 */
public enum EntityType {
    DOCTOR(true),
    SERVICE(true),
    BRANCH(true),
    DATE(false),
    TIME(false),
    PHONE(false),
    NAME(false),
    TOPIC(false);

    private final boolean reference;

    EntityType(boolean reference) {
        this.reference = reference;
    }

    public boolean isReference() {
        return reference;
    }
}
