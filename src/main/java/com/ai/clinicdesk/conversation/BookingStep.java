package com.ai.clinicdesk.conversation;

/**
 * Steps of the booking conversation, in the order they are asked.
 */
public enum BookingStep {
    NAME(false),
    PHONE(false),
    SERVICE(false),
    BRANCH(true),
    DATE_TIME(true),
    DONE(false),
    CANCELLED(false);

    private final boolean optional;

    BookingStep(boolean optional) {
        this.optional = optional;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }

    public BookingStep next() {
        switch (this) {
            case NAME:
                return PHONE;
            case PHONE:
                return SERVICE;
            case SERVICE:
                return BRANCH;
            case BRANCH:
                return DATE_TIME;
            case DATE_TIME:
                return DONE;
            default:
                return this;
        }
    }
}
