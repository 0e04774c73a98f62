package com.ai.clinicdesk.dto;

public final class ProcessingOutcome {

    public enum Type {
        REPLY,
        DUPLICATE,
        RATE_LIMITED
    }

    private static final ProcessingOutcome DUPLICATE = new ProcessingOutcome(Type.DUPLICATE, null);

    private final Type type;
    private final String reply;

    private ProcessingOutcome(Type type, String reply) {
        this.type = type;
        this.reply = reply;
    }

    public static ProcessingOutcome reply(String text) {
        return new ProcessingOutcome(Type.REPLY, text);
    }

    public static ProcessingOutcome duplicate() {
        return DUPLICATE;
    }

    /** @param notice throttle notice to send, or null when the user was already told */
    public static ProcessingOutcome rateLimited(String notice) {
        return new ProcessingOutcome(Type.RATE_LIMITED, notice);
    }

    public Type getType() {
        return type;
    }

    public String getReply() {
        return reply;
    }

    public boolean hasReply() {
        return reply != null && !reply.isEmpty();
    }

    @Override
    public String toString() {
        return type + (reply != null ? "{" + reply.length() + " chars}" : "");
    }
}
