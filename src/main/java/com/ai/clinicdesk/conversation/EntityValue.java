package com.ai.clinicdesk.conversation;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Extracted entity value. REFERENCE values hold the resolved id in {@code value};
 * unresolved or ambiguous references keep the raw mention and any candidate ids.
 */
public final class EntityValue {

    public enum Kind {
        STRING,
        DATE,
        REFERENCE
    }

    private final Kind kind;
    private final String raw;
    private final String value;
    private final LocalDate date;
    private final List<String> candidates;

    private EntityValue(Kind kind, String raw, String value, LocalDate date, List<String> candidates) {
        this.kind = kind;
        this.raw = raw;
        this.value = value;
        this.date = date;
        this.candidates = candidates == null ? Collections.emptyList() : List.copyOf(candidates);
    }

    public static EntityValue text(String value) {
        return new EntityValue(Kind.STRING, value, value, null, null);
    }

    public static EntityValue date(String raw, LocalDate date) {
        return new EntityValue(Kind.DATE, raw, date.toString(), date, null);
    }

    /** A date the user mentioned that could not be read. */
    public static EntityValue unreadableDate(String raw) {
        return new EntityValue(Kind.DATE, raw, null, null, null);
    }

    public static EntityValue reference(String raw, String id) {
        return new EntityValue(Kind.REFERENCE, raw, id, null, List.of(id));
    }

    public static EntityValue unresolved(String raw) {
        return new EntityValue(Kind.REFERENCE, raw, null, null, null);
    }

    public static EntityValue ambiguous(String raw, List<String> candidateIds) {
        return new EntityValue(Kind.REFERENCE, raw, null, null, candidateIds);
    }

    public Kind getKind() {
        return kind;
    }

    public String getRaw() {
        return raw;
    }

    /** Resolved id for references, the literal for strings, ISO date for dates. Null when unresolved. */
    public String getValue() {
        return value;
    }

    public LocalDate getDate() {
        return date;
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public boolean isResolved() {
        return value != null;
    }

    public boolean isAmbiguous() {
        return value == null && candidates.size() > 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityValue)) return false;
        EntityValue that = (EntityValue) o;
        return kind == that.kind
                && Objects.equals(raw, that.raw)
                && Objects.equals(value, that.value)
                && Objects.equals(date, that.date)
                && candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw, value, date, candidates);
    }

    @Override
    public String toString() {
        return kind + "(" + (value != null ? value : "?" + raw + candidates) + ")";
    }
}
