package com.flagship.cashback_ledger.common;

import lombok.Value;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifier received at the API boundary, tagged with the store that minted it.
 *
 * Callers hand us either a legacy primary-store id (a Mongo ObjectId hex string)
 * or a native relational id (a UUID assigned by the shadow store). The kind is
 * decided once, here, so query sites never re-inspect the raw string.
 */
@Value
public class EntityId {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    public enum Kind {
        /** Id issued by the primary document store. */
        LEGACY,
        /** Id issued by the secondary relational store. */
        NATIVE
    }

    Kind kind;
    String value;

    public static EntityId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be null or blank");
        }
        String trimmed = raw.trim();
        if (UUID_PATTERN.matcher(trimmed).matches()) {
            return new EntityId(Kind.NATIVE, trimmed.toLowerCase());
        }
        return new EntityId(Kind.LEGACY, trimmed);
    }

    public static EntityId legacy(String value) {
        return new EntityId(Kind.LEGACY, value);
    }

    public boolean isNative() {
        return kind == Kind.NATIVE;
    }

    /**
     * Returns the value as a UUID.
     *
     * @throws IllegalStateException if this is a legacy id
     */
    public UUID asUuid() {
        if (kind != Kind.NATIVE) {
            throw new IllegalStateException("Legacy id " + value + " is not a UUID");
        }
        return UUID.fromString(value);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + value;
    }
}
