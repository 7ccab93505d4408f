package com.flagship.pawn_ledger.ledger;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Link from a ledger entry to the pledge, payment or process that caused it.
 */
@Value
public class EntryReference {
    ReferenceKind kind;
    UUID id;

    private EntryReference(ReferenceKind kind, UUID id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static EntryReference of(ReferenceKind kind, UUID id) {
        return new EntryReference(kind, id);
    }

    public EntryReference reversal() {
        return new EntryReference(kind.reversal(), id);
    }
}
