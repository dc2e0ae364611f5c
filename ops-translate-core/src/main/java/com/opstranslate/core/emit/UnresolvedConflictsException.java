package com.opstranslate.core.emit;

import com.opstranslate.core.model.ConflictRecord;

import java.util.List;

/**
 * Thrown when a merged intent with conflicts is emitted without acknowledgement.
 */
public class UnresolvedConflictsException extends RuntimeException {

    private final List<ConflictRecord> conflicts;

    public UnresolvedConflictsException(List<ConflictRecord> conflicts) {
        super("Merged intent has " + conflicts.size() + " unresolved conflict(s): "
            + String.join(", ", conflicts.stream().map(ConflictRecord::subject).toList())
            + ". Resolve them or acknowledge them explicitly.");
        this.conflicts = List.copyOf(conflicts);
    }

    public List<ConflictRecord> getConflicts() {
        return conflicts;
    }
}
