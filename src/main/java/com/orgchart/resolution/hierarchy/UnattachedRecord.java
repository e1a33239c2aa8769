package com.orgchart.resolution.hierarchy;

import com.orgchart.resolution.core.model.EntityRecord;

import java.util.Objects;

/**
 * A record that is not part of the tree, with the reason.
 *
 * @param record  the record
 * @param reason  why it was not attached
 * @param message human-readable detail
 */
public record UnattachedRecord(EntityRecord record, UnattachedReason reason, String message) {

    public UnattachedRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(reason, "reason is required");
    }

    public String name() {
        return record.name();
    }
}
