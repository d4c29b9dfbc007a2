package com.zzf.codesync.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.zzf.codesync.core.tree.UiTreeNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of a write request. A rejected outcome carries the unchanged buffer.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "reason", "linesDelta", "version", "text", "tree"})
public final class EditOutcome {
    public static final String APPLIED = "applied";
    public static final String REJECTED = "rejected";

    private final String status;
    private final RejectReason reason;
    private final int linesDelta;
    private final long version;
    private final String text;
    private final UiTreeNode tree;

    static EditOutcome applied(SyncSnapshot snapshot, int linesDelta) {
        return new EditOutcome(APPLIED, null, linesDelta, snapshot.getBuffer().getVersion(),
                snapshot.getBuffer().getText(), snapshot.getTree());
    }

    static EditOutcome rejected(RejectReason reason, SyncSnapshot snapshot) {
        return new EditOutcome(REJECTED, reason, 0, snapshot.getBuffer().getVersion(),
                snapshot.getBuffer().getText(), snapshot.getTree());
    }

    @JsonIgnore
    public boolean isApplied() {
        return APPLIED.equals(status);
    }
}
