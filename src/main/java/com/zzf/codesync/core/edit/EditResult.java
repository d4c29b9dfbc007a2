package com.zzf.codesync.core.edit;

import java.util.Optional;

/**
 * Outcome of one structural edit.
 *
 * <p>{@code linesDelta} is the net change in line count. {@code changeLine} is the first line (1-based, in the
 * old text) from which lines were inserted or removed; the tracker is shifted from there.
 */
public final class EditResult {
    private final String newText;
    private final int linesDelta;
    private final int changeLine;
    private final EditFailure failure;

    private EditResult(String newText, int linesDelta, int changeLine, EditFailure failure) {
        this.newText = newText;
        this.linesDelta = linesDelta;
        this.changeLine = changeLine;
        this.failure = failure;
    }

    public static EditResult applied(String newText, int linesDelta, int changeLine) {
        return new EditResult(newText, linesDelta, changeLine, null);
    }

    public static EditResult failed(String originalText, EditFailure failure) {
        return new EditResult(originalText, 0, 0, failure);
    }

    public boolean isApplied() {
        return failure == null;
    }

    public String getNewText() {
        return newText;
    }

    public int getLinesDelta() {
        return linesDelta;
    }

    public int getChangeLine() {
        return changeLine;
    }

    public Optional<EditFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isApplied()
                ? "EditResult(applied, linesDelta=" + linesDelta + ", changeLine=" + changeLine + ")"
                : "EditResult(" + failure + ")";
    }
}
