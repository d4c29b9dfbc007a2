package com.zzf.codesync.core.tree;

/**
 * A named argument {@code name: value} of a node's own argument list, with its source offsets.
 * {@code start} is the offset of the name, {@code valueEnd} is exclusive and excludes trailing blanks,
 * comments and the separating comma.
 */
public final class NodeArgument {
    private final String name;
    private final int start;
    private final int valueStart;
    private final int valueEnd;
    private final String rawValue;

    public NodeArgument(String name, int start, int valueStart, int valueEnd, String rawValue) {
        this.name = name;
        this.start = start;
        this.valueStart = valueStart;
        this.valueEnd = valueEnd;
        this.rawValue = rawValue;
    }

    public String getName() {
        return name;
    }

    public int getStart() {
        return start;
    }

    public int getValueStart() {
        return valueStart;
    }

    public int getValueEnd() {
        return valueEnd;
    }

    public String getRawValue() {
        return rawValue;
    }

    @Override
    public String toString() {
        return name + ": " + rawValue;
    }
}
