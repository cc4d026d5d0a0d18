package com.scenetree.hierarchy;

/**
 * Thrown by a {@link HierarchyTC} when asked about a tag the host never registered.
 * The search code lets it propagate.
 */
public class UnknownTagException extends RuntimeException {
    private final String tag;

    public UnknownTagException(String tag) {
        super("Tag: " + tag + " is not defined.");
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
