package org.iceforge.placefinder.graph;

/**
 * A unit or resource would be realized before a prerequisite published what it needs.
 * Always a graph-construction bug, never a condition to recover from.
 */
public class OrderingViolationException extends RuntimeException {
    public OrderingViolationException(String message) { super(message); }
}
