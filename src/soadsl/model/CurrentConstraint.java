package soadsl.model;

/**
 * A current limit of a current_with_heating rule. {@code type} is one of {@code idc}, {@code ipeak}, {@code irms}.
 */
public record CurrentConstraint(String name, String type, LimitValue ihigh, String message) {}
