package net.eventmail.core.model;

/** A parameter ready to hand to the procedure invoker. */
public record BoundParameter(String name, ParamDirection direction, TypedValue value) {
    public ParamType type() { return value.type(); }
}
