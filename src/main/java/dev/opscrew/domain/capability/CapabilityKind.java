package dev.opscrew.domain.capability;

/**
 * Variant tag of a {@link Capability}.
 */
public enum CapabilityKind {
    TOOL, AGENT
}
