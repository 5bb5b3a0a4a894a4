package io.mylab.lab.labplatform.resource;

import java.util.UUID;

/** Typed reference to a workspace-owned resource row. */
public record ResourceRef(ResourceType type, UUID id) {}
