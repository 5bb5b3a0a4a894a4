package io.mylab.lab.labplatform.security;

import java.util.UUID;

/**
 * Authenticated actor of the current request, resolved once from the verified bearer token.
 *
 * @param id user id ({@code sub} claim)
 * @param workspaceId workspace the user belongs to; compared against resource ownership
 * @param orgId organization the user acts for; compared against grant recipients
 * @param role organization-wide platform role
 */
public record Principal(UUID id, UUID workspaceId, UUID orgId, PlatformRole role) {}
