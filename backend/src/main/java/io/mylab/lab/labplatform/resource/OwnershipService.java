package io.mylab.lab.labplatform.resource;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mylab.lab.labplatform.config.AccessControlProperties;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers whether a workspace owns a resource. Owner workspaces are immutable after creation, so
 * found owners are cached; misses are not, because the row may be created later.
 */
@Service
public class OwnershipService {

  private final ResourceOwnershipRepository ownershipRepository;
  private final Cache<ResourceRef, UUID> ownerCache;

  public OwnershipService(
      ResourceOwnershipRepository ownershipRepository, AccessControlProperties properties) {
    this.ownershipRepository = ownershipRepository;
    this.ownerCache =
        Caffeine.newBuilder()
            .maximumSize(properties.ownershipCache().maximumSize())
            .expireAfterWrite(properties.ownershipCache().expireAfterWrite())
            .build();
  }

  @Transactional(readOnly = true)
  public Optional<UUID> ownerOf(ResourceType type, UUID id) {
    var ref = new ResourceRef(type, id);
    UUID cached = ownerCache.getIfPresent(ref);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<UUID> owner = ownershipRepository.findOwnerWorkspaceId(type, id);
    owner.ifPresent(workspaceId -> ownerCache.put(ref, workspaceId));
    return owner;
  }

  /** True iff the resource exists and its recorded owner is {@code workspaceId}. */
  @Transactional(readOnly = true)
  public boolean isOwner(ResourceType type, UUID id, UUID workspaceId) {
    if (workspaceId == null) {
      return false;
    }
    return ownerOf(type, id).map(workspaceId::equals).orElse(false);
  }

  /** True iff the resource exists and is recorded under {@code projectId}. Never cached. */
  @Transactional(readOnly = true)
  public boolean belongsToProject(ResourceType type, UUID id, UUID projectId) {
    return ownershipRepository.findProjectId(type, id).map(projectId::equals).orElse(false);
  }
}
