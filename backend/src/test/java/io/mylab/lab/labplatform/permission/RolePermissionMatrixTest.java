package io.mylab.lab.labplatform.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class RolePermissionMatrixTest {

  @Mock private RolePermissionRepository repository;
  @InjectMocks private RolePermissionMatrix matrix;

  @Test
  void seedPolicyMatchesRoleHierarchy() {
    matrix.load(DefaultRolePermissions.seed());

    assertThat(matrix.isRoleAllowed(PlatformRole.ADMIN, ResourceType.SAMPLE, Action.DELETE))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.MANAGER, ResourceType.SAMPLE, Action.DELETE))
        .isFalse();
    assertThat(matrix.isRoleAllowed(PlatformRole.MANAGER, ResourceType.REPORT, Action.SHARE))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.SCIENTIST, ResourceType.BATCH, Action.EDIT))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.SCIENTIST, ResourceType.BATCH, Action.SHARE))
        .isFalse();
    assertThat(matrix.isRoleAllowed(PlatformRole.VIEWER, ResourceType.DOCUMENT, Action.VIEW))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.VIEWER, ResourceType.DOCUMENT, Action.DOWNLOAD))
        .isFalse();
    assertThat(matrix.isRoleAllowed(PlatformRole.SCIENTIST, ResourceType.DOCUMENT, Action.DOWNLOAD))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.VIEWER, ResourceType.DOCUMENT, Action.CREATE))
        .isFalse();
    assertThat(matrix.snapshot()).hasSize(4 * 7 * 6);
  }

  @Test
  void missingCellDenies() {
    matrix.load(
        Map.of(new PermissionKey(PlatformRole.ADMIN, ResourceType.SAMPLE, Action.VIEW), true));

    assertThat(matrix.isRoleAllowed(PlatformRole.ADMIN, ResourceType.SAMPLE, Action.VIEW))
        .isTrue();
    assertThat(matrix.isRoleAllowed(PlatformRole.ADMIN, ResourceType.SAMPLE, Action.EDIT))
        .isFalse();
  }

  @Test
  void reloadSkipsRowsWithUnknownValues() {
    var valid =
        new RolePermission(PlatformRole.VIEWER, ResourceType.REPORT, Action.VIEW, true, null);
    var unknownRole =
        new RolePermission(PlatformRole.VIEWER, ResourceType.REPORT, Action.EDIT, true, null);
    ReflectionTestUtils.setField(unknownRole, "role", "superuser");
    when(repository.findAll()).thenReturn(List.of(valid, unknownRole));

    matrix.reload();

    assertThat(matrix.snapshot())
        .containsOnlyKeys(new PermissionKey(PlatformRole.VIEWER, ResourceType.REPORT, Action.VIEW));
  }

  @Test
  void failedRefreshKeepsPreviousSnapshot() {
    matrix.load(DefaultRolePermissions.seed());
    when(repository.findAll()).thenThrow(new DataAccessResourceFailureException("db down"));

    matrix.refresh();

    assertThat(matrix.isRoleAllowed(PlatformRole.VIEWER, ResourceType.SAMPLE, Action.VIEW))
        .isTrue();
  }

  @Test
  void changeEventReloadsFromStore() {
    matrix.load(DefaultRolePermissions.seed());
    var key = new PermissionKey(PlatformRole.VIEWER, ResourceType.SAMPLE, Action.DOWNLOAD);
    when(repository.findAll())
        .thenReturn(
            List.of(
                new RolePermission(
                    PlatformRole.VIEWER, ResourceType.SAMPLE, Action.DOWNLOAD, true, null)));

    matrix.onPermissionsChanged(new RolePermissionsChangedEvent(key, true, null));

    assertThat(matrix.isRoleAllowed(PlatformRole.VIEWER, ResourceType.SAMPLE, Action.DOWNLOAD))
        .isTrue();
  }
}
