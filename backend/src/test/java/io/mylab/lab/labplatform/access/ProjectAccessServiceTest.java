package io.mylab.lab.labplatform.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.audit.SecurityEventRecord;
import io.mylab.lab.labplatform.audit.SecurityEventType;
import io.mylab.lab.labplatform.audit.SecuritySeverity;
import io.mylab.lab.labplatform.config.AccessControlProperties;
import io.mylab.lab.labplatform.exception.AccessCheckFailedException;
import io.mylab.lab.labplatform.override.AccessLevel;
import io.mylab.lab.labplatform.override.ResourceAccessOverride;
import io.mylab.lab.labplatform.override.ResourceAccessService;
import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.permission.DefaultRolePermissions;
import io.mylab.lab.labplatform.permission.RolePermissionMatrix;
import io.mylab.lab.labplatform.permission.RolePermissionRepository;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.team.ProjectTeamService;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class ProjectAccessServiceTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID REPORT_ID = UUID.randomUUID();

  @Mock private ProjectTeamService teamService;
  @Mock private ResourceAccessService resourceAccessService;
  @Mock private RolePermissionRepository rolePermissionRepository;
  @Mock private PlatformTransactionManager transactionManager;
  @Mock private AuditService auditService;

  private ProjectAccessService service;

  @BeforeEach
  void setUp() {
    lenient()
        .when(transactionManager.getTransaction(any()))
        .thenReturn(new SimpleTransactionStatus());
    var matrix = new RolePermissionMatrix(rolePermissionRepository);
    matrix.load(DefaultRolePermissions.seed());
    var chain =
        new AccessPolicyChain(
            "project-access",
            List.of(
                new RoleMatrixStrategy(teamService, matrix),
                new OverrideStrategy(resourceAccessService)));
    service =
        new ProjectAccessService(
            chain,
            new AccessDecisionRecorder(auditService),
            transactionManager,
            AccessControlProperties.defaults());
  }

  @Test
  void unassignedUserIsDenied() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID)).thenReturn(Optional.empty());

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.VIEW, null);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("User is not assigned to this project");
  }

  @Test
  void projectRoleReplacesOrganizationRole() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.SCIENTIST));

    var create =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.CREATE, null);
    var delete =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.DELETE, null);

    assertThat(create.allowed()).isTrue();
    assertThat(create.reason()).isEqualTo("Role 'scientist' allows create on sample");
    assertThat(delete.allowed()).isFalse();
    assertThat(delete.reason()).isEqualTo("Role 'scientist' cannot delete sample");
  }

  @Test
  void viewerCannotEditEvenWithoutOverride() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.VIEWER));

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.REPORT, Action.EDIT, REPORT_ID);

    assertThat(decision.allowed()).isFalse();
    verify(resourceAccessService, never()).findOverride(any(), any(), any());
  }

  @Test
  void downloadOverrideNarrowsScientistOnReport() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.SCIENTIST));
    when(resourceAccessService.findOverride(ResourceType.REPORT, REPORT_ID, USER_ID))
        .thenReturn(Optional.of(override(AccessLevel.DOWNLOAD)));

    var edit =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.REPORT, Action.EDIT, REPORT_ID);
    var download =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.REPORT, Action.DOWNLOAD, REPORT_ID);

    assertThat(edit.allowed()).isFalse();
    assertThat(edit.reason())
        .isEqualTo("User's explicit access level (download) does not allow edit");
    assertThat(download.allowed()).isTrue();
    assertThat(download.accessLevel()).isEqualTo(AccessLevel.DOWNLOAD);
    assertThat(download.reason()).isEqualTo("User has explicit download access");
  }

  @Test
  void overrideIsIgnoredForShare() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.MANAGER));

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.REPORT, Action.SHARE, REPORT_ID);

    assertThat(decision.allowed()).isTrue();
    verify(resourceAccessService, never()).findOverride(any(), any(), any());
  }

  @Test
  void overrideIsNotConsultedForTypesWithoutOverrides() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.SCIENTIST));

    var decision =
        service.checkAccess(
            USER_ID, PROJECT_ID, ResourceType.DOCUMENT, Action.EDIT, UUID.randomUUID());

    assertThat(decision.allowed()).isTrue();
    verify(resourceAccessService, never()).findOverride(any(), any(), any());
  }

  @Test
  void denialIsRecordedAsSecurityEvent() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.VIEWER));

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.EDIT, null);

    assertThat(decision.allowed()).isFalse();
    var captor = ArgumentCaptor.forClass(SecurityEventRecord.class);
    verify(auditService).logSecurityEvent(captor.capture());
    var event = captor.getValue();
    assertThat(event.eventType()).isEqualTo(SecurityEventType.ACCESS_DENIED);
    assertThat(event.severity()).isEqualTo(SecuritySeverity.MEDIUM);
    assertThat(event.resourceType()).isEqualTo("sample");
    assertThat(event.reason()).isEqualTo("Role 'viewer' cannot edit sample");
    assertThat(event.details())
        .containsEntry("policy", "project")
        .containsEntry("subjectId", USER_ID.toString())
        .containsEntry("projectId", PROJECT_ID.toString())
        .containsEntry("action", "edit");
  }

  @Test
  void allowIsNotWrittenToSecurityLog() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenReturn(Optional.of(PlatformRole.SCIENTIST));

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.VIEW, null);

    assertThat(decision.allowed()).isTrue();
    verifyNoInteractions(auditService);
  }

  @Test
  void failingSecurityLogDoesNotChangeDecision() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID)).thenReturn(Optional.empty());
    doThrow(new IllegalStateException("queue closed")).when(auditService).logSecurityEvent(any());

    var decision =
        service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.VIEW, null);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("User is not assigned to this project");
  }

  @Test
  void lookupFailureSurfacesAsAccessCheckFailure() {
    when(teamService.roleInProject(USER_ID, PROJECT_ID))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(
            () -> service.checkAccess(USER_ID, PROJECT_ID, ResourceType.SAMPLE, Action.VIEW, null))
        .isInstanceOf(AccessCheckFailedException.class);
    verifyNoInteractions(auditService);
  }

  private static ResourceAccessOverride override(AccessLevel level) {
    return new ResourceAccessOverride(
        ResourceType.REPORT, REPORT_ID, USER_ID, UUID.randomUUID(), level, false, null);
  }
}
