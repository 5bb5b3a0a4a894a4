package io.mylab.lab.labplatform.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.mylab.lab.labplatform.TestcontainersConfiguration;
import io.mylab.lab.labplatform.grant.AccessGrantService;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.Principal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end access decisions against a real database: the project role matrix, grants across
 * organizations, revocation, per-user overrides and input validation.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class AccessControlIntegrationTest {

  // Organization B owns the lab data, organization A is a partner lab
  private static final UUID ORG_B = UUID.randomUUID();
  private static final UUID WORKSPACE_B = UUID.randomUUID();
  private static final UUID ORG_A = UUID.randomUUID();
  private static final UUID WORKSPACE_A = UUID.randomUUID();

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID SAMPLE_ID = UUID.randomUUID();

  private static final UUID MANAGER_ID = UUID.randomUUID();
  private static final UUID VIEWER_ID = UUID.randomUUID();
  private static final UUID SCIENTIST_ID = UUID.randomUUID();
  private static final UUID PARTNER_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private ObjectAccessService objectAccessService;
  @Autowired private AccessGrantService grantService;

  private String grantId;

  @BeforeAll
  void seed() {
    jdbcTemplate.update(
        "INSERT INTO projects (id, workspace_id, name) VALUES (?, ?, ?)",
        PROJECT_ID,
        WORKSPACE_B,
        "Soil survey");
    jdbcTemplate.update(
        "INSERT INTO samples (id, workspace_id, project_id, name) VALUES (?, ?, ?, ?)",
        SAMPLE_ID,
        WORKSPACE_B,
        PROJECT_ID,
        "S-001");
    assign(MANAGER_ID, PlatformRole.MANAGER);
    assign(VIEWER_ID, PlatformRole.VIEWER);
    assign(SCIENTIST_ID, PlatformRole.SCIENTIST);
  }

  @Test
  @Order(1)
  void viewerAssignmentCannotEditSample() throws Exception {
    // Organization-wide admin, but only viewer on this project
    mockMvc
        .perform(
            post("/api/access/check")
                .with(user(VIEWER_ID, ORG_B, WORKSPACE_B, PlatformRole.ADMIN))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "resourceType": "sample", "action": "edit"}
                    """
                        .formatted(PROJECT_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allowed").value(false))
        .andExpect(jsonPath("$.reason").value("Role 'viewer' cannot edit sample"));
  }

  @Test
  @Order(2)
  void unassignedUserIsDeniedRegardlessOfGlobalRole() throws Exception {
    mockMvc
        .perform(
            post("/api/access/check")
                .with(user(UUID.randomUUID(), ORG_B, WORKSPACE_B, PlatformRole.ADMIN))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "resourceType": "sample", "action": "view"}
                    """
                        .formatted(PROJECT_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allowed").value(false))
        .andExpect(jsonPath("$.reason").value("User is not assigned to this project"));
  }

  @Test
  @Order(3)
  void partnerWithoutGrantIsForbidden() throws Exception {
    mockMvc
        .perform(get("/api/objects/sample/{id}/access", SAMPLE_ID).with(partner()))
        .andExpect(status().isForbidden())
        .andExpect(
            jsonPath("$.detail").value("Access denied: no ownership or access grant found"));
  }

  @Test
  @Order(4)
  void processorGrantAllowsPartnerAndAttachesGrant() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/access-grants")
                    .with(user(MANAGER_ID, ORG_B, WORKSPACE_B, PlatformRole.MANAGER))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"objectType": "sample", "objectId": "%s", "grantedToOrgId": "%s",
                         "role": "processor"}
                        """
                            .formatted(SAMPLE_ID, ORG_A)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("active"))
            .andReturn();
    grantId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(get("/api/objects/sample/{id}/access", SAMPLE_ID).with(partner()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.owner").value(false))
        .andExpect(jsonPath("$.grantId").value(grantId))
        .andExpect(jsonPath("$.grantedRole").value("processor"));

    var decision =
        objectAccessService.checkAccess(
            partnerPrincipal(), ResourceType.SAMPLE, SAMPLE_ID, GrantRole.PROCESSOR);
    assertThat(decision.allowed()).isTrue();
    assertThat(decision.grant().grantId()).isEqualTo(UUID.fromString(grantId));
  }

  @Test
  @Order(5)
  void partnerCannotReshareWithoutReshareFlag() throws Exception {
    mockMvc
        .perform(
            post("/api/objects/sample/{id}/share", SAMPLE_ID)
                .with(partner())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"grantedToOrgId": "%s", "role": "viewer"}
                    """
                        .formatted(UUID.randomUUID())))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.detail").value("Access denied: re-sharing not permitted"));
  }

  @Test
  @Order(6)
  void revokedGrantNoLongerAllowsAccess() throws Exception {
    mockMvc
        .perform(
            post("/api/access-grants/{id}/revoke", grantId)
                .with(user(MANAGER_ID, ORG_B, WORKSPACE_B, PlatformRole.MANAGER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"reason": "contract ended"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("revoked"))
        .andExpect(jsonPath("$.revocationReason").value("contract ended"));

    mockMvc
        .perform(get("/api/objects/sample/{id}/access", SAMPLE_ID).with(partner()))
        .andExpect(status().isForbidden());

    var decision =
        objectAccessService.checkAccess(
            partnerPrincipal(), ResourceType.SAMPLE, SAMPLE_ID, GrantRole.PROCESSOR);
    assertThat(decision.allowed()).isFalse();
  }

  @Test
  @Order(7)
  void secondRevocationKeepsOriginalReason() throws Exception {
    mockMvc
        .perform(
            post("/api/access-grants/{id}/revoke", grantId)
                .with(user(MANAGER_ID, ORG_B, WORKSPACE_B, PlatformRole.MANAGER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"reason": "again"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.revocationReason").value("contract ended"));
  }

  @Test
  @Order(8)
  void downloadOverrideLimitsScientistOnSample() throws Exception {
    mockMvc
        .perform(
            put("/api/projects/{projectId}/sample/{sampleId}/access", PROJECT_ID, SAMPLE_ID)
                .with(user(MANAGER_ID, ORG_B, WORKSPACE_B, PlatformRole.MANAGER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "accessLevel": "download"}
                    """
                        .formatted(SCIENTIST_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.overrideId").isNotEmpty());

    checkAsScientist("edit")
        .andExpect(jsonPath("$.allowed").value(false))
        .andExpect(
            jsonPath("$.reason")
                .value("User's explicit access level (download) does not allow edit"));
    checkAsScientist("download")
        .andExpect(jsonPath("$.allowed").value(true))
        .andExpect(jsonPath("$.accessLevel").value("download"));
  }

  @Test
  @Order(9)
  void viewerCannotManageOverrides() throws Exception {
    mockMvc
        .perform(
            put("/api/projects/{projectId}/sample/{sampleId}/access", PROJECT_ID, SAMPLE_ID)
                .with(user(VIEWER_ID, ORG_B, WORKSPACE_B, PlatformRole.VIEWER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "accessLevel": "edit"}
                    """
                        .formatted(VIEWER_ID)))
        .andExpect(status().isForbidden());
  }

  @Test
  @Order(10)
  void unknownTypeIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/objects/Widget/{id}/access", SAMPLE_ID).with(partner()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Invalid object type"));

    mockMvc
        .perform(
            post("/api/access/check")
                .with(user(VIEWER_ID, ORG_B, WORKSPACE_B, PlatformRole.VIEWER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "resourceType": "Widget", "action": "view"}
                    """
                        .formatted(PROJECT_ID)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @Order(11)
  void tokenWithoutWorkspaceClaimIsRejected() throws Exception {
    mockMvc
        .perform(
            get("/api/objects/sample/{id}/access", SAMPLE_ID)
                .with(
                    jwt()
                        .jwt(
                            j ->
                                j.subject(UUID.randomUUID().toString())
                                    .claim("o", Map.of("id", ORG_A.toString(), "rol", "viewer")))))
        .andExpect(status().isForbidden());
  }

  @Test
  @Order(12)
  void unauthenticatedRequestIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/objects/sample/{id}/access", SAMPLE_ID))
        .andExpect(status().isUnauthorized());
  }

  @Test
  @Order(13)
  void revokedGrantWithFutureExpiryAndExpiredGrantAreBothInactive() throws Exception {
    var revokedOrg = UUID.randomUUID();
    var expiredOrg = UUID.randomUUID();
    var now = Instant.now();
    jdbcTemplate.update(
        "INSERT INTO access_grants (object_type, object_id, granted_to_org_id, granted_role,"
            + " expires_at, created_by, created_by_org_id, revoked_at, revocation_reason)"
            + " VALUES ('sample', ?, ?, 'client', ?, ?, ?, ?, 'partnership ended')",
        SAMPLE_ID,
        revokedOrg,
        Timestamp.from(now.plus(30, ChronoUnit.DAYS)),
        MANAGER_ID,
        ORG_B,
        Timestamp.from(now.minus(1, ChronoUnit.HOURS)));
    jdbcTemplate.update(
        "INSERT INTO access_grants (object_type, object_id, granted_to_org_id, granted_role,"
            + " expires_at, created_by, created_by_org_id)"
            + " VALUES ('sample', ?, ?, 'client', ?, ?, ?)",
        SAMPLE_ID,
        expiredOrg,
        Timestamp.from(now.minus(1, ChronoUnit.DAYS)),
        MANAGER_ID,
        ORG_B);

    assertThat(grantService.lookupActive(ResourceType.SAMPLE, SAMPLE_ID, revokedOrg)).isEmpty();
    assertThat(grantService.lookupActive(ResourceType.SAMPLE, SAMPLE_ID, expiredOrg)).isEmpty();

    for (UUID orgId : new UUID[] {revokedOrg, expiredOrg}) {
      mockMvc
          .perform(
              get("/api/objects/sample/{id}/access", SAMPLE_ID)
                  .with(user(UUID.randomUUID(), orgId, UUID.randomUUID(), PlatformRole.ADMIN)))
          .andExpect(status().isForbidden())
          .andExpect(
              jsonPath("$.detail").value("Access denied: no ownership or access grant found"));
    }
  }

  @Test
  @Order(14)
  void managerCannotOverrideSampleOfAnotherProject() throws Exception {
    var otherProjectId = UUID.randomUUID();
    var otherSampleId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO projects (id, workspace_id, name) VALUES (?, ?, ?)",
        otherProjectId,
        WORKSPACE_B,
        "Water survey");
    jdbcTemplate.update(
        "INSERT INTO samples (id, workspace_id, project_id, name) VALUES (?, ?, ?, ?)",
        otherSampleId,
        WORKSPACE_B,
        otherProjectId,
        "W-001");

    mockMvc
        .perform(
            put("/api/projects/{projectId}/sample/{sampleId}/access", PROJECT_ID, otherSampleId)
                .with(user(MANAGER_ID, ORG_B, WORKSPACE_B, PlatformRole.MANAGER))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"userId": "%s", "accessLevel": "edit"}
                    """
                        .formatted(SCIENTIST_ID)))
        .andExpect(status().isNotFound());

    Integer overrides =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM resource_access_overrides WHERE resource_id = ?",
            Integer.class,
            otherSampleId);
    assertThat(overrides).isZero();
  }

  private ResultActions checkAsScientist(String action) throws Exception {
    return mockMvc
        .perform(
            post("/api/access/check")
                .with(user(SCIENTIST_ID, ORG_B, WORKSPACE_B, PlatformRole.SCIENTIST))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "resourceType": "sample", "action": "%s",
                     "resourceId": "%s"}
                    """
                        .formatted(PROJECT_ID, action, SAMPLE_ID)))
        .andExpect(status().isOk());
  }

  private void assign(UUID userId, PlatformRole role) {
    jdbcTemplate.update(
        "INSERT INTO project_team_assignments (project_id, user_id, assigned_role)"
            + " VALUES (?, ?, ?)",
        PROJECT_ID,
        userId,
        role.value());
  }

  private static Principal partnerPrincipal() {
    return new Principal(PARTNER_ID, WORKSPACE_A, ORG_A, PlatformRole.SCIENTIST);
  }

  private JwtRequestPostProcessor partner() {
    return user(PARTNER_ID, ORG_A, WORKSPACE_A, PlatformRole.SCIENTIST);
  }

  private JwtRequestPostProcessor user(
      UUID userId, UUID orgId, UUID workspaceId, PlatformRole role) {
    return jwt()
        .jwt(
            j ->
                j.subject(userId.toString())
                    .claim(
                        "o",
                        Map.of(
                            "id", orgId.toString(),
                            "ws", workspaceId.toString(),
                            "rol", role.value())))
        .authorities(new SimpleGrantedAuthority("ROLE_" + role.value().toUpperCase(Locale.ROOT)));
  }
}
