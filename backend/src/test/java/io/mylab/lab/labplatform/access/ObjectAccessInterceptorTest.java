package io.mylab.lab.labplatform.access;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.exception.GlobalExceptionHandler;
import io.mylab.lab.labplatform.grant.GrantContext;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.Principal;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

class ObjectAccessInterceptorTest {

  private static final UUID SAMPLE_ID = UUID.randomUUID();

  private final Principal principal =
      new Principal(
          UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), PlatformRole.SCIENTIST);

  private ObjectAccessService objectAccessService;
  private AuditService auditService;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    objectAccessService = mock(ObjectAccessService.class);
    auditService = mock(AuditService.class);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new GuardedController())
            .addInterceptors(new ObjectAccessInterceptor(objectAccessService))
            .setControllerAdvice(new GlobalExceptionHandler(auditService))
            .build();
    RequestScopes.bindPrincipal(principal);
  }

  @AfterEach
  void tearDown() {
    RequestScopes.clear();
  }

  @Test
  void unknownObjectTypeIsRejectedBeforeAnyLookup() throws Exception {
    mockMvc
        .perform(get("/api/objects/widget/{id}", SAMPLE_ID))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Invalid object type"));

    verifyNoInteractions(objectAccessService);
  }

  @Test
  void reportsAreNotGrantCapable() throws Exception {
    mockMvc
        .perform(get("/api/objects/report/{id}", SAMPLE_ID))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(objectAccessService);
  }

  @Test
  void missingObjectIdIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/samples"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Object ID required"));

    verifyNoInteractions(objectAccessService);
  }

  @Test
  void malformedObjectIdIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/objects/sample/not-a-uuid"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(objectAccessService);
  }

  @Test
  void objectIdIsReadFromQueryParameter() throws Exception {
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(new AccessDecision(true, "owner", null, null));

    mockMvc
        .perform(get("/api/samples").param("id", SAMPLE_ID.toString()))
        .andExpect(status().isOk());
  }

  @Test
  void typeNamesAreNormalized() throws Exception {
    when(objectAccessService.checkAccess(any(), eq(ResourceType.DERIVED_SAMPLE), any(), isNull()))
        .thenReturn(new AccessDecision(true, "owner", null, null));

    mockMvc
        .perform(get("/api/objects/DerivedSample/{id}", SAMPLE_ID))
        .andExpect(status().isOk());
  }

  @Test
  void deniedAccessReturnsForbiddenWithoutSecondSecurityEvent() throws Exception {
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(AccessDecision.deny("no ownership or access grant found"));

    mockMvc
        .perform(get("/api/objects/sample/{id}", SAMPLE_ID))
        .andExpect(status().isForbidden())
        .andExpect(
            jsonPath("$.detail").value("Access denied: no ownership or access grant found"));

    // The access engine already wrote the access_denied event for this decision
    verify(auditService, never()).logSecurityEvent(any());
  }

  @Test
  void grantContextIsExposedToHandler() throws Exception {
    var grantId = UUID.randomUUID();
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(
            new AccessDecision(
                true, "grant", null, new GrantContext(grantId, GrantRole.PROCESSOR, false)));

    mockMvc
        .perform(get("/api/objects/sample/{id}", SAMPLE_ID))
        .andExpect(status().isOk())
        .andExpect(content().string(grantId.toString()));
  }

  @Test
  void reshareWithNonReshareGrantIsForbidden() throws Exception {
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(
            new AccessDecision(
                true,
                "grant",
                null,
                new GrantContext(UUID.randomUUID(), GrantRole.PROCESSOR, false)));

    mockMvc
        .perform(post("/api/objects/sample/{id}/share", SAMPLE_ID))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.detail").value("Access denied: re-sharing not permitted"));

    verify(auditService).logSecurityEvent(any());
  }

  @Test
  void reshareWithReshareGrantIsAllowed() throws Exception {
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(
            new AccessDecision(
                true, "grant", null, new GrantContext(UUID.randomUUID(), GrantRole.CLIENT, true)));

    mockMvc.perform(post("/api/objects/sample/{id}/share", SAMPLE_ID)).andExpect(status().isOk());
  }

  @Test
  void ownerMayReshare() throws Exception {
    when(objectAccessService.checkAccess(principal, ResourceType.SAMPLE, SAMPLE_ID, null))
        .thenReturn(new AccessDecision(true, "owner", null, null));

    mockMvc.perform(post("/api/objects/sample/{id}/share", SAMPLE_ID)).andExpect(status().isOk());
  }

  @Test
  void reshareCheckWithoutPriorAccessCheckIsForbidden() throws Exception {
    mockMvc.perform(post("/api/unchecked/share")).andExpect(status().isForbidden());

    verifyNoInteractions(objectAccessService);
  }

  @RestController
  public static class GuardedController {

    @GetMapping("/api/objects/{objectType}/{id}")
    @RequireObjectAccess
    public String view(
        @PathVariable String objectType, @PathVariable String id, HttpServletRequest request) {
      GrantContext grant = ObjectAccessInterceptor.currentGrant(request);
      return grant != null ? grant.grantId().toString() : "owner";
    }

    @GetMapping("/api/samples")
    @RequireObjectAccess("sample")
    public String bySampleParam() {
      return "ok";
    }

    @PostMapping("/api/objects/{objectType}/{id}/share")
    @RequireObjectAccess
    @RequireResharePermission
    public String share(@PathVariable String objectType, @PathVariable String id) {
      return "shared";
    }

    @PostMapping("/api/unchecked/share")
    @RequireResharePermission
    public String uncheckedShare() {
      return "shared";
    }
  }
}
