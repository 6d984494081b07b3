package com.platform.paas.api;

import com.platform.paas.admission.AdmissionGate;
import com.platform.paas.admission.AdmissionResult;
import com.platform.paas.admission.ContainerResources;
import com.platform.paas.admission.Mutation;
import com.platform.paas.admission.MutationRequest;
import com.platform.paas.admission.Rejection;
import com.platform.paas.admission.RewrittenRequest;
import com.platform.paas.admission.WorkloadDescriptor;
import com.platform.paas.admission.WorkloadSubmissionService;
import com.platform.paas.catalog.ResourceKind;
import com.platform.paas.observability.MetricsRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdmissionController.class)
class AdmissionControllerTest {

    private static final String BODY = "{"
        + "\"tenantId\": \"acme\", "
        + "\"planId\": \"starter\", "
        + "\"workload\": {\"appId\": \"shop\", \"name\": \"web\", \"replicas\": 1, "
        + "\"containers\": [{\"name\": \"web\", \"image\": \"nginx\", \"requests\": {\"cpu\": \"50m\"}}], "
        + "\"volumes\": []}"
        + "}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdmissionGate admissionGate;

    @MockBean
    private WorkloadSubmissionService submissionService;

    @MockBean
    private MetricsRegistry metricsRegistry;

    @Test
    void shouldReturnRewrittenRequestWithMutations() throws Exception {
        when(admissionGate.admit(any(MutationRequest.class))).thenReturn(AdmissionResult.admitted(rewritten()));

        mockMvc.perform(post("/api/admission").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.tenantId").value("acme"))
            .andExpect(jsonPath("$.mutations[0].path").value("/containers/web/requests/cpu"))
            .andExpect(jsonPath("$.mutations[0].to").value("100m"));
    }

    @Test
    void shouldMapQuotaRejectionTo422() throws Exception {
        when(admissionGate.admit(any(MutationRequest.class))).thenReturn(AdmissionResult.rejected(
            Rejection.quotaExceeded("/containers/web/requests/cpu", "500m", "1000m")));

        mockMvc.perform(post("/api/admission").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("CP-601"))
            .andExpect(jsonPath("$.metadata.reason").value("QUOTA_EXCEEDED"))
            .andExpect(jsonPath("$.metadata.limit").value("500m"))
            .andExpect(jsonPath("$.metadata.requested").value("1000m"));
    }

    @Test
    void shouldMapUnknownPlanTo404() throws Exception {
        when(admissionGate.admit(any(MutationRequest.class)))
            .thenReturn(AdmissionResult.rejected(Rejection.unknownPlan("starter")));

        mockMvc.perform(post("/api/admission").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CP-301"))
            .andExpect(jsonPath("$.metadata.dimension").value("planId"));
    }

    @Test
    void shouldMapReservedNameTo400() throws Exception {
        when(admissionGate.admit(any(MutationRequest.class))).thenReturn(AdmissionResult.rejected(
            Rejection.nameReserved("/name", "kube-web", "Name 'kube-web' is reserved")));

        mockMvc.perform(post("/api/admission").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CP-602"))
            .andExpect(jsonPath("$.metadata.dimension").value("/name"));
    }

    @Test
    void shouldRejectRequestWithoutTenant() throws Exception {
        String body = BODY.replace("\"tenantId\": \"acme\",", "");

        mockMvc.perform(post("/api/admission").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CP-100"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("tenantId"));
        verify(admissionGate, never()).admit(any());
    }

    @Test
    void shouldSubmitWorkload() throws Exception {
        when(submissionService.submit(any(MutationRequest.class))).thenReturn(rewritten());

        mockMvc.perform(put("/api/workloads").contentType(MediaType.APPLICATION_JSON).content(BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.workload.name").value("web"));
    }

    @Test
    void shouldReturn404WhenRemovingUnknownWorkload() throws Exception {
        when(submissionService.remove("acme", "shop", "web")).thenReturn(false);

        mockMvc.perform(delete("/api/workloads/acme/shop/web"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CP-300"))
            .andExpect(jsonPath("$.message").value("Workload not found: acme/shop/web"))
            .andExpect(jsonPath("$.metadata.resourceType").value("Workload"))
            .andExpect(jsonPath("$.metadata.resourceId").value("acme/shop/web"));
    }

    @Test
    void shouldReturn204WhenRemovingWorkload() throws Exception {
        when(submissionService.remove("acme", "shop", "web")).thenReturn(true);

        mockMvc.perform(delete("/api/workloads/acme/shop/web"))
            .andExpect(status().isNoContent());
    }

    private static RewrittenRequest rewritten() {
        WorkloadDescriptor workload = new WorkloadDescriptor("shop", "web", 1,
            List.of(new ContainerResources("web", "nginx", Map.of(ResourceKind.CPU, "100m"), Map.of())),
            List.of());
        return new RewrittenRequest("acme", "starter", workload,
            List.of(new Mutation("/containers/web/requests/cpu", "50m", "100m")), "task-1",
            Instant.parse("2024-03-01T10:15:30Z"));
    }
}
