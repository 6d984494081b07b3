package com.platform.paas.api;

import com.platform.paas.admission.AdmissionGate;
import com.platform.paas.admission.MutationRequest;
import com.platform.paas.admission.RewrittenRequest;
import com.platform.paas.admission.WorkloadSubmissionService;
import com.platform.paas.error.ResourceNotFoundException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the admission gate and desired workloads.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class AdmissionController {
    
    private final AdmissionGate admissionGate;
    private final WorkloadSubmissionService submissionService;
    
    public AdmissionController(AdmissionGate admissionGate, WorkloadSubmissionService submissionService) {
        this.admissionGate = admissionGate;
        this.submissionService = submissionService;
    }
    
    /**
     * Admit a mutation request: the rewritten request on success, an ErrorResponse otherwise.
     */
    @PostMapping("/admission")
    public ResponseEntity<RewrittenRequest> admit(@Valid @RequestBody MutationRequest request) {
        return ResponseEntity.ok(admissionGate.admit(request).orElseThrow());
    }
    
    /**
     * Admit a workload, store it as desired state and enqueue its sync.
     */
    @PutMapping("/workloads")
    public ResponseEntity<RewrittenRequest> submit(@Valid @RequestBody MutationRequest request) {
        return ResponseEntity.ok(submissionService.submit(request));
    }
    
    @DeleteMapping("/workloads/{tenantId}/{appId}/{name}")
    public ResponseEntity<Void> remove(
            @PathVariable String tenantId,
            @PathVariable String appId,
            @PathVariable String name) {
        if (!submissionService.remove(tenantId, appId, name)) {
            throw ResourceNotFoundException.workload(tenantId, appId, name);
        }
        log.info("Removed desired workload {}/{}/{}", tenantId, appId, name);
        return ResponseEntity.noContent().build();
    }
}
