package com.platform.paas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PaaS Controller Application
 * 
 * Control-plane core for a multi-tenant PaaS:
 * - Limit catalog (resource floors and ceilings per plan)
 * - Admission gate (rewrite below floor, reject above ceiling)
 * - Three-band reconciliation queue with retry and dead tasks
 * - Auto-scaling worker pools per band
 * - Hourly and daily scheduled reconciliation
 */
@SpringBootApplication
@EnableScheduling
public class PaasControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaasControllerApplication.class, args);
    }
}
