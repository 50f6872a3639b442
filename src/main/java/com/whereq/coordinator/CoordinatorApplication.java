package com.whereq.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the WhereQ workflow coordinator.
 * This service decides quality and resources for ML workflows, submits them to
 * Argo Workflows and scales the workloads that serve them.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class CoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorApplication.class, args);
    }
}
