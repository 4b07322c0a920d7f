package com.platform.secretsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Secret sync controller.
 * <p>
 * Watches SecretManagerConfig resources, reads SOPS-encrypted secret files from the Flux or
 * ArgoCD source they reference and keeps AWS, Azure or GCP secret stores in step with them.
 */
@SpringBootApplication
public class SecretSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecretSyncApplication.class, args);
    }
}
