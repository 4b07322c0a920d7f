package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.Condition;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncTargetStatus {

    private String phase;

    private String description;

    private List<Condition> conditions = new ArrayList<>();

    private String lastSyncTime;

    private Integer syncedCount;

    private Long observedGeneration;

    private String lastRevision;

    private String lastChecksum;

    private List<FailedFile> failedFiles = new ArrayList<>();

    private boolean degraded;

    private Boolean sopsKeyAvailable;

    /**
     * Success, TransientFailure, PermanentFailure or NotRequired.
     */
    private String decryptionStatus;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailedFile {
        private String path;
        private String reason;
    }
}
