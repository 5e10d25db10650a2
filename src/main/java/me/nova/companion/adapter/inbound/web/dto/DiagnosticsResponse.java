package me.nova.companion.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.nova.companion.domain.model.DecisionRecord;

/**
 * Policy metadata exposed by {@code GET /api/diagnostics}. Carries no message
 * content and no secrets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticsResponse {

    private boolean ok;
    private String now;
    private long uptimeSec;
    private Policy policy;
    private DecisionLog decisionLog;
    private DecisionRecord lastDecision;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        private boolean noHiddenBackgroundCognition;
        private Mode reflection;
        private Mode memory;
        private Mode artifacts;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mode {
        private String mode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DecisionLog {
        private int count;
        private String path;
    }
}
