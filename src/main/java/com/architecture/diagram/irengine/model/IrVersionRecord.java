package com.architecture.diagram.irengine.model;

import com.architecture.diagram.irengine.dto.enrich.InferenceRecord;
import com.architecture.diagram.irengine.dto.ir.DiffSummary;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored entry in a diagram's version chain. The IR document itself is immutable; the
 * audit metadata (patch log, diff, originating feedback, inference records) lives beside it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IrVersionRecord {

    private String diagramId;
    private int irVersion;
    private Integer parentVersion;

    private IrVersion version;

    private String reason;              // ENRICHMENT, FEEDBACK, IMPORT

    @Builder.Default
    private List<PatchLogEntry> patchLog = new ArrayList<>();

    private DiffSummary diffSummary;

    private FeedbackRequest feedback;   // null unless reason is FEEDBACK

    @Builder.Default
    private List<InferenceRecord> inferences = new ArrayList<>();

    private LocalDateTime createdAt;

    public static IrVersionRecord of(IrVersion version, String reason) {
        return IrVersionRecord.builder()
                .diagramId(version.getDiagramId())
                .irVersion(version.getIrVersion())
                .parentVersion(version.getParentVersion())
                .version(version)
                .reason(reason)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static class Reason {
        public static final String ENRICHMENT = "ENRICHMENT";
        public static final String FEEDBACK = "FEEDBACK";
        public static final String IMPORT = "IMPORT";
    }
}
