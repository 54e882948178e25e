package com.architecture.diagram.irengine.service.version;

import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.exception.DiagramNotFoundException;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.StructuralIntegrityException;
import com.architecture.diagram.irengine.exception.VersionConflictException;
import com.architecture.diagram.irengine.model.IrVersionRecord;
import com.architecture.diagram.irengine.repository.IrVersionRepository;
import com.architecture.diagram.irengine.service.enrich.AestheticResolver;
import com.architecture.diagram.irengine.service.enrich.ConnectivityInferencer;
import com.architecture.diagram.irengine.service.enrich.EnrichedIrMapper;
import com.architecture.diagram.irengine.service.enrich.EnrichedIrValidator;
import com.architecture.diagram.irengine.service.enrich.IrEnricher;
import com.architecture.diagram.irengine.service.enrich.NodeRoleClassifier;
import com.architecture.diagram.irengine.service.patch.FeedbackParser;
import com.architecture.diagram.irengine.service.patch.PatchEngine;
import com.architecture.diagram.irengine.service.schema.IrDiffer;
import com.architecture.diagram.irengine.service.schema.IrSchemaValidator;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.browserAuthPostgresPlan;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiagramVersionServiceTest {

    @Mock
    private IrVersionRepository versionRepository;

    @Mock
    private Validator validator;

    @Spy
    private IrVersionFactory versionFactory = new IrVersionFactory(new IrSchemaValidator());

    @Spy
    private IrEnricher enricher = new IrEnricher(
            new AestheticResolver(), new NodeRoleClassifier(), new ConnectivityInferencer(), new EnrichedIrValidator());

    @Spy
    private EnrichedIrMapper enrichedIrMapper = new EnrichedIrMapper();

    @Spy
    private FeedbackParser feedbackParser = new FeedbackParser();

    @Spy
    private PatchEngine patchEngine = new PatchEngine(new IrVersionFactory(new IrSchemaValidator()), new IrDiffer());

    @InjectMocks
    private DiagramVersionService service;

    private IrVersionRecord currentRecord(int irVersion) {
        IrVersion version = versionFactory.makeVersion("flow",
                document("flow", List.of(block("a", "Ingest"), block("b", "Store")), List.of(edge("a__b", "a", "b"))),
                irVersion == 1 ? null : irVersion - 1);
        return IrVersionRecord.of(version, IrVersionRecord.Reason.IMPORT);
    }

    private FeedbackRequest editText(String blockId, Integer baseVersion) {
        return FeedbackRequest.builder()
                .diagramId("flow")
                .action("edit_text")
                .blockId(blockId)
                .payload(Map.of("text", "Collect"))
                .baseVersion(baseVersion)
                .build();
    }

    @Test
    void createDiagram_storesEnrichedPlanAsVersionOne() {
        when(versionRepository.existsByDiagramId("login")).thenReturn(false);
        when(versionRepository.save(any(IrVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        service.createDiagram("login", browserAuthPostgresPlan());

        ArgumentCaptor<IrVersionRecord> captor = ArgumentCaptor.forClass(IrVersionRecord.class);
        verify(versionRepository).save(captor.capture());
        IrVersionRecord saved = captor.getValue();

        assertThat(saved.getIrVersion()).isEqualTo(1);
        assertThat(saved.getParentVersion()).isNull();
        assertThat(saved.getReason()).isEqualTo(IrVersionRecord.Reason.ENRICHMENT);
        assertThat(saved.getInferences()).hasSize(2);
        assertThat(saved.getVersion().diagram().getBlockIds()).containsExactly("browser", "auth", "postgresql");
    }

    @Test
    void createDiagram_refusesExistingDiagram() {
        when(versionRepository.existsByDiagramId("login")).thenReturn(true);

        assertThatThrownBy(() -> service.createDiagram("login", browserAuthPostgresPlan()))
                .isInstanceOf(VersionConflictException.class);
        verify(versionRepository, never()).save(any());
    }

    @Test
    void applyFeedback_mintsNextVersionWithPatchLogAndDiff() {
        when(versionRepository.findLatest("flow")).thenReturn(Optional.of(currentRecord(1)));
        when(versionRepository.save(any(IrVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        FeedbackRequest request = editText("a", 1);

        IrVersionRecord saved = service.applyFeedback(request);

        assertThat(saved.getIrVersion()).isEqualTo(2);
        assertThat(saved.getParentVersion()).isEqualTo(1);
        assertThat(saved.getReason()).isEqualTo(IrVersionRecord.Reason.FEEDBACK);
        assertThat(saved.getFeedback()).isSameAs(request);
        assertThat(saved.getPatchLog()).singleElement().satisfies(entry -> {
            assertThat(entry.getOp()).isEqualTo(FeedbackAction.EDIT_TEXT);
            assertThat(entry.getBefore()).isEqualTo("Ingest");
            assertThat(entry.getAfter()).isEqualTo("Collect");
        });
        assertThat(saved.getDiffSummary().getBlocksModified()).containsExactly("a");
        assertThat(saved.getVersion().diagram().findBlock("a").orElseThrow().getText()).isEqualTo("Collect");
    }

    @Test
    void applyFeedback_rejectsStaleBaseVersion() {
        when(versionRepository.findLatest("flow")).thenReturn(Optional.of(currentRecord(3)));

        assertThatThrownBy(() -> service.applyFeedback(editText("a", 2)))
                .isInstanceOf(VersionConflictException.class)
                .hasMessageContaining("expected 2");
        verify(versionRepository, never()).save(any());
    }

    @Test
    void applyFeedback_keepsChainUnchanged_whenPatchWouldOrphanEdges() {
        IrVersion dangling = versionFactory.makeVersion("flow",
                document("flow", List.of(block("a", "Ingest")), List.of(edge("a__gone", "a", "gone"))), null);
        when(versionRepository.findLatest("flow"))
                .thenReturn(Optional.of(IrVersionRecord.of(dangling, IrVersionRecord.Reason.IMPORT)));

        assertThatThrownBy(() -> service.applyFeedback(editText("a", null)))
                .isInstanceOf(StructuralIntegrityException.class);
        verify(versionRepository, never()).save(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void applyFeedback_reportsConstraintViolations_beforeTouchingStore() {
        ConstraintViolation<FeedbackRequest> violation = mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("action is required");
        FeedbackRequest request = FeedbackRequest.builder().diagramId("flow").build();
        when(validator.validate(request)).thenReturn(Set.of(violation));

        assertThatThrownBy(() -> service.applyFeedback(request))
                .isInstanceOf(PatchValidationException.class)
                .hasMessage("action is required");
        verifyNoInteractions(versionRepository);
    }

    @Test
    void importVersion_appendsToExistingChain() {
        when(versionRepository.findLatest("flow")).thenReturn(Optional.of(currentRecord(2)));
        when(versionRepository.save(any(IrVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        JsonNode payload = versionFactory.toTree(currentRecord(1).getVersion());

        IrVersionRecord saved = service.importVersion("flow", payload);

        assertThat(saved.getIrVersion()).isEqualTo(3);
        assertThat(saved.getParentVersion()).isEqualTo(2);
        assertThat(saved.getReason()).isEqualTo(IrVersionRecord.Reason.IMPORT);
    }

    @Test
    void importVersion_startsNewChainAtVersionOne() {
        when(versionRepository.findLatest("flow")).thenReturn(Optional.empty());
        when(versionRepository.save(any(IrVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        IrVersionRecord saved = service.importVersion("flow", versionFactory.toTree(currentRecord(4).getVersion()));

        assertThat(saved.getIrVersion()).isEqualTo(1);
        assertThat(saved.getParentVersion()).isNull();
    }

    @Test
    void listHistory_failsForUnknownDiagram() {
        when(versionRepository.findByDiagramIdOrderByIrVersionDesc("nope")).thenReturn(List.of());

        assertThatThrownBy(() -> service.listHistory("nope")).isInstanceOf(DiagramNotFoundException.class);
    }

    @Test
    void getVersion_failsForMissingVersion() {
        when(versionRepository.findByDiagramIdAndIrVersion("flow", 9)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getVersion("flow", 9))
                .isInstanceOf(DiagramNotFoundException.class)
                .hasMessage("Diagram flow has no version 9");
    }

    @Test
    void sharesBoundedLockStripes_acrossManyDiagrams() {
        Set<ReentrantLock> locks = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            locks.add(service.lockFor("diagram-" + i));
        }

        assertThat(locks).hasSizeLessThanOrEqualTo(DiagramVersionService.LOCK_STRIPES);
        assertThat(service.lockFor("flow")).isSameAs(service.lockFor("flow"));
        assertThat(service.lockFor("flow").isLocked()).isFalse();
    }
}
