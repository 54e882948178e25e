package com.architecture.diagram.irengine.service.version;

import com.architecture.diagram.irengine.dto.enrich.EnrichedIr;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.dto.patch.PatchResult;
import com.architecture.diagram.irengine.dto.plan.ArchitecturePlan;
import com.architecture.diagram.irengine.exception.DiagramNotFoundException;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.VersionConflictException;
import com.architecture.diagram.irengine.model.IrVersionRecord;
import com.architecture.diagram.irengine.repository.IrVersionRepository;
import com.architecture.diagram.irengine.service.enrich.EnrichedIrMapper;
import com.architecture.diagram.irengine.service.enrich.IrEnricher;
import com.architecture.diagram.irengine.service.patch.FeedbackParser;
import com.architecture.diagram.irengine.service.patch.PatchEngine;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the version chain of each diagram.
 *
 * Flow for feedback:
 * 1. Validate the request
 * 2. Lock the diagram so only one patch is applied at a time
 * 3. Check the optional base version against the current one
 * 4. Apply the patch to a copy of the current IR
 * 5. Mint and store version n+1 with its patch log and diff
 *
 * A rejected patch leaves the chain untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramVersionService {

    private final IrVersionRepository versionRepository;
    private final IrVersionFactory versionFactory;
    private final IrEnricher enricher;
    private final EnrichedIrMapper enrichedIrMapper;
    private final FeedbackParser feedbackParser;
    private final PatchEngine patchEngine;
    private final Validator validator;

    static final int LOCK_STRIPES = 64;

    // Diagrams sharing a stripe serialize against each other; the lock set stays fixed in size
    private final ReentrantLock[] diagramLocks = newStripes();

    /**
     * Enrich a plan and store it as version 1 of a new diagram.
     */
    public IrVersionRecord createDiagram(String diagramId, ArchitecturePlan plan) {
        return withLock(diagramId, () -> {
            if (versionRepository.existsByDiagramId(diagramId)) {
                throw new VersionConflictException(diagramId, 1);
            }
            EnrichedIr enriched = enricher.enrich(plan);
            IrDocument ir = enrichedIrMapper.toIrDocument(enriched, diagramId);
            IrVersion version = versionFactory.makeVersion(diagramId, ir, null);

            IrVersionRecord record = IrVersionRecord.of(version, IrVersionRecord.Reason.ENRICHMENT);
            record.setInferences(new ArrayList<>(enriched.getInferences()));
            versionRepository.save(record);
            log.info("Created diagram {} from plan '{}' ({} blocks, {} edges, {} inferred)",
                    diagramId, plan.getSystemName(), ir.getDiagram().getBlocks().size(),
                    ir.getDiagram().getEdges().size(), enriched.getInferences().size());
            return record;
        });
    }

    /**
     * Store an externally produced payload. A bare legacy diagram becomes version 1 of a new
     * chain; for an existing chain the payload is appended as the next version.
     */
    public IrVersionRecord importVersion(String diagramId, JsonNode payload) {
        return withLock(diagramId, () -> {
            IrVersion upgraded = versionFactory.upgrade(payload, diagramId);
            IrVersion version = versionRepository.findLatest(diagramId)
                    .map(latest -> versionFactory.makeVersion(diagramId, upgraded.getIr(), latest.getIrVersion()))
                    .orElseGet(() -> versionFactory.makeVersion(diagramId, upgraded.getIr(), null));

            IrVersionRecord record = IrVersionRecord.of(version, IrVersionRecord.Reason.IMPORT);
            versionRepository.save(record);
            log.info("Imported version {} of diagram {}", version.getIrVersion(), diagramId);
            return record;
        });
    }

    /**
     * Apply one feedback edit to the current version.
     *
     * @throws PatchValidationException if the request itself is invalid
     * @throws DiagramNotFoundException if the diagram has no versions
     * @throws VersionConflictException if {@code base_version} is not the current version
     */
    public IrVersionRecord applyFeedback(FeedbackRequest request) {
        Set<ConstraintViolation<FeedbackRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new PatchValidationException(message);
        }

        String diagramId = request.getDiagramId();
        return withLock(diagramId, () -> {
            IrVersionRecord current = getCurrent(diagramId);
            if (request.getBaseVersion() != null && request.getBaseVersion() != current.getIrVersion()) {
                throw new VersionConflictException(diagramId, request.getBaseVersion(), current.getIrVersion());
            }

            PatchResult result = patchEngine.apply(feedbackParser.parse(request), current.getVersion().getIr());
            IrVersion next = versionFactory.makeVersion(diagramId, result.getIr(), current.getIrVersion());

            IrVersionRecord record = IrVersionRecord.of(next, IrVersionRecord.Reason.FEEDBACK);
            record.setPatchLog(new ArrayList<>(result.getPatchLog()));
            record.setDiffSummary(result.getDiffSummary());
            record.setFeedback(request);
            versionRepository.save(record);
            log.info("Diagram {} advanced to version {} via {}", diagramId, next.getIrVersion(), request.getAction());
            return record;
        });
    }

    /**
     * Version history, newest first.
     */
    public List<IrVersionRecord> listHistory(String diagramId) {
        List<IrVersionRecord> history = new ArrayList<>(versionRepository.findByDiagramIdOrderByIrVersionDesc(diagramId));
        if (history.isEmpty()) {
            throw new DiagramNotFoundException(diagramId);
        }
        history.sort(Comparator.comparingInt(IrVersionRecord::getIrVersion).reversed());
        return history;
    }

    public IrVersionRecord getCurrent(String diagramId) {
        return versionRepository.findLatest(diagramId)
                .orElseThrow(() -> new DiagramNotFoundException(diagramId));
    }

    public IrVersionRecord getVersion(String diagramId, int irVersion) {
        return versionRepository.findByDiagramIdAndIrVersion(diagramId, irVersion)
                .orElseThrow(() -> new DiagramNotFoundException(diagramId, irVersion));
    }

    private <T> T withLock(String diagramId, Supplier<T> action) {
        ReentrantLock lock = lockFor(diagramId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String diagramId) {
        return diagramLocks[Math.floorMod(diagramId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
