package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.DiffSummary;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import com.architecture.diagram.irengine.dto.patch.PatchResult;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.StructuralIntegrityException;
import com.architecture.diagram.irengine.service.schema.IrDiffer;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies patches to a copy of an IR document. Either every patch applies and the result passes
 * the structural-integrity guard, or an exception is thrown and nothing changes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchEngine {

    private final IrVersionFactory versionFactory;
    private final IrDiffer differ;

    public PatchResult apply(BlockPatch patch, IrDocument current) {
        return apply(List.of(patch), current);
    }

    /**
     * Apply patches in order as one unit.
     *
     * @throws StructuralIntegrityException if any edge would reference a missing block
     */
    public PatchResult apply(List<BlockPatch> patches, IrDocument current) {
        if (current == null || current.getDiagram() == null) {
            throw new PatchValidationException("IR missing diagram");
        }
        IrDocument working = versionFactory.copy(current);
        Diagram diagram = working.getDiagram();

        List<PatchLogEntry> patchLog = new ArrayList<>();
        for (BlockPatch patch : patches) {
            PatchLogEntry entry = patch.apply(diagram);
            log.debug("Applied {} to block {}", entry.getOp().getValue(), entry.getBlockId());
            patchLog.add(entry);
        }

        List<String> orphaned = findOrphanedEdges(diagram);
        if (!orphaned.isEmpty()) {
            log.warn("Rejecting patch on diagram {}: {} orphaned edges {}",
                    diagram.getId(), orphaned.size(), orphaned);
            throw new StructuralIntegrityException(orphaned);
        }

        DiffSummary diffSummary = differ.diff(current.getDiagram(), diagram);
        log.info("Patched diagram {}: {}", diagram.getId(), diffSummary.getDescription());
        return PatchResult.builder()
                .ir(working)
                .patchLog(patchLog)
                .diffSummary(diffSummary)
                .build();
    }

    /**
     * Ids of edges whose {@code from} or {@code to} is not a block id.
     */
    public List<String> findOrphanedEdges(Diagram diagram) {
        Set<String> blockIds = new HashSet<>(diagram.getBlockIds());
        return diagram.getEdges().stream()
                .filter(e -> !blockIds.contains(e.getFrom()) || !blockIds.contains(e.getTo()))
                .map(IrEdge::getEdgeId)
                .collect(Collectors.toList());
    }
}
