package com.architecture.diagram.irengine.repository;

import com.architecture.diagram.irengine.model.IrVersionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Backing store for diagram version chains.
 */
public interface IrVersionRepository {

    /**
     * @throws com.architecture.diagram.irengine.exception.VersionConflictException
     *         if the (diagram id, version) pair is already stored
     */
    IrVersionRecord save(IrVersionRecord record);

    Optional<IrVersionRecord> findLatest(String diagramId);

    Optional<IrVersionRecord> findByDiagramIdAndIrVersion(String diagramId, int irVersion);

    List<IrVersionRecord> findByDiagramIdOrderByIrVersionDesc(String diagramId);

    boolean existsByDiagramId(String diagramId);

    long countByDiagramId(String diagramId);

    void deleteByDiagramId(String diagramId);
}
