package com.architecture.diagram.irengine.repository;

import com.architecture.diagram.irengine.exception.VersionConflictException;
import com.architecture.diagram.irengine.model.IrVersionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

@Repository
@Slf4j
public class InMemoryIrVersionRepository implements IrVersionRepository {

    private final Map<String, NavigableMap<Integer, IrVersionRecord>> chains = new ConcurrentHashMap<>();

    @Override
    public IrVersionRecord save(IrVersionRecord record) {
        NavigableMap<Integer, IrVersionRecord> chain =
                chains.computeIfAbsent(record.getDiagramId(), id -> new ConcurrentSkipListMap<>());
        if (chain.putIfAbsent(record.getIrVersion(), record) != null) {
            throw new VersionConflictException(record.getDiagramId(), record.getIrVersion());
        }
        log.debug("Stored version {} of diagram {}", record.getIrVersion(), record.getDiagramId());
        return record;
    }

    @Override
    public Optional<IrVersionRecord> findLatest(String diagramId) {
        NavigableMap<Integer, IrVersionRecord> chain = chains.get(diagramId);
        if (chain == null || chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chain.lastEntry().getValue());
    }

    @Override
    public Optional<IrVersionRecord> findByDiagramIdAndIrVersion(String diagramId, int irVersion) {
        NavigableMap<Integer, IrVersionRecord> chain = chains.get(diagramId);
        return chain == null ? Optional.empty() : Optional.ofNullable(chain.get(irVersion));
    }

    @Override
    public List<IrVersionRecord> findByDiagramIdOrderByIrVersionDesc(String diagramId) {
        NavigableMap<Integer, IrVersionRecord> chain = chains.get(diagramId);
        return chain == null ? List.of() : new ArrayList<>(chain.descendingMap().values());
    }

    @Override
    public boolean existsByDiagramId(String diagramId) {
        return countByDiagramId(diagramId) > 0;
    }

    @Override
    public long countByDiagramId(String diagramId) {
        NavigableMap<Integer, IrVersionRecord> chain = chains.get(diagramId);
        return chain == null ? 0 : chain.size();
    }

    @Override
    public void deleteByDiagramId(String diagramId) {
        chains.remove(diagramId);
    }
}
