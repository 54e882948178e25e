package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.DiagramFormat;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;

/**
 * Translates a {@link StructuralIr} into the text a renderer consumes. Implementations are
 * stateless and deterministic: equal input gives byte-equal output.
 */
public interface DiagramCodec {

    DiagramFormat format();

    /**
     * Encoded diagram text including its trailing fingerprint.
     */
    String encode(StructuralIr ir);

    /**
     * The fingerprint {@link #encode} embeds for {@code ir}.
     */
    String fingerprint(StructuralIr ir);
}
