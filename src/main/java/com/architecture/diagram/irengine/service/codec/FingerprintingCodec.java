package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.StructuralIr;

/**
 * Base for codecs whose output ends with a content fingerprint computed over the body.
 * Input is normalized before the body is written.
 */
public abstract class FingerprintingCodec implements DiagramCodec {

    private final ContentFingerprint contentFingerprint;

    protected FingerprintingCodec(ContentFingerprint contentFingerprint) {
        this.contentFingerprint = contentFingerprint;
    }

    @Override
    public final String encode(StructuralIr ir) {
        String body = body(ir.normalized());
        return attach(body, contentFingerprint.of(body));
    }

    @Override
    public final String fingerprint(StructuralIr ir) {
        return contentFingerprint.of(body(ir.normalized()));
    }

    protected abstract String body(StructuralIr ir);

    protected abstract String attach(String body, String fingerprint);

    static String labelOrId(String label, String id) {
        return label == null || label.isBlank() ? id : label;
    }

    static String orUnknown(String endpoint) {
        return endpoint == null ? "?" : endpoint;
    }
}
