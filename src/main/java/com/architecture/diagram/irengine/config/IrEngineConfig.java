package com.architecture.diagram.irengine.config;

import com.architecture.diagram.irengine.dto.invariance.InvariancePolicy;
import com.architecture.diagram.irengine.dto.invariance.InvarianceSettings;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.service.codec.ContentFingerprint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine settings read from application.yml under {@code ir-engine}.
 */
@Configuration
@Slf4j
public class IrEngineConfig {

    @Value("${ir-engine.invariance.policy:LOG_AND_CONTINUE}")
    private InvariancePolicy invariancePolicy;

    @Value("${ir-engine.invariance.strict:true}")
    private boolean invarianceStrict;

    @Value("${ir-engine.analyzer.geometric-endpoint-fallback:false}")
    private boolean geometricEndpointFallback;

    @Value("${ir-engine.codec.fingerprint-length:16}")
    private int fingerprintLength;

    /**
     * Policy applied by the cosmetic transform pipeline when a transform breaks invariance.
     */
    @Bean
    public InvarianceSettings invarianceSettings() {
        log.info("[IR Engine Config] Invariance policy: {} (strict={})", invariancePolicy, invarianceStrict);
        return InvarianceSettings.builder()
                .policy(invariancePolicy)
                .strict(invarianceStrict)
                .build();
    }

    @Bean
    public AnalysisOptions analysisOptions() {
        if (geometricEndpointFallback) {
            log.info("[IR Engine Config] Geometric endpoint fallback enabled for SVG analysis");
        }
        return AnalysisOptions.builder()
                .geometricEndpointFallback(geometricEndpointFallback)
                .build();
    }

    @Bean
    public ContentFingerprint contentFingerprint() {
        return new ContentFingerprint(fingerprintLength);
    }
}
