package com.wordsonphone.backend.customcategory.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ProviderTelemetry {

    public void ok(String provider, String modelId, String category, long latencyMs, int items) {
        log.info("provider_call status=OK provider={} modelId={} category={} latencyMs={} items={}",
                safe(provider), safe(modelId), safe(category), latencyMs, items);
    }

    public void fail(String provider, String modelId, String category, long latencyMs,
                     String errorCode, Integer retryAfterSec) {
        log.warn("provider_call status=FAIL provider={} modelId={} category={} latencyMs={} errorCode={} retryAfterSec={}",
                safe(provider), safe(modelId), safe(category), latencyMs,
                safe(errorCode), n(retryAfterSec));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }
}
