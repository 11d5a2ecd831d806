package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 把 RestClient / 網路 / 解析錯誤收斂成 {@link ProviderErrorCode}。
 * - 401/403 -> AUTH_FAILED
 * - 429 -> RATE_LIMITED（有 Retry-After 就帶秒數）
 * - 任何 timeout（含 cause chain）-> TIMEOUT
 * - JSON 解析失敗 -> MALFORMED_RESPONSE
 * - 其他 -> PROVIDER_ERROR
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public record Mapped(ProviderErrorCode code, String message, Integer retryAfterSec) {}

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped(ProviderErrorCode.PROVIDER_ERROR, null, null);

        // 自己丟的已經分類好了
        if (e instanceof GenerationClientException gce) {
            return new Mapped(gce.code(), safeMsg(gce), gce.retryAfterSec());
        }

        if (isTimeoutThrowable(e)) {
            return new Mapped(ProviderErrorCode.PROVIDER_TIMEOUT, safeMsg(e), null);
        }

        if (e instanceof RestClientResponseException re) {
            HttpStatusCode sc = re.getStatusCode();
            int status = sc.value();

            Integer retryAfter = null;
            HttpHeaders headers = re.getResponseHeaders();
            if (headers != null) {
                retryAfter = parseRetryAfterSecondsOrNull(headers.getFirst(HttpHeaders.RETRY_AFTER));
            }

            if (status == 401 || status == 403) {
                return new Mapped(ProviderErrorCode.PROVIDER_AUTH_FAILED, "auth failed", null);
            }
            if (status == 429) {
                return new Mapped(ProviderErrorCode.PROVIDER_RATE_LIMITED, "rate limited", retryAfter);
            }
            if (status == 408 || status == 504) {
                return new Mapped(ProviderErrorCode.PROVIDER_TIMEOUT, "timeout", retryAfter);
            }
            if (sc.is5xxServerError()) {
                return new Mapped(ProviderErrorCode.PROVIDER_ERROR, "upstream " + status, retryAfter);
            }
            return new Mapped(ProviderErrorCode.PROVIDER_ERROR, "http " + status, null);
        }

        if (hasCause(e, JsonProcessingException.class)) {
            return new Mapped(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, safeMsg(e), null);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped(ProviderErrorCode.PROVIDER_ERROR, "network: " + safeMsg(rae), null);
        }

        if (e instanceof RestClientException rce) {
            return new Mapped(ProviderErrorCode.PROVIDER_ERROR, safeMsg(rce), null);
        }

        return new Mapped(ProviderErrorCode.PROVIDER_ERROR, safeMsg(e), null);
    }

    private static Integer parseRetryAfterSecondsOrNull(String ra) {
        if (ra == null || ra.isBlank()) return null;
        try {
            int v = Integer.parseInt(ra.trim());
            return Math.max(0, Math.min(v, 3600));
        } catch (NumberFormatException ignored) {
            // HTTP-date 格式先不處理
            return null;
        }
    }

    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timed out") || s.contains("read timeout") || s.contains("connect timeout")) return true;
            }
        }
        return false;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
        }
        return false;
    }

    static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
