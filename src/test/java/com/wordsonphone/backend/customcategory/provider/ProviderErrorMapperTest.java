package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorMapperTest {

    @Test
    void rate_limit_carries_retry_after_capped_to_an_hour() {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.RETRY_AFTER, "12");
        var e = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", h, new byte[0], StandardCharsets.UTF_8);

        ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(e);
        assertEquals(ProviderErrorCode.PROVIDER_RATE_LIMITED, m.code());
        assertEquals(12, m.retryAfterSec());

        HttpHeaders big = new HttpHeaders();
        big.set(HttpHeaders.RETRY_AFTER, "999999");
        var e2 = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "x", big, new byte[0], StandardCharsets.UTF_8);
        assertEquals(3600, ProviderErrorMapper.map(e2).retryAfterSec());
    }

    @Test
    void http_date_retry_after_is_ignored() {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.RETRY_AFTER, "Wed, 21 Oct 2026 07:28:00 GMT");
        var e = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "x", h, new byte[0], StandardCharsets.UTF_8);

        assertNull(ProviderErrorMapper.map(e).retryAfterSec());
    }

    @Test
    void auth_failures() {
        var e401 = HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "x", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
        var e403 = HttpClientErrorException.create(HttpStatus.FORBIDDEN, "x", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        assertEquals(ProviderErrorCode.PROVIDER_AUTH_FAILED, ProviderErrorMapper.map(e401).code());
        assertEquals(ProviderErrorCode.PROVIDER_AUTH_FAILED, ProviderErrorMapper.map(e403).code());
    }

    @Test
    void server_errors_and_gateway_timeouts() {
        var e500 = HttpServerErrorException.create(HttpStatus.INTERNAL_SERVER_ERROR, "x", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
        var e504 = HttpServerErrorException.create(HttpStatus.GATEWAY_TIMEOUT, "x", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(e500);
        assertEquals(ProviderErrorCode.PROVIDER_ERROR, m.code());
        assertEquals("upstream 500", m.message());
        assertEquals(ProviderErrorCode.PROVIDER_TIMEOUT, ProviderErrorMapper.map(e504).code());
    }

    @Test
    void socket_timeout_in_cause_chain_is_timeout() {
        var e = new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"));

        assertEquals(ProviderErrorCode.PROVIDER_TIMEOUT, ProviderErrorMapper.map(e).code());
    }

    @Test
    void json_failure_is_malformed() {
        var e = new RestClientException("Error while extracting response",
                new JsonParseException((JsonParser) null, "Unexpected character"));

        assertEquals(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, ProviderErrorMapper.map(e).code());
    }

    @Test
    void already_classified_exception_passes_through() {
        var e = new GenerationClientException(ProviderErrorCode.PROVIDER_RATE_LIMITED, "slow down", 7, null);

        ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(e);
        assertEquals(ProviderErrorCode.PROVIDER_RATE_LIMITED, m.code());
        assertEquals("slow down", m.message());
        assertEquals(7, m.retryAfterSec());
    }

    @Test
    void anything_else_is_provider_error() {
        ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(new IllegalArgumentException());
        assertEquals(ProviderErrorCode.PROVIDER_ERROR, m.code());
        assertEquals("IllegalArgumentException", m.message());
    }
}
