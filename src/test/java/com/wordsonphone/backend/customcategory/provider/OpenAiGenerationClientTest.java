package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.wordsonphone.backend.customcategory.model.Difficulty;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import com.wordsonphone.backend.customcategory.provider.config.OpenAiProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

class OpenAiGenerationClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private final ObjectMapper om = new ObjectMapper();

    private OpenAiGenerationClient client(String apiKey, Duration readTimeout) {
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        JdkClientHttpRequestFactory f = new JdkClientHttpRequestFactory(jdk);
        f.setReadTimeout(readTimeout);

        RestClient http = RestClient.builder()
                .baseUrl(wm.getRuntimeInfo().getHttpBaseUrl())
                .requestFactory(f)
                .build();

        OpenAiProperties props = new OpenAiProperties();
        props.setApiKey(apiKey);
        props.setModel("gpt-test");
        return new OpenAiGenerationClient(http, props, om, new ProviderTelemetry());
    }

    private OpenAiGenerationClient client() {
        return client("TEST_KEY", Duration.ofSeconds(5));
    }

    /** chat completions 外殼；content 本身是 JSON 字串 */
    private String completion(String content) {
        ObjectNode root = om.createObjectNode();
        ObjectNode msg = root.putArray("choices").addObject().putObject("message");
        msg.put("role", "assistant");
        msg.put("content", content);
        return root.toString();
    }

    @Test
    void echoes_ids_and_maps_difficulty() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer TEST_KEY"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-test")))
                .withRequestBody(matchingJsonPath("$.response_format.type", equalTo("json_object")))
                .willReturn(okJson(completion("""
                        {"phrases":[
                          {"id":"a1","topic":"Kitchen Items","phrase":"Coffee Maker","difficulty":"easy"},
                          {"id":"a2","phrase":"Rolling Pin","difficulty":"Weird"}
                        ]}
                        """))));

        List<GeneratedItem> items = client().generateBatch(
                new GenerationRequest("Kitchen Items", 2, List.of("a1", "a2")));

        assertEquals(2, items.size());
        assertEquals(new GeneratedItem("a1", "Kitchen Items", "Coffee Maker", Difficulty.EASY), items.get(0));
        assertEquals("a2", items.get(1).id());
        assertNull(items.get(1).difficulty());

        wm.verify(1, postRequestedFor(urlPathEqualTo("/v1/chat/completions"))
                .withRequestBody(matchingJsonPath("$.messages[1].content", containing("a1"))));
    }

    @Test
    void refusal_object_is_provider_error() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(okJson(completion("{\"error\":\"topic not family friendly\"}"))));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_ERROR, ex.code());
        assertTrue(ex.getMessage().contains("topic not family friendly"));
    }

    @Test
    void rate_limit_surfaces_retry_after() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "12")));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_RATE_LIMITED, ex.code());
        assertEquals(12, ex.retryAfterSec());
    }

    @Test
    void unauthorized_is_auth_failed() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(401)));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_AUTH_FAILED, ex.code());
    }

    @Test
    void slow_upstream_is_timeout() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(okJson(completion("{\"phrases\":[]}")).withFixedDelay(1500)));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client("TEST_KEY", Duration.ofMillis(200))
                        .generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_TIMEOUT, ex.code());
    }

    @Test
    void missing_key_fails_without_calling_out() {
        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client(" ", Duration.ofSeconds(5)).generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_AUTH_FAILED, ex.code());
        assertEquals("OPENAI_API_KEY_MISSING", ex.getMessage());
        wm.verify(0, postRequestedFor(urlPathEqualTo("/v1/chat/completions")));
    }

    @Test
    void empty_content_is_malformed() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(okJson("{\"choices\":[]}")));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("X", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, ex.code());
    }

    @Test
    void parse_skips_blank_and_overlong_phrases_and_caps_to_batch() {
        String content = """
                {"phrases":[
                  {"id":"1","phrase":"  "},
                  {"id":"2","phrase":"%s"},
                  {"id":"3","phrase":"Kite"},
                  "not an object",
                  {"id":"4","phrase":"Drone"},
                  {"id":"5","phrase":"Yo-yo"}
                ]}
                """.formatted("x".repeat(101));

        List<GeneratedItem> items = client().parseItems(content, 2);

        assertEquals(List.of("Kite", "Drone"), items.stream().map(GeneratedItem::text).toList());
    }

    @Test
    void parse_with_nothing_usable_is_malformed() {
        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().parseItems("{\"phrases\":[{\"id\":\"1\",\"phrase\":\"\"}]}", 5));

        assertEquals(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, ex.code());
        assertEquals("no usable phrases", ex.getMessage());
    }

    @Test
    void sample_words_reuse_batch_call() {
        wm.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(okJson(completion("""
                        {"phrases":[{"id":"x","phrase":"Spatula"},{"id":"y","phrase":"Whisk"},{"id":"z","phrase":"Ladle"}]}
                        """))));

        assertEquals(List.of("Spatula", "Whisk", "Ladle"), client().sampleWords("Kitchen Items", 3));
    }

    @Test
    void user_message_lists_ids_in_order() {
        String msg = OpenAiGenerationClient.buildUserMessage(new GenerationRequest("Pets", 2, List.of("id-a", "id-b")));

        assertTrue(msg.startsWith("Generate exactly 2 phrases. Topic: \"Pets\"."));
        assertTrue(msg.contains("1. id-a\n2. id-b\n"));
    }
}
