package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import com.wordsonphone.backend.customcategory.provider.config.GeminiProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.List;
import java.util.stream.IntStream;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

class GeminiGenerationClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String PATH = "/v1beta/models/gemini-test:generateContent";

    private final ObjectMapper om = new ObjectMapper();

    private GeminiGenerationClient client() {
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        RestClient http = RestClient.builder()
                .baseUrl(wm.getRuntimeInfo().getHttpBaseUrl())
                .requestFactory(new JdkClientHttpRequestFactory(jdk))
                .build();

        GeminiProperties props = new GeminiProperties();
        props.setApiKey("TEST_API_KEY");
        props.setModel("gemini-test");
        return new GeminiGenerationClient(http, props, om, new ProviderTelemetry());
    }

    private String candidate(String text) {
        ObjectNode root = om.createObjectNode();
        root.putArray("candidates").addObject()
                .putObject("content")
                .putArray("parts").addObject().put("text", text);
        return root.toString();
    }

    private static List<String> ids(int n) {
        return IntStream.range(0, n).mapToObj(i -> "id" + i).toList();
    }

    @Test
    void json_array_is_mapped_to_request_ids_by_position() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .withHeader("x-goog-api-key", equalTo("TEST_API_KEY"))
                .withRequestBody(matchingJsonPath("$.contents[0].parts[0].text", containing("\"Pets\"")))
                .willReturn(okJson(candidate("```json\n[\"Dog Walk\", \"Cat Nap\"]\n```"))));

        List<GeneratedItem> items = client().generateBatch(new GenerationRequest("Pets", 3, List.of("p1", "p2", "p3")));

        assertEquals(2, items.size());
        assertEquals(new GeneratedItem("p1", "Pets", "Dog Walk", null), items.get(0));
        assertEquals("p2", items.get(1).id());
    }

    @Test
    void falls_back_to_lines_when_no_array() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(okJson(candidate("1. Pizza Delivery\n2) Taco Night\n- \"Brunch\",\n* Picnic\n"))));

        List<GeneratedItem> items = client().generateBatch(
                new GenerationRequest("Food & Drink", 3, List.of("a", "b", "c")));

        assertEquals(List.of("Pizza Delivery", "Taco Night", "Brunch"),
                items.stream().map(GeneratedItem::text).toList());
    }

    @Test
    void bracketed_count_in_prose_does_not_hide_the_phrase_array() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(okJson(candidate("Here are [2] phrases:\n[\"Pizza Night\", \"Taco Tuesday\"]"))));

        List<GeneratedItem> items = client().generateBatch(
                new GenerationRequest("Food & Drink", 15, ids(15)));

        assertEquals(List.of("Pizza Night", "Taco Tuesday"),
                items.stream().map(GeneratedItem::text).toList());
        assertEquals("id0", items.get(0).id());
    }

    @Test
    void non_string_array_elements_are_not_phrases() {
        assertEquals(List.of("Kite", "Drone"),
                client().parsePhrases("[\"Kite\", 7, null, [\"x\"], \"Drone\"]", 15));
    }

    @Test
    void empty_candidates_is_malformed() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(okJson("{\"candidates\":[]}")));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("Pets", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, ex.code());
    }

    @Test
    void upstream_500_is_provider_error() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(aResponse().withStatus(500)));

        GenerationClientException ex = assertThrows(GenerationClientException.class,
                () -> client().generateBatch(new GenerationRequest("Pets", 1, List.of("a"))));

        assertEquals(ProviderErrorCode.PROVIDER_ERROR, ex.code());
        assertEquals("upstream 500", ex.getMessage());
    }

    @Test
    void sample_words_drop_long_lines() {
        wm.stubFor(post(urlPathEqualTo(PATH))
                .willReturn(okJson(candidate("Spatula\n" + "y".repeat(51) + "\nWhisk\n\nLadle\nTongs"))));

        assertEquals(List.of("Spatula", "Whisk", "Ladle"), client().sampleWords("Kitchen Items", 3));
    }

    @Test
    void clean_line_strips_list_markers_and_quotes() {
        assertEquals("Pizza Delivery", GeminiGenerationClient.cleanLine("  12. Pizza Delivery "));
        assertEquals("Taco Night", GeminiGenerationClient.cleanLine("- \"Taco Night\","));
        assertEquals("Brunch", GeminiGenerationClient.cleanLine("• Brunch"));
        assertEquals("", GeminiGenerationClient.cleanLine(null));
    }

    @Test
    void prompt_is_not_structured() {
        assertFalse(client().structuredOutput());
        assertTrue(GeminiGenerationClient.batchPrompt("Pets", 15).contains("Generate exactly 15 HIGH-QUALITY phrases for category \"Pets\""));
    }
}
