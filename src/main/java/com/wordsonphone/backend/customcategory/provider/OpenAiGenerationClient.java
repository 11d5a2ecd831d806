package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wordsonphone.backend.customcategory.model.Difficulty;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import com.wordsonphone.backend.customcategory.provider.config.OpenAiProperties;
import com.wordsonphone.backend.customcategory.provider.util.LenientJsonExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.*;

/**
 * 結構化 provider：chat completions + JSON mode。
 * 回 {"phrases":[{id, topic?, phrase, difficulty?}]}，或失敗時 {"error":"..."}。
 */
@Slf4j
public class OpenAiGenerationClient implements GenerationClient {

    public static final String CODE = "OPENAI";

    private static final int MAX_PHRASE_LEN = 100;

    static final String SYSTEM_PROMPT = """
            Provide a batch of new phrases in a JSON payload following the specified schema without any markdown fences, extra keys, or commentary.

            # JSON Schema
            Response object:
            - phrases: CustomTerm[] (1-100 items per call)

            CustomTerm:
            - id: string. Echo back the client-supplied id unchanged.
            - topic: string, optional. Echo verbatim if a topic was provided in the request.
            - phrase: string. 1-4 English words, Title Case where appropriate.
            - difficulty: "easy" | "medium" | "hard", optional. Your best guess.

            # Content Rules
            1. Match the request: if a topic is given, every phrase must clearly relate to it.
            2. Family-friendly: no profanity, slurs, trademarked titles or copyrighted lyrics.
            3. Describable: common idioms or nouns that can be clued without saying the words.
            4. Unique: no duplicates within the response.
            5. Length: 1-4 words, alphabetic characters only (apostrophes allowed).
            6. Language: U.S. English spelling.
            7. Quantity: return at least the requested number of terms.

            # Failure Handling
            If the constraints cannot be satisfied, respond only with { "error": "<short reason>" }.
            """;

    private final RestClient http;
    private final OpenAiProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public OpenAiGenerationClient(RestClient http, OpenAiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() { return CODE; }

    @Override
    public boolean structuredOutput() { return true; }

    @Override
    public List<GeneratedItem> generateBatch(GenerationRequest request) {
        long t0 = System.nanoTime();
        try {
            String content = callChatCompletion(buildUserMessage(request));
            List<GeneratedItem> items = parseItems(content, request.batchSize());
            telemetry.ok(CODE, props.getModel(), request.topic(), msSince(t0), items.size());
            return items;
        } catch (RuntimeException e) {
            throw fail(e, request.topic(), t0);
        }
    }

    @Override
    public List<String> sampleWords(String categoryName, int count) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) ids.add(UUID.randomUUID().toString());

        List<GeneratedItem> items = generateBatch(new GenerationRequest(categoryName, count, ids));
        List<String> out = new ArrayList<>(count);
        for (GeneratedItem it : items) {
            if (out.size() >= count) break;
            out.add(it.text());
        }
        return out;
    }

    // ===== http =====

    private String callChatCompletion(String userMessage) {
        ObjectNode req = om.createObjectNode();
        req.put("model", props.getModel());
        ArrayNode messages = req.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", userMessage);
        req.put("temperature", props.getTemperature());
        req.put("max_tokens", props.getMaxTokens());
        req.putObject("response_format").put("type", "json_object");

        JsonNode resp = http.post()
                .uri("/v1/chat/completions")
                .header("Authorization", "Bearer " + requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);

        String content = (resp == null) ? null
                : resp.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "empty completion content");
        }
        return content;
    }

    static String buildUserMessage(GenerationRequest request) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Generate exactly ").append(request.batchSize()).append(" phrases.");
        if (request.topic() != null && !request.topic().isBlank()) {
            sb.append(" Topic: \"").append(request.topic()).append("\". All phrases must clearly relate to this topic.");
        }
        sb.append("\n\nUse these exact IDs in order:\n");
        List<String> ids = request.itemIds();
        for (int i = 0; i < ids.size(); i++) {
            sb.append(i + 1).append(". ").append(ids.get(i)).append('\n');
        }
        return sb.toString();
    }

    // ===== parse =====

    List<GeneratedItem> parseItems(String content, int batchSize) {
        JsonNode root = LenientJsonExtractor.tryParse(om, content);
        if (root == null) {
            log.warn("openai_unparseable preview={}", LenientJsonExtractor.safeOneLine200(content));
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "unparseable completion");
        }

        if (root.isObject() && root.hasNonNull("error")) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_ERROR,
                    "provider refused: " + root.path("error").asText());
        }

        JsonNode arr = root.isArray() ? root : root.path("phrases");
        if (!arr.isArray()) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "missing phrases array");
        }

        List<GeneratedItem> out = new ArrayList<>();
        for (JsonNode n : arr) {
            if (out.size() >= batchSize) break;
            if (n == null || !n.isObject()) continue;

            String phrase = n.path("phrase").asText("").trim();
            if (phrase.isEmpty() || phrase.length() > MAX_PHRASE_LEN) continue;

            out.add(new GeneratedItem(
                    textOrNull(n, "id"),
                    textOrNull(n, "topic"),
                    phrase,
                    Difficulty.fromNullable(textOrNull(n, "difficulty"))
            ));
        }

        if (out.isEmpty()) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "no usable phrases");
        }
        return out;
    }

    private GenerationClientException fail(RuntimeException e, String category, long t0) {
        ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(e);
        telemetry.fail(CODE, props.getModel(), category, msSince(t0), m.code().name(), m.retryAfterSec());
        if (e instanceof GenerationClientException gce) return gce;
        return new GenerationClientException(m.code(), m.message(), m.retryAfterSec(), e);
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_AUTH_FAILED, "OPENAI_API_KEY_MISSING");
        }
        return k.trim();
    }

    private static String textOrNull(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
