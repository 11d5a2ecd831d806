package com.wordsonphone.backend.customcategory.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import com.wordsonphone.backend.customcategory.provider.config.GeminiProperties;
import com.wordsonphone.backend.customcategory.provider.util.LenientJsonExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * prompt-based provider：回自由文字，先找 JSON 字串陣列，找不到就逐行切。
 * provider 不會 echo id，所以 id 依位置對回 request.itemIds。
 */
@Slf4j
public class GeminiGenerationClient implements GenerationClient {

    public static final String CODE = "GEMINI";

    static final int MAX_PHRASE_LEN = 100;
    static final int MAX_SAMPLE_LEN = 50;

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public GeminiGenerationClient(RestClient http, GeminiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() { return CODE; }

    @Override
    public boolean structuredOutput() { return false; }

    @Override
    public List<GeneratedItem> generateBatch(GenerationRequest request) {
        long t0 = System.nanoTime();
        try {
            String text = callGenerateContent(batchPrompt(request.topic(), request.batchSize()));
            List<String> phrases = parsePhrases(text, request.batchSize());
            if (phrases.isEmpty()) {
                log.warn("gemini_no_phrases preview={}", LenientJsonExtractor.safeOneLine200(text));
                throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "no usable phrases");
            }

            List<GeneratedItem> items = new ArrayList<>(phrases.size());
            for (int i = 0; i < phrases.size(); i++) {
                items.add(new GeneratedItem(request.itemIds().get(i), request.topic(), phrases.get(i), null));
            }
            telemetry.ok(CODE, props.getModel(), request.topic(), msSince(t0), items.size());
            return items;
        } catch (RuntimeException e) {
            throw fail(e, request.topic(), t0);
        }
    }

    @Override
    public List<String> sampleWords(String categoryName, int count) {
        long t0 = System.nanoTime();
        try {
            String text = callGenerateContent(samplePrompt(categoryName, count));
            List<String> words = parseSampleLines(text, count);
            telemetry.ok(CODE, props.getModel(), categoryName, msSince(t0), words.size());
            return words;
        } catch (RuntimeException e) {
            throw fail(e, categoryName, t0);
        }
    }

    // ===== http =====

    private String callGenerateContent(String prompt) {
        ObjectNode req = om.createObjectNode();
        ArrayNode contents = req.putArray("contents");
        ObjectNode c0 = contents.addObject();
        c0.put("role", "user");
        c0.putArray("parts").addObject().put("text", prompt);

        ObjectNode gen = req.putObject("generationConfig");
        gen.put("maxOutputTokens", props.getMaxOutputTokens());
        gen.put("temperature", props.getTemperature());

        JsonNode resp = http.post()
                .uri("/v1beta/models/{model}:generateContent", props.getModel())
                .header("x-goog-api-key", requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);

        String text = extractJoinedTextOrNull(resp);
        if (text == null) {
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_MALFORMED_RESPONSE, "empty candidates");
        }
        return text;
    }

    static String extractJoinedTextOrNull(JsonNode resp) {
        if (resp == null || resp.isNull()) return null;
        JsonNode parts = resp.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return null;

        StringBuilder sb = new StringBuilder(256);
        for (JsonNode p : parts) {
            String t = p.path("text").asText(null);
            if (t != null) sb.append(t);
        }
        String joined = sb.toString().trim();
        return joined.isEmpty() ? null : joined;
    }

    // ===== parse =====

    /** JSON 字串陣列優先；不是陣列就逐行（去掉編號、項目符號、引號） */
    List<String> parsePhrases(String text, int batchSize) {
        List<String> out = new ArrayList<>(batchSize);

        JsonNode arr = LenientJsonExtractor.tryParseStringArray(om, text);
        if (arr != null) {
            for (JsonNode n : arr) {
                if (out.size() >= batchSize) break;
                // 只收字串；數字、null、巢狀的都不算 phrase
                if (n == null || !n.isTextual()) continue;
                String p = n.asText().trim();
                if (!p.isEmpty() && p.length() <= MAX_PHRASE_LEN) out.add(p);
            }
            if (!out.isEmpty()) return out;
        }

        for (String line : text.split("\\r?\\n")) {
            if (out.size() >= batchSize) break;
            String p = cleanLine(line);
            if (p.isEmpty() || p.length() > MAX_PHRASE_LEN) continue;
            if (p.startsWith("[") || p.startsWith("]") || p.startsWith("```")) continue;
            out.add(p);
        }
        return out;
    }

    static List<String> parseSampleLines(String text, int count) {
        List<String> out = new ArrayList<>(count);
        if (text == null) return out;
        for (String line : text.split("\\r?\\n")) {
            if (out.size() >= count) break;
            String w = cleanLine(line);
            if (!w.isEmpty() && w.length() <= MAX_SAMPLE_LEN) out.add(w);
        }
        return out;
    }

    static String cleanLine(String line) {
        if (line == null) return "";
        String s = line.trim();
        s = s.replaceFirst("^(\\d+[.)]|[-*•])\\s*", "");
        if (s.endsWith(",")) s = s.substring(0, s.length() - 1).trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    // ===== prompts =====

    static String batchPrompt(String categoryName, int count) {
        return """
                You are PhraseMachine, an expert generator of party game phrases for "Words on Phone", \
                a charades-style game where players act out, draw, or describe phrases for their team to guess.

                GAME CONTEXT:
                - Players have 60 seconds to get their team to guess as many phrases as possible
                - Phrases must be ACTABLE, DRAWABLE, or DESCRIBABLE without saying the words
                - Players range from teens to adults at parties and game nights

                TASK:
                Generate exactly %d HIGH-QUALITY phrases for category "%s".

                GOOD EXAMPLES: "Pizza Delivery", "Taylor Swift", "Brushing Teeth", "Harry Potter"
                AVOID: "Quantum Physics", "Municipal Governance", "Existential Dread"

                RULES:
                1. 2-4 words maximum
                2. Instantly recognizable to most people
                3. No profanity, politics, or adult themes
                4. Avoid technical or academic terms
                5. Prefer pop culture, common activities, famous people and places

                Every phrase must clearly belong to "%s".

                OUTPUT FORMAT:
                Return ONLY a valid JSON array of strings:
                ["First phrase", "Second phrase"]

                Generate exactly %d phrases now:""".formatted(count, categoryName, categoryName, count);
    }

    static String samplePrompt(String categoryName, int count) {
        return """
                You are PhraseMachine, a generator of sample words for party game categories.

                TASK:
                Generate exactly %d example words or short phrases for the category "%s". \
                These are preview samples to show users what this category contains.

                RULES:
                - Each should be 1-3 words maximum
                - Family-friendly only
                - Representative examples that clearly belong to "%s"
                - Return only the items, one per line, no numbering or formatting

                Begin.""".formatted(count, categoryName, categoryName);
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
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_AUTH_FAILED, "GEMINI_API_KEY_MISSING");
        }
        return k.trim();
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
