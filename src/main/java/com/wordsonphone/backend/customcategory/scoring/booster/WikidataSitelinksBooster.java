package com.wordsonphone.backend.customcategory.scoring.booster;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * 用 Wikidata SPARQL 查「英文 label 完全等於 text」的 item，依 sitelinks（有幾種語言的維基條目）分段給分。
 * - 找不到 item：0
 * - 有 item 但 0 個 sitelink：5
 * - 1 / 5 / 10 / 20 / 50 以上：10 / 15 / 20 / 25 / 30
 */
@Slf4j
public class WikidataSitelinksBooster implements QualityBooster {

    private static final String QUERY_TEMPLATE = """
            SELECT ?item ?sitelinks WHERE {
              ?item rdfs:label "%s"@en .
              ?item wikibase:sitelinks ?sitelinks .
            }
            LIMIT 1
            """;

    private final RestClient http;

    public WikidataSitelinksBooster(RestClient http) {
        this.http = http;
    }

    @Override
    public BoosterKind kind() { return BoosterKind.ENCYCLOPEDIA; }

    @Override
    @Cacheable(cacheNames = "wikidataSitelinks", cacheManager = "boosterCacheManager",
            key = "#text.toLowerCase(T(java.util.Locale).ROOT)")
    public int points(String text) {
        if (text == null || text.isBlank()) return 0;

        String query = QUERY_TEMPLATE.formatted(escapeLiteral(text.trim()));
        JsonNode resp = http.get()
                .uri(b -> b.path("/sparql")
                        .queryParam("query", "{q}")
                        .queryParam("format", "json")
                        .build(query))
                .accept(MediaType.valueOf("application/sparql-results+json"), MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);

        if (resp == null || !resp.has("results")) {
            throw new IllegalStateException("WIKIDATA_MALFORMED_RESPONSE");
        }

        JsonNode bindings = resp.path("results").path("bindings");
        if (!bindings.isArray() || bindings.isEmpty()) return 0;

        String raw = bindings.path(0).path("sitelinks").path("value").asText("0");
        int sitelinks;
        try {
            sitelinks = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("WIKIDATA_MALFORMED_SITELINKS: " + raw, e);
        }

        int pts = tierFor(sitelinks);
        log.debug("wikidata_sitelinks text={} sitelinks={} points={}", text, sitelinks, pts);
        return pts;
    }

    static int tierFor(int sitelinks) {
        if (sitelinks >= 50) return 30;
        if (sitelinks >= 20) return 25;
        if (sitelinks >= 10) return 20;
        if (sitelinks >= 5) return 15;
        if (sitelinks >= 1) return 10;
        return 5;
    }

    private static String escapeLiteral(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
