package com.wordsonphone.backend.customcategory.scoring.booster;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Reddit 搜尋前 5 筆的 upvote 加總當熱度。
 */
@Slf4j
public class RedditEngagementBooster implements QualityBooster {

    private static final int SEARCH_LIMIT = 5;

    private final RestClient http;

    public RedditEngagementBooster(RestClient http) {
        this.http = http;
    }

    @Override
    public BoosterKind kind() { return BoosterKind.ENGAGEMENT; }

    @Override
    @Cacheable(cacheNames = "redditEngagement", cacheManager = "boosterCacheManager",
            key = "#text.toLowerCase(T(java.util.Locale).ROOT)")
    public int points(String text) {
        if (text == null || text.isBlank()) return 0;

        String q = "\"" + text.trim() + "\"";
        JsonNode resp = http.get()
                .uri(b -> b.path("/search.json")
                        .queryParam("q", "{q}")
                        .queryParam("sort", "relevance")
                        .queryParam("limit", SEARCH_LIMIT)
                        .build(q))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);

        JsonNode children = (resp == null) ? null : resp.path("data").path("children");
        if (children == null || !children.isArray()) {
            throw new IllegalStateException("REDDIT_MALFORMED_RESPONSE");
        }

        long ups = 0;
        int seen = 0;
        for (JsonNode c : children) {
            if (seen++ >= SEARCH_LIMIT) break;
            ups += Math.max(0, c.path("data").path("ups").asLong(0));
        }

        int pts = tierFor(ups);
        log.debug("reddit_engagement text={} ups={} points={}", text, ups, pts);
        return pts;
    }

    static int tierFor(long ups) {
        int max = BoosterKind.ENGAGEMENT.maxPoints();
        if (ups >= 10_000) return max;
        if (ups >= 5_000) return (int) Math.round(max * 0.8);
        if (ups >= 1_000) return (int) Math.round(max * 0.6);
        if (ups >= 100) return (int) Math.round(max * 0.4);
        if (ups >= 10) return (int) Math.round(max * 0.2);
        return 0;
    }
}
