package com.wordsonphone.backend.customcategory.scoring.booster;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.booster")
public class BoosterProperties {

    private final Endpoint wikidata = new Endpoint("https://query.wikidata.org");
    private final Endpoint reddit = new Endpoint("https://www.reddit.com");

    /** 兩個 booster 共用的 cache 設定 */
    private Duration cacheTtl = Duration.ofHours(6);
    private long cacheMaxSize = 10_000;

    public Endpoint getWikidata() { return wikidata; }
    public Endpoint getReddit() { return reddit; }

    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

    public long getCacheMaxSize() { return cacheMaxSize; }
    public void setCacheMaxSize(long cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }

    public static class Endpoint {

        /** 預設關閉：外部查詢慢，只有明確要 boosters 的評分才會用 */
        private boolean enabled = false;
        private String baseUrl;
        private String userAgent = "WordsOnPhone-PhraseValidator/1.0";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);

        public Endpoint() {}

        Endpoint(String baseUrl) { this.baseUrl = baseUrl; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }
}
