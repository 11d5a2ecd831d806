package com.wordsonphone.backend.customcategory.scoring.booster;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.web.client.RestClient;

@Configuration
@EnableCaching
@EnableConfigurationProperties(BoosterProperties.class)
public class BoosterConfig {

    /** 同一個字查過就記住（含「查不到」的 0）；失敗不會進 cache */
    @Bean("boosterCacheManager")
    public CacheManager boosterCacheManager(BoosterProperties props) {
        CaffeineCacheManager mgr = new CaffeineCacheManager("wikidataSitelinks", "redditEngagement");
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.getCacheTtl())
                .maximumSize(props.getCacheMaxSize())
        );
        return mgr;
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.booster.wikidata", name = "enabled", havingValue = "true")
    public QualityBooster wikidataSitelinksBooster(BoosterProperties props) {
        return new WikidataSitelinksBooster(restClient(props.getWikidata(), "WIKIDATA"));
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.booster.reddit", name = "enabled", havingValue = "true")
    public QualityBooster redditEngagementBooster(BoosterProperties props) {
        return new RedditEngagementBooster(restClient(props.getReddit(), "REDDIT"));
    }

    private static RestClient restClient(BoosterProperties.Endpoint ep, String name) {
        if (ep.getBaseUrl() == null || ep.getBaseUrl().isBlank()) {
            throw new IllegalStateException(name + "_BASE_URL_MISSING");
        }

        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) ep.getConnectTimeout().toMillis());
        f.setReadTimeout((int) ep.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(ep.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, ep.getUserAgent())
                .requestFactory(f)
                .build();
    }
}
