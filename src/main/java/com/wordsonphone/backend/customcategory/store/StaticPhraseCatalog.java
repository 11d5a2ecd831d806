package com.wordsonphone.backend.customcategory.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordsonphone.backend.customcategory.dedup.PhraseDeduplicator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 內建題庫（classpath JSON 字串陣列）。只用來 dedup，不寫進 DB。
 * required=true（預設）載不到就擋啟動；false 才當成空集合並打 ERROR。
 */
@Slf4j
@Component
public class StaticPhraseCatalog {

    private final ObjectMapper om;
    private final String location;
    private final boolean required;

    private volatile Set<String> keys = Collections.emptySet();

    public StaticPhraseCatalog(ObjectMapper om,
                               @Value("${app.custom-category.static-catalog:classpath:catalog/static-phrases.json}") String location,
                               @Value("${app.custom-category.static-catalog-required:true}") boolean required) {
        this.om = om;
        this.location = location;
        this.required = required;
    }

    @PostConstruct
    public void load() {
        Resource r = new DefaultResourceLoader().getResource(location);
        try (InputStream in = r.getInputStream()) {
            List<String> phrases = om.readValue(in, new TypeReference<List<String>>() {});
            keys = Collections.unmodifiableSet(PhraseDeduplicator.keysOf(phrases));
            log.info("static_catalog_loaded location={} phrases={}", location, keys.size());
        } catch (Exception e) {
            if (required) {
                throw new IllegalStateException("STATIC_CATALOG_LOAD_FAILED: " + location, e);
            }
            log.error("static_catalog_load_failed location={} err={} (dedup runs without static corpus)", location, e.toString());
        }
    }

    /** 已正規化（小寫）的 key */
    public Set<String> keys() {
        return keys;
    }
}
