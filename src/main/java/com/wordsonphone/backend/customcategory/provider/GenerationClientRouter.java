package com.wordsonphone.backend.customcategory.provider;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * app.custom-category.provider：
 * - AUTO：OPENAI > GEMINI > STUB（有註冊誰就用誰）
 * - 其他：指定 providerCode，沒註冊就 PROVIDER_NOT_CONFIGURED
 */
@Slf4j
@Component
public class GenerationClientRouter {

    private static final List<String> AUTO_ORDER = List.of(
            OpenAiGenerationClient.CODE, GeminiGenerationClient.CODE, StubGenerationClient.CODE);

    private final Map<String, GenerationClient> byCode;
    private final CustomCategoryProperties props;

    public GenerationClientRouter(List<GenerationClient> clients, CustomCategoryProperties props) {
        Map<String, GenerationClient> m = new LinkedHashMap<>();
        for (GenerationClient c : clients) {
            String code = c.providerCode().trim().toUpperCase(Locale.ROOT);
            GenerationClient prev = m.putIfAbsent(code, c);
            if (prev != null) {
                throw new IllegalStateException("DUPLICATE_PROVIDER_CODE: " + code);
            }
        }
        this.byCode = Collections.unmodifiableMap(m);
        this.props = props;
        log.info("generation_clients_registered codes={} configured={}", byCode.keySet(), props.getProvider());
    }

    public GenerationClient resolve() {
        String want = props.getProvider() == null ? "AUTO" : props.getProvider().trim().toUpperCase(Locale.ROOT);

        if ("AUTO".equals(want)) {
            for (String code : AUTO_ORDER) {
                GenerationClient c = byCode.get(code);
                if (c != null) return c;
            }
            throw new IllegalStateException("PROVIDER_NOT_CONFIGURED");
        }

        GenerationClient c = byCode.get(want);
        if (c == null) throw new IllegalStateException("PROVIDER_NOT_CONFIGURED: " + want);
        return c;
    }

    public Set<String> registeredCodes() {
        return byCode.keySet();
    }
}
