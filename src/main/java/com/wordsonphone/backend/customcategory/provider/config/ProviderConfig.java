package com.wordsonphone.backend.customcategory.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.provider.GeminiGenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.OpenAiGenerationClient;
import com.wordsonphone.backend.customcategory.provider.ProviderTelemetry;
import com.wordsonphone.backend.customcategory.provider.StubGenerationClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({OpenAiProperties.class, GeminiProperties.class, CustomCategoryProperties.class})
public class ProviderConfig {

    /**
     * ✅ stub 永遠註冊；router 在 AUTO 時排最後，只有真的 provider 都沒開才會用到
     */
    @Bean
    public GenerationClient stubGenerationClient() {
        return new StubGenerationClient();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.openai", name = "enabled", havingValue = "true")
    public GenerationClient openAiGenerationClient(OpenAiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("OPENAI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("OPENAI_BASE_URL_MISSING");

        RestClient http = restClient(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout());
        return new OpenAiGenerationClient(http, props, om, telemetry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public GenerationClient geminiGenerationClient(GeminiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("GEMINI_BASE_URL_MISSING");

        RestClient http = restClient(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout());
        return new GeminiGenerationClient(http, props, om, telemetry);
    }

    private static RestClient restClient(String baseUrl, Duration connect, Duration read) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) connect.toMillis());
        f.setReadTimeout((int) read.toMillis());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(f)
                .build();
    }
}
