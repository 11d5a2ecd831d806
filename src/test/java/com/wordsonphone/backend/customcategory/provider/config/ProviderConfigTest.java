package com.wordsonphone.backend.customcategory.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClientRouter;
import com.wordsonphone.backend.customcategory.provider.ProviderTelemetry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(ProviderConfig.class, ProviderTelemetry.class, GenerationClientRouter.class)
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void only_stub_when_nothing_enabled() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx.getBeansOfType(GenerationClient.class)).containsOnlyKeys("stubGenerationClient");
            assertThat(ctx.getBean(GenerationClientRouter.class).resolve().providerCode()).isEqualTo("STUB");
        });
    }

    @Test
    void enabled_openai_without_key_fails_startup() {
        runner.withPropertyValues("app.provider.openai.enabled=true")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().hasMessage("OPENAI_API_KEY_MISSING"));
    }

    @Test
    void enabled_gemini_without_key_fails_startup() {
        runner.withPropertyValues("app.provider.gemini.enabled=true", "app.provider.gemini.api-key=")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().rootCause().hasMessage("GEMINI_API_KEY_MISSING"));
    }

    @Test
    void auto_prefers_configured_real_provider() {
        runner.withPropertyValues(
                        "app.provider.gemini.enabled=true",
                        "app.provider.gemini.api-key=k",
                        "app.custom-category.provider=AUTO")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx.getBean(GenerationClientRouter.class).resolve().providerCode()).isEqualTo("GEMINI");
                });
    }
}
