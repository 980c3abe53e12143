package uk.gegc.aimeter.features.ai.infra.litellm;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class LiteLlmClientConfig {

    @Bean("liteLlmRestTemplate")
    public RestTemplate liteLlmRestTemplate(RestTemplateBuilder builder, LiteLlmProperties properties) {
        return builder
                .rootUri(properties.getBaseUrl())
                .connectTimeout(properties.getTimeout())
                .readTimeout(properties.getTimeout())
                .build();
    }
}
