package uk.gegc.aimeter.shared.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * {@link ChatClient} for the Spring AI provider. The OpenAI starter auto-configures the model and
 * the builder; its base URL points at the LiteLLM proxy.
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }
}
