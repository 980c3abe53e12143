package uk.gegc.aimeter.features.ai.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "ai.conversation")
@Validated
@Data
public class ConversationProperties {

    /**
     * Longest single message accepted from a caller.
     */
    @Positive
    private int maxMessageChars = 4000;

    /**
     * Budget for the whole history sent to the model; older messages are dropped first.
     */
    @Positive
    private int maxHistoryChars = 16000;
}
