package uk.gegc.aimeter.features.ai.application.relay;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "ai.relay")
@Validated
@Data
public class RelayProperties {

    /**
     * How long the pump waits for the provider's final result once the stream ended
     * without a terminal event.
     */
    @NotNull
    private Duration finalTimeout = Duration.ofSeconds(30);
}
