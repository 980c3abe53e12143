package uk.gegc.aimeter.features.ai.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "ai.runtime")
@Validated
@Data
public class AiRuntimeProperties {

    /**
     * Graph used when a streaming request does not name one.
     */
    @NotBlank
    private String defaultGraph = "inproc:chat";
}
