package org.iceforge.placefinder.synth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.placefinder.compose.DeploymentComposer;
import org.iceforge.placefinder.render.TemplateRenderer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SynthConfig {

    @Bean
    public DeploymentComposer deploymentComposer() {
        return new DeploymentComposer();
    }

    @Bean
    public TemplateRenderer templateRenderer(ObjectMapper objectMapper) {
        return new TemplateRenderer(objectMapper);
    }

    @Bean
    public CloudAssemblyWriter cloudAssemblyWriter(TemplateRenderer renderer) {
        return new CloudAssemblyWriter(renderer);
    }
}
