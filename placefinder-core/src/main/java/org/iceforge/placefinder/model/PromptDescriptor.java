package org.iceforge.placefinder.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Managed prompt template. {@code {{variable}}} placeholders in the text become the prompt's input variables.
 */
public record PromptDescriptor(
        String name,
        String description,
        String modelId,
        double temperature,
        double topP,
        int maxTokens,
        String templateText
) {
    private static final Pattern VARIABLE = Pattern.compile("\\{\\{(\\w+)}}");

    public PromptDescriptor {
        DeploymentConfigurationException.requireNonBlank("prompt.name", name);
        DeploymentConfigurationException.requireNonBlank("prompt.modelId", modelId);
        DeploymentConfigurationException.requireNonBlank("prompt.templateText", templateText);
        if (temperature < 0 || temperature > 1) {
            throw new DeploymentConfigurationException("prompt.temperature", "must be within [0, 1]");
        }
        if (topP < 0 || topP > 1) {
            throw new DeploymentConfigurationException("prompt.topP", "must be within [0, 1]");
        }
        if (maxTokens <= 0) {
            throw new DeploymentConfigurationException("prompt.maxTokens", "must be positive");
        }
    }

    public List<String> inputVariables() {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = VARIABLE.matcher(templateText);
        while (m.find()) {
            out.add(m.group(1));
        }
        return List.copyOf(out);
    }
}
