package org.iceforge.placefinder.units;

import org.iceforge.placefinder.model.PromptDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Managed prompt definitions; the template text lives on the classpath under {@code prompts/}. */
public final class PromptTemplates {

    public static final String HOLIDAY_PLANNER_RESOURCE = "prompts/holiday-planner-scope.txt";
    public static final String DEFAULT_MODEL_ID = "anthropic.claude-sonnet-4-20250514-v1:0";

    private PromptTemplates() {}

    public static PromptDescriptor holidayPlannerScope(AppNaming naming) {
        return new PromptDescriptor(
                naming.promptName(),
                "Scope and tool-usage instructions for the " + naming.appName() + " holiday planner agent",
                DEFAULT_MODEL_ID,
                0.0,
                1.0,
                4096,
                load(HOLIDAY_PLANNER_RESOURCE));
    }

    static String load(String resource) {
        try (InputStream in = PromptTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template " + resource + " not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, e);
        }
    }
}
