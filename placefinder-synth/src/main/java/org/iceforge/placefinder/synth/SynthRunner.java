package org.iceforge.placefinder.synth;

import org.iceforge.placefinder.compose.DeploymentComposer;
import org.iceforge.placefinder.compose.DeploymentProfile;
import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command-line entry point.
 * <p>
 * Options (each overrides the bound {@code placefinder.deploy.*} value):
 * <ul>
 *   <li>{@code --imageUri=<host>/<repo>:<tag>} use an existing image instead of the registry's</li>
 *   <li>{@code --profile=HTTP_OAUTH|MCP_NO_AUTH}</li>
 *   <li>{@code --output=<dir>}</li>
 * </ul>
 */
@Component
public class SynthRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SynthRunner.class);

    static final String OPT_IMAGE_URI = "imageUri";
    static final String OPT_PROFILE = "profile";
    static final String OPT_OUTPUT = "output";

    private final DeploymentProperties props;
    private final DeploymentComposer composer;
    private final CloudAssemblyWriter writer;

    public SynthRunner(DeploymentProperties props, DeploymentComposer composer, CloudAssemblyWriter writer) {
        this.props = props;
        this.composer = composer;
        this.writer = writer;
    }

    @Override
    public void run(ApplicationArguments args) {
        synth(args);
    }

    List<Path> synth(ApplicationArguments args) {
        option(args, OPT_IMAGE_URI).ifPresent(props::setImageUri);
        option(args, OPT_PROFILE).map(SynthRunner::parseProfile).ifPresent(props::setProfile);
        option(args, OPT_OUTPUT).ifPresent(props::setOutputDir);

        DeploymentGraph graph = composer.compose(props.toRequest());
        return writer.write(graph, props.environment(), Path.of(props.getOutputDir()));
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        if (values.size() > 1) {
            log.warn("--{} given {} times; using the last value", name, values.size());
        }
        return Optional.ofNullable(values.get(values.size() - 1));
    }

    static DeploymentProfile parseProfile(String value) {
        try {
            return DeploymentProfile.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new DeploymentConfigurationException("profile",
                    "unknown profile '" + value + "', expected one of " + List.of(DeploymentProfile.values()));
        }
    }
}
