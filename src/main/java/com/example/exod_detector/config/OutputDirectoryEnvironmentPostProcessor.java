package com.example.exod_detector.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.nio.file.Path;
import java.util.Map;

/**
 * Fills in {@code detector.output-dir} from the event list location before logging starts, so
 * the run log lands in the same folder as the products.
 */
public class OutputDirectoryEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String OUTPUT_DIR_KEY = "detector.output-dir";
    static final String PROPERTY_SOURCE_NAME = "detectorDerivedOutputDir";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String configured = environment.getProperty(OUTPUT_DIR_KEY);
        if (configured != null && !configured.isBlank()) {
            return;
        }
        DetectorProperties properties = Binder.get(environment).bindOrCreate("detector", DetectorProperties.class);
        Path output = properties.resolveOutputDir();
        if (output != null) {
            environment.getPropertySources().addLast(
                    new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(OUTPUT_DIR_KEY, output.toString())));
        }
    }

    @Override
    public int getOrder() {
        return ConfigDataEnvironmentPostProcessor.ORDER + 1;
    }
}
