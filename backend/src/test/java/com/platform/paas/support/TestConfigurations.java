package com.platform.paas.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.paas.config.ControllerConfiguration;
import com.platform.paas.config.ControllerConfigurationLoader;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Controller configuration built from the bundled defaults.
 */
public final class TestConfigurations {

    public static final Instant EPOCH = Instant.parse("2024-03-01T10:15:30Z");

    private TestConfigurations() {
    }

    public static ControllerConfiguration defaults() {
        return load(ControllerConfigurationLoader.Sources.defaults());
    }

    public static ControllerConfiguration load(ControllerConfigurationLoader.Sources sources) {
        ControllerConfigurationLoader loader = new ControllerConfigurationLoader(
            new DefaultResourceLoader(), new ObjectMapper(), Clock.fixed(EPOCH, ZoneOffset.UTC));
        return loader.load(sources);
    }
}
