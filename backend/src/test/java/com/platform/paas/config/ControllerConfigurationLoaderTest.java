package com.platform.paas.config;

import com.platform.paas.error.ConfigurationException;
import com.platform.paas.support.TestConfigurations;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControllerConfigurationLoaderTest {

    @TempDir
    Path dir;

    @Test
    void shouldLoadBuiltInDefaults() {
        ControllerConfiguration configuration = TestConfigurations.defaults();

        assertEquals(3, configuration.catalog().planCount());
        assertEquals(6, configuration.catalog().specCount());
        assertEquals("standard", configuration.catalog().defaultPlan().id());
        assertEquals(TestConfigurations.EPOCH, configuration.loadedAt());
        assertTrue(configuration.namePolicy().check("kube-system").isPresent());
        assertEquals("Opaque", configuration.templates().secret().get("type"));
    }

    @Test
    void shouldHonorExplicitDefaultPlanAndReservedNames() {
        ControllerConfiguration configuration = TestConfigurations.load(new ControllerConfigurationLoader.Sources(
            null, null, "starter", "admin, billing", null, null, null, null));

        assertEquals("starter", configuration.catalog().defaultPlan().id());
        assertTrue(configuration.namePolicy().check("admin").isPresent());
        assertTrue(configuration.namePolicy().check("admin-panel").isEmpty());
    }

    @Test
    void shouldFallBackWhenConfiguredSourceIsMissing() {
        ControllerConfiguration configuration = TestConfigurations.load(new ControllerConfigurationLoader.Sources(
            "file:" + dir.resolve("absent.json"), null, null, null, null, null, null, null));

        assertEquals(6, configuration.catalog().specCount());
    }

    @Test
    void shouldReadConfiguredSources() throws IOException {
        Path specs = Files.writeString(dir.resolve("specs.json"),
            "[{\"id\":\"cpu\",\"kind\":\"cpu\",\"floor\":\"10m\",\"ceiling\":\"1\"}]");
        Path plans = Files.writeString(dir.resolve("plans.json"),
            "[{\"id\":\"tiny\",\"specs\":[\"cpu\"]}]");
        Path template = Files.writeString(dir.resolve("secret.json"), "{\"type\":\"Custom\"}");

        ControllerConfiguration configuration = TestConfigurations.load(new ControllerConfigurationLoader.Sources(
            "file:" + specs, "file:" + plans, null, null, null, "file:" + template, null, null));

        assertEquals("tiny", configuration.catalog().defaultPlan().id());
        assertEquals(Map.of("type", "Custom"), configuration.templates().secret());
    }

    @Test
    void shouldRejectTemplateWithNullValue() throws IOException {
        Path template = Files.writeString(dir.resolve("claim.json"),
            "{\"spec\":{\"storageClassName\":null,\"accessModes\":[\"ReadWriteOnce\"]}}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> TestConfigurations.load(
            new ControllerConfigurationLoader.Sources(null, null, null, null, null, null, null, "file:" + template)));

        assertTrue(e.getMessage().contains("volume-claim-template"));
        assertTrue(e.getMessage().contains("/spec/storageClassName"));
    }

    @Test
    void shouldRejectNullEntryInTemplateList() {
        Map<String, Object> volume = new HashMap<>();
        volume.put("items", Arrays.asList("a", null));

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> new ResourceTemplates(Map.of(), volume, null));

        assertTrue(e.getMessage().contains("/items/1"));
    }

    @Test
    void shouldRejectPlanWithNullCeiling() throws IOException {
        Path plans = Files.writeString(dir.resolve("plans.json"),
            "[{\"id\":\"tiny\",\"specs\":[\"cpu-starter\"],\"ceilings\":{\"cpu\":null}}]");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> TestConfigurations.load(
            new ControllerConfigurationLoader.Sources(null, "file:" + plans, null, null, null, null, null, null)));

        assertTrue(e.getMessage().startsWith("limit-plans"));
    }

    @Test
    void shouldFailOnUnparseableSource() throws IOException {
        Path broken = Files.writeString(dir.resolve("plans.json"), "{not json");

        assertThrows(ConfigurationException.class, () -> TestConfigurations.load(
            new ControllerConfigurationLoader.Sources(null, "file:" + broken, null, null, null, null, null, null)));
    }

    @Test
    void shouldFailOnInvalidReservedPattern() throws IOException {
        Path patterns = Files.writeString(dir.resolve("patterns.txt"), "^ok-\n[unclosed\n");

        assertThrows(ConfigurationException.class, () -> TestConfigurations.load(
            new ControllerConfigurationLoader.Sources(null, null, null, null, "file:" + patterns, null, null, null)));
    }
}
