package org.processverify.engine.config;

import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.errors.ConfigurationException;
import org.processverify.engine.errors.Stage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigHelperTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigHelper.loadDefaultConfig();

        assertEquals("workplace", config.workspace);
        assertEquals(EngineConfig.DATA_SOURCE_CACHED, config.dataSource);
        assertFalse(config.validateBpmnInput);
        assertEquals("p_post_T1", config.namingConvention.postPlace("T1"));
        assertEquals("t_T1", config.namingConvention.transition("T1"));
        assertEquals(0.7, config.similarity.sequenceFlowWeight, 1e-9);
        assertEquals(0.3, config.similarity.messageFlowWeight, 1e-9);
        assertEquals("GATEWAY", config.closure.routingActor);
        assertEquals("_petri_net.pnml", config.outputFiles.pnmlSuffix);
    }

    @Test
    void shouldKeepDefaultsForFieldsNotNamed() throws IOException {
        Path file = tempDir.resolve("engine-config.json");
        Files.writeString(file, """
                {
                  "workspace": "runs/42",
                  "namingConvention": { "transitionPrefix": "tr_" }
                }
                """);

        EngineConfig config = EngineConfigHelper.loadConfigFile(file.toString());

        assertEquals("runs/42", config.workspace);
        assertEquals("tr_T1", config.namingConvention.transition("T1"));
        assertEquals("p_pre_T1", config.namingConvention.prePlace("T1"));
        assertEquals("bpmn_converted_net", config.petriNet.netId);
        assertEquals(Path.of("runs/42", "seq_output.json"),
                EngineConfigHelper.resolveInWorkspace(config, config.outputFiles.seqOutputFile));
    }

    @Test
    void shouldRejectUnknownDataSource() throws IOException {
        Path file = tempDir.resolve("engine-config.json");
        Files.writeString(file, "{ \"dataSource\": \"remote\" }");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> EngineConfigHelper.loadConfigFile(file.toString()));
        assertEquals(Stage.CONFIG, e.getStage());
    }

    @Test
    void shouldRejectPrefixWithSpaces() throws IOException {
        Path file = tempDir.resolve("engine-config.json");
        Files.writeString(file, "{ \"namingConvention\": { \"postPlacePrefix\": \"post place \" } }");

        assertThrows(ConfigurationException.class, () -> EngineConfigHelper.loadConfigFile(file.toString()));
    }

    @Test
    void shouldRejectWeightOutOfRange() throws IOException {
        Path file = tempDir.resolve("engine-config.json");
        Files.writeString(file, "{ \"similarity\": { \"sequenceFlowWeight\": 1.5 } }");

        assertThrows(ConfigurationException.class, () -> EngineConfigHelper.loadConfigFile(file.toString()));
    }

    @Test
    void shouldThrowWhenFileIsMissing() {
        String missing = tempDir.resolve("missing.json").toString();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> EngineConfigHelper.loadConfigFile(missing));
        assertEquals(missing, e.getIdentifier());
    }

    @Test
    void shouldThrowWhenClasspathResourceIsMissing() {
        assertThrows(ConfigurationException.class,
                () -> EngineConfigHelper.loadConfigFromClasspath("no-such-config.json"));
    }
}
