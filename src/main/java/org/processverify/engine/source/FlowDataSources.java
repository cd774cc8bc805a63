package org.processverify.engine.source;

import org.processverify.engine.config.models.EngineConfig;
import org.processverify.engine.errors.ConfigurationException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Picks the {@link FlowDataSource} named by {@code EngineConfig.dataSource}.
 */
public class FlowDataSources {

    public static FlowDataSource cached(EngineConfig config) {
        return new CachedFileFlowDataSource(Paths.get(config.workspace), config.outputFiles);
    }

    /**
     * @param generator used when the config asks for generated data; may be null for "cached"
     * @throws ConfigurationException if generation is requested without a generator, or the source is unknown
     */
    public static FlowDataSource fromConfig(EngineConfig config, FlowDataGenerator generator) {
        String dataSource = config.dataSource == null ? EngineConfig.DATA_SOURCE_CACHED : config.dataSource;
        switch (dataSource) {
            case EngineConfig.DATA_SOURCE_CACHED:
                return cached(config);
            case EngineConfig.DATA_SOURCE_GENERATE:
                if (generator == null) {
                    throw new ConfigurationException("Data source 'generate' needs a flow data generator", dataSource);
                }
                Path workspace = Paths.get(config.workspace);
                return new GeneratingFlowDataSource(generator, workspace, config.outputFiles);
            default:
                throw new ConfigurationException("Unknown data source", dataSource);
        }
    }
}
