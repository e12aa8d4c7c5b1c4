package com.devicesim.config;

import com.devicesim.io.DefinitionLoader;
import com.devicesim.io.GraphSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SimulatorConfig {

    @Bean
    public DefinitionLoader definitionLoader() {
        return new DefinitionLoader();
    }

    @Bean
    public GraphSerializer graphSerializer() {
        return new GraphSerializer();
    }
}
