package com.toolgraph.engine.execution;

import com.toolgraph.engine.store.GraphStore;
import com.toolgraph.engine.store.RunStore;
import com.toolgraph.engine.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    /** The application-wide stores and registry, bundled for the engine. */
    @Bean
    EngineContext engineContext(GraphStore graphStore, RunStore runStore, ToolRegistry toolRegistry) {
        return new EngineContext(graphStore, runStore, toolRegistry);
    }
}
