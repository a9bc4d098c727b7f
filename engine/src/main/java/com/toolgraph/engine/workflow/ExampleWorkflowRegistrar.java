package com.toolgraph.engine.workflow;

import com.toolgraph.engine.service.GraphService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Registers the bundled example graphs once the application has started.
 * Disable with {@code toolgraph.workflows.register-examples=false}.
 */
@Component
@ConditionalOnProperty(name = "toolgraph.workflows.register-examples", havingValue = "true", matchIfMissing = true)
public class ExampleWorkflowRegistrar implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ExampleWorkflowRegistrar.class);

    private final GraphService graphService;

    public ExampleWorkflowRegistrar(GraphService graphService) {
        this.graphService = graphService;
    }

    @Override
    public void run(ApplicationArguments args) {
        graphService.register(CodeReviewWorkflow.graph());
        log.info("Example graph '{}' is available", CodeReviewWorkflow.GRAPH_ID);
    }
}
