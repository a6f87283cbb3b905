package com.phillippitts.observability;

import com.phillippitts.observability.service.pipeline.InstrumentationPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ObservabilityApplicationTests {

    @Autowired
    private InstrumentationPipeline pipeline;

    @Test
    void contextLoads() {
        assertThat(pipeline.getConfig().excludePaths()).contains("/actuator/*", "/logs");
        assertThat(pipeline.getConfig().routeTemplates()).containsExactly("/users/{id}");
    }

}
