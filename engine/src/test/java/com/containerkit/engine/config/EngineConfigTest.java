package com.containerkit.engine.config;

import com.containerkit.engine.job.Job;
import com.containerkit.engine.job.JobOrchestrator;
import com.containerkit.engine.job.JobStatus;
import com.containerkit.engine.job.JobType;
import com.containerkit.engine.orchestrator.Orchestrator;
import com.containerkit.engine.tool.ExecutionContext;
import com.containerkit.engine.tool.Tool;
import com.containerkit.engine.tool.ToolCategory;
import com.containerkit.engine.tool.ToolInput;
import com.containerkit.engine.tool.ToolOutput;
import com.containerkit.engine.tool.ToolRegistry;
import com.containerkit.engine.tool.ToolSchema;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context: Tool beans are registered, engine.* properties
 * bind, and a mapped job type runs its tool.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "engine.jobs.tools.build=echo_image",
                "engine.jobs.workers=1",
                "engine.communication.base-delay=5ms"
        })
class EngineConfigTest {

    @Autowired EngineProperties properties;
    @Autowired ToolRegistry     toolRegistry;
    @Autowired Orchestrator     orchestrator;
    @Autowired JobOrchestrator  jobOrchestrator;

    @TestConfiguration
    static class Tools {
        @Bean
        Tool echoImageTool() {
            return new Tool() {
                @Override public String name()           { return "echo_image"; }
                @Override public String description()    { return "Echoes the requested image name"; }
                @Override public ToolCategory category() { return ToolCategory.BUILD; }

                @Override
                public ToolSchema schema() {
                    return new ToolSchema(Map.of("image_name", ToolSchema.ParamType.STRING),
                            Set.of("image_name"), "image reference");
                }

                @Override
                public ToolOutput execute(ExecutionContext ctx, ToolInput input) {
                    return ToolOutput.success(Map.of("image", input.data().get("image_name") + ":latest"));
                }
            };
        }
    }

    @Test
    void propertiesBindWithDefaultsAndOverrides() {
        assertThat(properties.getJobs().getWorkers()).isEqualTo(1);
        assertThat(properties.getJobs().getQueueCapacity()).isEqualTo(100);
        assertThat(properties.getCommunication().getBaseDelay()).isEqualTo(Duration.ofMillis(5));
        assertThat(properties.getCircuitBreaker().getMaxFailures()).isEqualTo(5);
        assertThat(properties.getEvents().getSource()).isEqualTo("engine");
    }

    @Test
    void toolBeans_registeredAtStartup() {
        assertThat(toolRegistry.listByCategory(ToolCategory.BUILD)).containsExactly("echo_image");
        assertThat(orchestrator.health()).containsEntry("status", "healthy");
    }

    @Test
    void mappedJobType_runsBackingTool() throws Exception {
        Job job = jobOrchestrator.submit(JobType.BUILD, Map.of("image_name", "app"));

        Instant deadline = Instant.now().plusSeconds(5);
        Job current = job;
        while (!current.getStatus().isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(10);
            current = jobOrchestrator.getJob(job.getId()).orElseThrow();
        }

        assertThat(current.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(current.getResult()).containsEntry("image", "app:latest");
    }
}
