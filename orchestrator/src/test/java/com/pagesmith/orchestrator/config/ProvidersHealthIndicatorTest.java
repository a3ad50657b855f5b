package com.pagesmith.orchestrator.config;

import com.pagesmith.orchestrator.hosting.HostingProvider;
import com.pagesmith.orchestrator.llm.ChatCompletionsClient;
import com.pagesmith.orchestrator.service.TaskOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProvidersHealthIndicatorTest {

    private final ChatCompletionsClient llm          = mock(ChatCompletionsClient.class);
    private final HostingProvider       hosting      = mock(HostingProvider.class);
    private final TaskOrchestrator      orchestrator = mock(TaskOrchestrator.class);

    @Test
    void missingModelKey_isStillUp() {
        PagesmithProperties props = new PagesmithProperties();
        props.setSecret("s3cret");
        when(hosting.isConfigured()).thenReturn(true);
        when(llm.isConfigured()).thenReturn(false);
        when(orchestrator.activeTasks()).thenReturn(2L);

        Health health = new ProvidersHealthIndicator(props, llm, hosting, orchestrator).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("llmConfigured", false)
                .containsEntry("activeTasks", 2L);
    }

    @Test
    void missingSecret_isOutOfService() {
        when(hosting.isConfigured()).thenReturn(true);

        Health health = new ProvidersHealthIndicator(new PagesmithProperties(), llm, hosting, orchestrator).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("secretConfigured", false);
    }
}
