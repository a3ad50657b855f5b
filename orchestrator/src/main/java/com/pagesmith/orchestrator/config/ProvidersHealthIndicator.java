package com.pagesmith.orchestrator.config;

import com.pagesmith.orchestrator.hosting.HostingProvider;
import com.pagesmith.orchestrator.llm.ChatCompletionsClient;
import com.pagesmith.orchestrator.service.TaskOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * {@code /actuator/health/providers}: which external collaborators are configured.
 *
 * Without GitHub credentials or the shared secret no task can succeed, so the
 * service reports OUT_OF_SERVICE. A missing model key only means every page
 * comes from the template generator, which is still UP.
 */
@Component
public class ProvidersHealthIndicator implements HealthIndicator {

    private final PagesmithProperties   properties;
    private final ChatCompletionsClient llm;
    private final HostingProvider       hosting;
    private final TaskOrchestrator      orchestrator;

    public ProvidersHealthIndicator(PagesmithProperties properties, ChatCompletionsClient llm,
                                    HostingProvider hosting, TaskOrchestrator orchestrator) {
        this.properties   = properties;
        this.llm          = llm;
        this.hosting      = hosting;
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        boolean github = hosting.isConfigured();
        boolean secret = properties.hasSecret();
        Health.Builder builder = github && secret ? Health.up() : Health.outOfService();
        return builder
                .withDetail("llmConfigured",    llm.isConfigured())
                .withDetail("githubConfigured", github)
                .withDetail("secretConfigured", secret)
                .withDetail("activeTasks",      orchestrator.activeTasks())
                .build();
    }
}
