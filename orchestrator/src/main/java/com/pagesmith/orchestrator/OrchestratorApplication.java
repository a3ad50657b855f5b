package com.pagesmith.orchestrator;

import com.pagesmith.orchestrator.config.PagesmithProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(PagesmithProperties.class)
public class OrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }

    /**
     * Startup report of what is configured. Missing credentials do not stop the
     * service; they show up here and on /actuator/health.
     */
    @Bean
    CommandLineRunner configurationReport(PagesmithProperties props) {
        return args -> {
            log.info("Model provider: {} ({})",
                    props.getLlm().isConfigured() ? "configured" : "NOT configured, template pages only",
                    props.getLlm().getModel());
            log.info("GitHub: {} (owner={}, branch={})",
                    props.getGithub().isConfigured() ? "configured" : "NOT configured",
                    props.getGithub().getUsername(), props.getGithub().getBranch());
            log.info("Shared secret: {}", props.hasSecret() ? "set" : "NOT set, every submission is rejected");
            log.info("Up to {} concurrent tasks, {}s budget each",
                    props.getOrchestrator().getMaxConcurrentTasks(),
                    props.getOrchestrator().getBudget().toSeconds());
        };
    }
}
