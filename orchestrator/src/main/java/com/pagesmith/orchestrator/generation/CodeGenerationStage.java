package com.pagesmith.orchestrator.generation;

import com.pagesmith.orchestrator.llm.ChatCompletionsClient;
import com.pagesmith.orchestrator.llm.LlmApiException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a brief into an HTML document.
 *
 * Priority order, first success wins:
 * <ol>
 *   <li>the generative provider, when configured and its reply parses as a document</li>
 *   <li>{@link FallbackPageGenerator}, rendered from the brief/attachments/checks alone</li>
 *   <li>{@link FallbackPageGenerator#MINIMAL_PAGE}</li>
 * </ol>
 * Provider problems are recoverable here and never reach the orchestrator. The only
 * exception that escapes is {@link InterruptedException}, raised when the run is
 * abandoned while the provider call is in flight.
 */
@Component
public class CodeGenerationStage {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationStage.class);

    static final String REASON_NOT_CONFIGURED = "not_configured";
    static final String REASON_TIMEOUT        = "timeout";
    static final String REASON_PROVIDER_ERROR = "provider_error";
    static final String REASON_EMPTY          = "empty";
    static final String REASON_MALFORMED      = "malformed";

    private final ChatCompletionsClient  llm;
    private final FallbackPageGenerator  fallback;
    private final MeterRegistry          meters;

    @Autowired
    public CodeGenerationStage(ChatCompletionsClient llm, MeterRegistry meters) {
        this(llm, new FallbackPageGenerator(), meters);
    }

    CodeGenerationStage(ChatCompletionsClient llm, FallbackPageGenerator fallback, MeterRegistry meters) {
        this.llm      = llm;
        this.fallback = fallback;
        this.meters   = meters;
    }

    public GeneratedArtifact generate(String taskName, String brief,
                                      Map<String, byte[]> attachments,
                                      List<String> checks) throws InterruptedException {
        if (!llm.isConfigured()) {
            return fallback(REASON_NOT_CONFIGURED, taskName, brief, attachments, checks);
        }

        String reply;
        try {
            reply = llm.complete(PromptBuilder.build(taskName, brief, attachments, checks));
        } catch (LlmApiException e) {
            log.warn("Generative provider failed: {}", e.getMessage());
            return fallback(reasonFor(e), taskName, brief, attachments, checks);
        } catch (RuntimeException e) {
            log.warn("Unexpected error from generative provider", e);
            return fallback(REASON_PROVIDER_ERROR, taskName, brief, attachments, checks);
        }

        Optional<String> document = HtmlResponseParser.extractDocument(reply);
        if (document.isEmpty()) {
            log.warn("Provider reply of {} chars is not an HTML document", reply.length());
            return fallback(REASON_MALFORMED, taskName, brief, attachments, checks);
        }
        log.info("Generated {} chars of HTML with {}", document.get().length(), llm.model());
        return new GeneratedArtifact(document.get(), GeneratedArtifact.Source.PROVIDER, null);
    }

    private GeneratedArtifact fallback(String reason, String taskName, String brief,
                                       Map<String, byte[]> attachments, List<String> checks) {
        meters.counter("pagesmith.generation.fallback", "reason", reason).increment();
        log.info("Using template page (reason={})", reason);

        String html = fallback.generate(taskName, brief, attachments, checks);
        if (!FallbackPageGenerator.MINIMAL_PAGE.equals(html) && HtmlResponseParser.isDocument(html)) {
            return new GeneratedArtifact(html, GeneratedArtifact.Source.TEMPLATE, reason);
        }
        log.warn("Template page unusable, serving the minimal page");
        return new GeneratedArtifact(FallbackPageGenerator.MINIMAL_PAGE, GeneratedArtifact.Source.MINIMAL, reason);
    }

    static String reasonFor(LlmApiException e) {
        if (e.statusCode() == LlmApiException.NOT_CONFIGURED) {
            return REASON_NOT_CONFIGURED;
        }
        if (e.getCause() instanceof HttpTimeoutException) {
            return REASON_TIMEOUT;
        }
        // 200 with no usable text.
        if (e.statusCode() == 200) {
            return REASON_EMPTY;
        }
        return REASON_PROVIDER_ERROR;
    }
}
