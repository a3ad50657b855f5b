package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.config.PagesmithProperties;
import com.pagesmith.orchestrator.hosting.HostingException;
import com.pagesmith.orchestrator.hosting.HostingProvider;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.RepositoryHandle;
import com.pagesmith.orchestrator.model.StageFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns on static hosting for a repository and works out its public URL.
 *
 * Safe to call every round. Failures surface as a non-fatal
 * {@code PublishDegraded} stage failure; the orchestrator records it as a
 * warning and carries on to notification.
 */
@Service
public class PagesPublisher {

    private static final Logger log = LoggerFactory.getLogger(PagesPublisher.class);

    private final HostingProvider hosting;
    private final RetryPolicy     retry;

    @Autowired
    public PagesPublisher(HostingProvider hosting, PagesmithProperties properties) {
        this(hosting, properties.getGithub().getRetry().toPolicy());
    }

    PagesPublisher(HostingProvider hosting, RetryPolicy retry) {
        this.hosting = hosting;
        this.retry   = retry;
    }

    /**
     * @return the URL the provider reports, or the conventional
     *         {@code https://<owner>.github.io/<repo>/} when it reports none yet
     * @throws StageFailureException {@code PublishDegraded} if hosting could not be enabled
     */
    public String ensurePublished(RepositoryHandle repo) throws InterruptedException {
        try {
            retry.execute("enablePages " + repo.fullName(), () -> {
                hosting.enablePages(repo);
                return null;
            }, PagesPublisher::isTransient);

            Optional<String> reported = retry.execute("findPagesUrl " + repo.fullName(),
                    () -> hosting.findPagesUrl(repo), PagesPublisher::isTransient);
            String url = reported.orElseGet(() -> defaultUrl(repo));
            log.info("Pages for {} at {}", repo.fullName(), url);
            return url;
        } catch (HostingException e) {
            if (Thread.interrupted()) {
                throw new InterruptedException("publishing " + repo.fullName() + " abandoned");
            }
            throw new StageFailureException(ErrorKind.PUBLISH_DEGRADED,
                    "Could not enable pages for " + repo.fullName() + ": " + e.getMessage(), e);
        }
    }

    /** Where GitHub serves a project site once it is built. */
    public static String defaultUrl(RepositoryHandle repo) {
        return "https://" + repo.owner().toLowerCase(Locale.ROOT) + ".github.io/" + repo.name() + "/";
    }

    private static boolean isTransient(RuntimeException e) {
        return e instanceof HostingException h && h.isTransient();
    }
}
