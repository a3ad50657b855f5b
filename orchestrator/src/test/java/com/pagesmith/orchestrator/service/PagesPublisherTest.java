package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.hosting.InMemoryHostingProvider;
import com.pagesmith.orchestrator.model.ErrorKind;
import com.pagesmith.orchestrator.model.RepositoryHandle;
import com.pagesmith.orchestrator.model.StageFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PagesPublisherTest {

    InMemoryHostingProvider hosting;
    PagesPublisher publisher;
    RepositoryHandle repo;

    @BeforeEach
    void setUp() {
        hosting   = new InMemoryHostingProvider();
        publisher = new PagesPublisher(hosting, RetryPolicy.immediate(2));
        repo      = hosting.createRepository("tds-demo", "test");
    }

    @Test
    void enablesPages_andReturnsReportedUrl() throws Exception {
        String url = publisher.ensurePublished(repo);

        assertThat(hosting.pagesEnabled("tds-demo")).isTrue();
        assertThat(url).isEqualTo("https://pagesmith-bot.github.io/tds-demo/");
    }

    @Test
    void isIdempotent() throws Exception {
        String first  = publisher.ensurePublished(repo);
        String second = publisher.ensurePublished(repo);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void noReportedUrl_fallsBackToConventionalUrl() throws Exception {
        hosting.setPagesUrlReported(false);

        assertThat(publisher.ensurePublished(repo))
                .isEqualTo(PagesPublisher.defaultUrl(repo))
                .isEqualTo("https://pagesmith-bot.github.io/tds-demo/");
    }

    @Test
    void failure_isReportedAsPublishDegraded() {
        hosting.setPagesBroken(true);

        assertThatThrownBy(() -> publisher.ensurePublished(repo))
                .isInstanceOf(StageFailureException.class)
                .extracting(e -> ((StageFailureException) e).getKind())
                .isEqualTo(ErrorKind.PUBLISH_DEGRADED);
    }

    @Test
    void defaultUrl_lowerCasesOwner() {
        RepositoryHandle handle = new RepositoryHandle("SomeUser", "tds-x", "https://github.com/SomeUser/tds-x", "main");
        assertThat(PagesPublisher.defaultUrl(handle)).isEqualTo("https://someuser.github.io/tds-x/");
    }
}
