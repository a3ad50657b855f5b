package com.pagesmith.orchestrator.generation;

/**
 * Output of the code generation stage.
 *
 * @param html           complete HTML document, never null
 * @param source         which path produced it
 * @param fallbackReason why the provider path was abandoned, null for {@link Source#PROVIDER}
 */
public record GeneratedArtifact(String html, Source source, String fallbackReason) {

    public enum Source { PROVIDER, TEMPLATE, MINIMAL }

    public boolean isFallback() {
        return source != Source.PROVIDER;
    }
}
