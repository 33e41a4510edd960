package io.promptfeed.source;

/**
 * An external collaborator (item store or exploration source) could not serve a request.
 * The feed engine never retries; callers decide on retry and backoff.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message) {
        super(message);
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    /**
     * Name of the failing collaborator, e.g. {@code "item-store"}.
     */
    public String getUpstream() {
        return upstream;
    }
}
