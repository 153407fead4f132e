package fun.fengwk.mah.core.service.fetch;

import fun.fengwk.mah.core.service.browser.runtime.BrowserSession;

/**
 * Retrieves a rendered page through an acquired browser session.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Navigate, wait for content readiness and collect the rendered content with its embedded payload.
     *
     * @throws TransientFetchException on timeout, navigation error or detected soft-block
     * @throws PermanentFetchException when the page does not exist or was removed
     */
    FetchResult fetch(BrowserSession session, String url);

}
