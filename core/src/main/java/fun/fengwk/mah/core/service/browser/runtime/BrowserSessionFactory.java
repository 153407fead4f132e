package fun.fengwk.mah.core.service.browser.runtime;

import fun.fengwk.mah.core.service.browser.FingerprintProfile;
import fun.fengwk.mah.core.service.proxy.ProxyRecord;

/**
 * Opens browser sessions bound to one proxy and one fingerprint profile.
 *
 * @author fengwk
 */
public interface BrowserSessionFactory {

    BrowserSession create(String contextId, ProxyRecord proxy, FingerprintProfile fingerprintProfile) throws Exception;

}
