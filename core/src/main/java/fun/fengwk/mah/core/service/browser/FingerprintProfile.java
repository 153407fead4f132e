package fun.fengwk.mah.core.service.browser;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device fingerprint a browser session presents: user agent plus mobile viewport emulation.
 *
 * @author fengwk
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FingerprintProfile {

    private String name;
    private String userAgent;
    private int viewportWidth;
    private int viewportHeight;
    private double deviceScaleFactor;
    private boolean mobile;
    private boolean touch;

}
