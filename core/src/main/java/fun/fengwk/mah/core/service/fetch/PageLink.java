package fun.fengwk.mah.core.service.fetch;

/**
 * Link found on a page together with its visible text.
 *
 * @author fengwk
 */
public record PageLink(String url, String text) {

    public PageLink {
        text = text == null ? "" : text.trim();
    }

}
