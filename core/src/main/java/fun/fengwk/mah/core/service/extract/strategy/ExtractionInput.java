package fun.fengwk.mah.core.service.extract.strategy;

import fun.fengwk.mah.core.service.fetch.EmbeddedPayload;
import org.jsoup.nodes.Document;

/**
 * Parsed page handed to every extraction strategy.
 *
 * @param document parsed html, base uri set to {@code url}
 * @param payload embedded script payload, never null
 * @param url page url
 * @author fengwk
 */
public record ExtractionInput(Document document, EmbeddedPayload payload, String url) {

    public ExtractionInput {
        payload = payload == null ? EmbeddedPayload.empty() : payload;
    }

}
