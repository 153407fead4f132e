package fun.fengwk.mah.core.service.crawl;

import fun.fengwk.mah.core.service.discovery.model.Candidate;
import fun.fengwk.mah.core.service.discovery.model.CandidateKind;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class CrawlFrontierTest {

    @Test
    public void shouldAcceptEachCanonicalUrlOnce() {
        CrawlFrontier frontier = new CrawlFrontier(10);

        assertThat(frontier.offer(article("https://mp.weixin.qq.com/s/a", 0))).isTrue();
        assertThat(frontier.offer(article("https://mp.weixin.qq.com/s/a?scene=21#rd", 1))).isFalse();
        assertThat(frontier.markVisited("https://mp.weixin.qq.com/s/a")).isFalse();
        assertThat(frontier.markVisited("https://mp.weixin.qq.com/s/b")).isTrue();
        assertThat(frontier.offer(article("https://mp.weixin.qq.com/s/b", 1))).isFalse();
        assertThat(frontier.offer(null)).isFalse();
        assertThat(frontier.size()).isEqualTo(1);
    }

    @Test
    public void shouldHandOutShallowestFirstInDiscoveryOrder() {
        CrawlFrontier frontier = new CrawlFrontier(10);
        frontier.offer(article("https://mp.weixin.qq.com/s/deep", 2));
        frontier.offer(article("https://mp.weixin.qq.com/s/first", 1));
        frontier.offer(article("https://mp.weixin.qq.com/s/second", 1));

        assertThat(frontier.take(0).getUrl()).endsWith("/first");
        assertThat(frontier.take(0).getUrl()).endsWith("/second");
        assertThat(frontier.take(0).getUrl()).endsWith("/deep");
        assertThat(frontier.take(0)).isNull();
        assertThat(frontier.inFlight()).isEqualTo(3);
        assertThat(frontier.isExhausted()).isFalse();
    }

    @Test
    public void shouldNeverHandOutMoreArticlesThanBudgetAllows() {
        CrawlFrontier frontier = new CrawlFrontier(2);
        for (int i = 0; i < 5; i++) {
            frontier.offer(article("https://mp.weixin.qq.com/s/" + i, 1));
        }
        frontier.offer(listing("https://mp.weixin.qq.com/mp/appmsgalbum?album_id=1", 2));

        Candidate first = frontier.take(0);
        Candidate second = frontier.take(0);
        Candidate third = frontier.take(0);

        assertThat(third.isListing()).isTrue();
        assertThat(frontier.take(0)).isNull();

        frontier.complete(first, false);
        Candidate replacement = frontier.take(0);
        assertThat(replacement).isNotNull();

        frontier.complete(second, true);
        frontier.complete(replacement, true);
        assertThat(frontier.isBudgetMet()).isTrue();
        assertThat(frontier.isClosed()).isTrue();
        assertThat(frontier.size()).isZero();
        assertThat(frontier.offer(article("https://mp.weixin.qq.com/s/late", 1))).isFalse();

        frontier.complete(third, false);
        assertThat(frontier.isExhausted()).isTrue();
        assertThat(frontier.producedArticles()).isEqualTo(2);
    }

    @Test
    public void shouldDelayRetriesUntilDue() {
        CrawlFrontier frontier = new CrawlFrontier(10);
        frontier.offer(article("https://mp.weixin.qq.com/s/a", 0));
        Candidate candidate = frontier.take(0);

        frontier.retry(candidate, 1000);

        assertThat(frontier.take(999)).isNull();
        assertThat(frontier.nextDelayMs(600)).isEqualTo(400);
        assertThat(frontier.isExhausted()).isFalse();
        assertThat(frontier.take(1000)).isSameAs(candidate);
        assertThat(frontier.nextDelayMs(1000)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    public void shouldDropListingsAfterIdleExpansions() {
        CrawlFrontier frontier = new CrawlFrontier(10);
        frontier.offer(listing("https://mp.weixin.qq.com/mp/appmsgalbum?album_id=1", 1));
        frontier.offer(listing("https://mp.weixin.qq.com/mp/appmsgalbum?album_id=2", 1));

        assertThat(frontier.recordExpansion(0, 3)).isZero();
        assertThat(frontier.recordExpansion(0, 3)).isZero();
        assertThat(frontier.recordExpansion(0, 3)).isEqualTo(2);
        assertThat(frontier.size()).isZero();
    }

    @Test
    public void shouldKeepListingsWhileArticlesAreQueuedOrFound() {
        CrawlFrontier frontier = new CrawlFrontier(10);
        frontier.offer(listing("https://mp.weixin.qq.com/mp/appmsgalbum?album_id=1", 1));
        frontier.offer(article("https://mp.weixin.qq.com/s/a", 1));

        assertThat(frontier.recordExpansion(0, 1)).isZero();
        assertThat(frontier.recordExpansion(0, 2)).isZero();
        assertThat(frontier.recordExpansion(3, 2)).isZero();
        assertThat(frontier.size()).isEqualTo(2);
    }

    @Test
    public void shouldDiscardEverythingQueued() {
        CrawlFrontier frontier = new CrawlFrontier(10);
        frontier.offer(article("https://mp.weixin.qq.com/s/a", 0));
        frontier.offer(article("https://mp.weixin.qq.com/s/b", 1));

        assertThat(frontier.discard()).isEqualTo(2);
        assertThat(frontier.take(0)).isNull();
        assertThat(frontier.isExhausted()).isTrue();
    }

    @Test
    public void shouldRejectSettlingCandidateThatWasNotTaken() {
        CrawlFrontier frontier = new CrawlFrontier(10);

        assertThatThrownBy(() -> frontier.complete(article("https://mp.weixin.qq.com/s/a", 0), false))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new CrawlFrontier(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private Candidate article(String url, int depth) {
        return Candidate.of(url, StrategyType.DISCOVER, null, depth, CandidateKind.ARTICLE);
    }

    private Candidate listing(String url, int depth) {
        return Candidate.of(url, StrategyType.SERIES, null, depth, CandidateKind.LISTING);
    }

}
