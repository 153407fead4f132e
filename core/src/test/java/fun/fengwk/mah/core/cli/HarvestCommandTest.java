package fun.fengwk.mah.core.cli;

import fun.fengwk.mah.core.service.crawl.CrawlJobService;
import fun.fengwk.mah.core.service.crawl.model.CrawlJob;
import fun.fengwk.mah.core.service.crawl.model.JobStatus;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Flux;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class HarvestCommandTest {

    private final CrawlJobService crawlJobService = mock(CrawlJobService.class);
    private final HarvestCommand command = new HarvestCommand(crawlJobService);

    @Test
    public void shouldDoNothingWithoutUrl() throws Exception {
        command.run(new DefaultApplicationArguments("--strategy=series"));

        verify(crawlJobService, never()).submit(anyString(), any(), any());
    }

    @Test
    public void shouldSubmitAndAwaitJob() throws Exception {
        when(crawlJobService.articles()).thenReturn(Flux.empty());
        when(crawlJobService.submit("https://mp.weixin.qq.com/s/a", StrategyType.HISTORY, 5)).thenReturn("job-1");
        when(crawlJobService.awaitTermination("job-1", Duration.ofMillis(1000)))
            .thenReturn(CrawlJob.builder().id("job-1").status(JobStatus.COMPLETED).build());

        command.run(new DefaultApplicationArguments(
            "--url=https://mp.weixin.qq.com/s/a", "--strategy=history", "--max-articles=5", "--await-timeout-ms=1000"));

        verify(crawlJobService).awaitTermination("job-1", Duration.ofMillis(1000));
        verify(crawlJobService, never()).cancel(anyString());
    }

    @Test
    public void shouldCancelJobStillRunningAfterAwaitTimeout() throws Exception {
        when(crawlJobService.articles()).thenReturn(Flux.empty());
        when(crawlJobService.submit("https://mp.weixin.qq.com/s/a", StrategyType.SERIES, null)).thenReturn("job-2");
        when(crawlJobService.awaitTermination("job-2", Duration.ofMillis(10)))
            .thenReturn(CrawlJob.builder().id("job-2").status(JobStatus.RUNNING).build());
        when(crawlJobService.status("job-2"))
            .thenReturn(CrawlJob.builder().id("job-2").status(JobStatus.CANCELLED).build());

        command.run(new DefaultApplicationArguments("--url=https://mp.weixin.qq.com/s/a", "--await-timeout-ms=10"));

        verify(crawlJobService).cancel("job-2");
    }

    @Test
    public void shouldRejectUnknownStrategy() {
        assertThatThrownBy(() -> command.run(
            new DefaultApplicationArguments("--url=https://mp.weixin.qq.com/s/a", "--strategy=random")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown strategy");
    }

}
