package fun.fengwk.mah.core.cli;

import fun.fengwk.mah.core.service.crawl.CrawlJobService;
import fun.fengwk.mah.core.service.crawl.model.CrawlJob;
import fun.fengwk.mah.core.service.discovery.model.StrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;

/**
 * One-shot harvest command runner.
 *
 * <p>Usage: {@code --url=<seed> [--strategy=series|history|discover] [--max-articles=N] [--await-timeout-ms=N]}.
 * Does nothing when {@code --url} is absent, so the application can also be embedded without running a job.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HarvestCommand implements ApplicationRunner {

    private static final long DEFAULT_AWAIT_TIMEOUT_MS = 7_200_000L;

    private final CrawlJobService crawlJobService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String url = option(args, "url");
        if (url == null) {
            return;
        }
        StrategyType strategy = StrategyType.fromValue(optionOrDefault(args, "strategy", StrategyType.SERIES.value()));
        String maxArticlesOption = option(args, "max-articles");
        Integer maxArticles = maxArticlesOption == null ? null : Integer.valueOf(maxArticlesOption);
        long awaitTimeoutMs = Long.parseLong(
            optionOrDefault(args, "await-timeout-ms", String.valueOf(DEFAULT_AWAIT_TIMEOUT_MS)));

        Disposable subscription = crawlJobService.articles()
            .subscribe(event -> log.info("harvested article, jobId={}, title={}, url={}, publishTime={}",
                event.jobId(), event.record().getTitle(), event.record().getUrl(), event.record().getPublishTime()));
        try {
            String jobId = crawlJobService.submit(url, strategy, maxArticles);
            CrawlJob job = crawlJobService.awaitTermination(jobId, Duration.ofMillis(awaitTimeoutMs));
            if (!job.getStatus().isTerminal()) {
                log.warn("harvest still running after await timeout, cancelling, jobId={}, timeoutMs={}",
                    jobId, awaitTimeoutMs);
                crawlJobService.cancel(jobId);
                job = crawlJobService.status(jobId);
            }
            log.info("harvest finished, jobId={}, status={}, found={}, failed={}, skipped={}, summary={}",
                job.getId(), job.getStatus(), job.getArticlesFound(), job.getArticlesFailed(),
                job.getArticlesSkipped(), job.getErrorSummary());
            for (String error : job.getRecentErrors()) {
                log.info("harvest error, jobId={}, error={}", job.getId(), error);
            }
        } finally {
            subscription.dispose();
        }
    }

    private String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private String optionOrDefault(ApplicationArguments args, String name, String defaultValue) {
        String value = option(args, name);
        return value == null ? defaultValue : value;
    }

}
