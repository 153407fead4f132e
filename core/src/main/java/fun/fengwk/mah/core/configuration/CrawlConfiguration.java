package fun.fengwk.mah.core.configuration;

import fun.fengwk.mah.core.service.crawl.CrawlProperties;
import fun.fengwk.mah.core.service.crawl.RetryBackoff;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;

/**
 * @author fengwk
 */
@Configuration
public class CrawlConfiguration {

    @Bean(name = "crawlExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService crawlExecutor(CrawlProperties crawlProperties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("mah-crawl-");
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
            Math.max(1, crawlProperties.getWorkerPoolSize()), threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public RetryBackoff retryBackoff(CrawlProperties crawlProperties) {
        return new RetryBackoff(
            crawlProperties.getBackoffBaseMs(),
            crawlProperties.getBackoffMaxMs(),
            crawlProperties.getBackoffJitter(),
            () -> ThreadLocalRandom.current().nextDouble()
        );
    }

}
