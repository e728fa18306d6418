package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs scrape cycles: every platform in registry order, then aggregation, then
 * the history save. At most one cycle runs at a time; asking for another while
 * one is in flight just reports the running one.
 */
@Service
public class ScrapeCycleService {
  private static final Logger log = LoggerFactory.getLogger(ScrapeCycleService.class);

  private final PlatformRegistry registry;
  private final CrossPlatformAggregator aggregator;
  private final HistoryStore historyStore;
  private final PriceMetrics metrics;
  private final ScrapeState state;
  private final PacingDelay pacing;
  private final TicketDeskProperties cfg;
  private final Clock clock;
  private final Executor executor;

  public ScrapeCycleService(PlatformRegistry registry,
                            CrossPlatformAggregator aggregator,
                            HistoryStore historyStore,
                            PriceMetrics metrics,
                            ScrapeState state,
                            PacingDelay pacing,
                            TicketDeskProperties cfg,
                            Clock clock,
                            @Qualifier("scrapeExecutor") Executor executor) {
    this.registry = registry;
    this.aggregator = aggregator;
    this.historyStore = historyStore;
    this.metrics = metrics;
    this.state = state;
    this.pacing = pacing;
    this.cfg = cfg;
    this.clock = clock;
    this.executor = executor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void runOnStartup() {
    if (cfg.isRunOnStartup()) {
      log.info("App ready, running initial scrape for {} section {}", cfg.getEvent(), cfg.getSection());
      trigger("startup");
    } else {
      log.info("Scraper ready. Scheduled cron: {}", cfg.getCron());
    }
  }

  @Scheduled(cron = "${TICKETDESK_CRON:0 0 14 * * *}", zone = "UTC")
  public void scheduledScrape() {
    trigger("schedule");
  }

  /** Starts a cycle on the scrape executor unless one is already running. */
  public TriggerResult trigger(String reason) {
    Instant now = clock.instant();
    if (!state.tryStart(now)) {
      Instant since = state.snapshot().startedAt();
      log.info("Scrape requested ({}) while one is running since {}", reason, since);
      return TriggerResult.alreadyRunning(since);
    }

    log.info("Scrape started ({})", reason);
    try {
      executor.execute(this::runCycle);
    } catch (RejectedExecutionException e) {
      state.failed("scrape executor rejected the cycle: " + e.getMessage(), List.of());
      state.finish();
      throw e;
    }
    return TriggerResult.started(now);
  }

  /**
   * One full cycle. The caller must already hold the slot from
   * {@link ScrapeState#tryStart}; it is released on return.
   */
  Optional<HistoryDocument> runCycle() {
    Instant started = clock.instant();
    LocalDate today = LocalDate.ofInstant(started, ZoneOffset.UTC);
    Instant deadline = started.plus(Duration.ofSeconds(cfg.getCycleDeadlineSeconds()));

    Map<String, PlatformResult> active = new LinkedHashMap<>();
    List<StrategyAttempt> attempts = new ArrayList<>();
    try {
      List<PlatformScraper> scrapers = registry.scrapers();
      for (int i = 0; i < scrapers.size(); i++) {
        PlatformScraper scraper = scrapers.get(i);
        if (i > 0) pacing.pause();
        if (clock.instant().isAfter(deadline)) {
          log.warn("Cycle deadline of {}s passed, skipping {} remaining platform(s) from {}",
              cfg.getCycleDeadlineSeconds(), scrapers.size() - i, scraper.platform());
          break;
        }

        PlatformScrapeReport report = scraper.scrape(today);
        attempts.addAll(report.attempts());
        Optional<PlatformResult> result = report.resultIfActive();
        if (result.isPresent()) {
          active.put(scraper.platform(), result.get());
          metrics.recordPlatform(scraper.platform(), result.get());
        } else {
          metrics.markInactive(scraper.platform());
        }
      }
      log.info("Active platforms: {}", active.keySet());

      DailyRecord record = aggregator.aggregate(active, clock.instant());
      HistoryDocument doc = historyStore.save(record, meta(record.timestamp()));
      metrics.recordComposite(record);

      state.succeeded(clock.instant(), new ArrayList<>(active.keySet()), attempts);
      log.info("Scrape complete. crossMedian={}, crossFloor={}, inventory={}, spread={}%",
          record.crossMedian(), record.crossFloor(), record.totalInventory(), record.platformSpreadPct());
      return Optional.of(doc);

    } catch (NoActivePlatformsException e) {
      state.failed(e.getMessage(), attempts);
      log.error("Scrape failed: {}", e.getMessage());
      return Optional.empty();
    } catch (RuntimeException e) {
      state.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), attempts);
      log.error("Scrape failed: {}", e.getMessage(), e);
      return Optional.empty();
    } finally {
      state.finish();
    }
  }

  private HistoryMeta meta(Instant generated) {
    return new HistoryMeta(generated, cfg.getEvent(), cfg.getSection(), cfg.getRow(), cfg.getSeatType(),
        CrossPlatformAggregator.SOURCE, cfg.getService());
  }
}
