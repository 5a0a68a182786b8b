package com.streamfirst.worklog.boot;

import com.streamfirst.worklog.adapters.InMemoryCandidateAdapter;
import com.streamfirst.worklog.adapters.InMemoryEventSourceAdapter;
import com.streamfirst.worklog.adapters.InMemoryExternalRecordAdapter;
import com.streamfirst.worklog.adapters.InMemoryTextRecordAdapter;
import com.streamfirst.worklog.adapters.JsonFileLedgerStore;
import com.streamfirst.worklog.application.CommitSyncJob;
import com.streamfirst.worklog.application.ReconciliationEngine;
import com.streamfirst.worklog.application.SyncLedger;
import com.streamfirst.worklog.application.WorkSessionCalculator;
import com.streamfirst.worklog.application.matching.WorkItemLinkingService;
import com.streamfirst.worklog.application.matching.WorkItemMatcher;
import com.streamfirst.worklog.domain.ReconciliationReport;
import com.streamfirst.worklog.domain.TimeWindow;
import com.streamfirst.worklog.ports.CandidatePort;
import com.streamfirst.worklog.ports.EventSourcePort;
import com.streamfirst.worklog.ports.ExternalRecordPort;
import com.streamfirst.worklog.ports.LedgerStorePort;
import com.streamfirst.worklog.ports.TextRecordPort;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the sync pipeline. The collaborator adapters are in-memory; the ledger is the JSON file
 * named by {@code worklog.ledger.file}.
 */
@Slf4j
@Configuration
public class WorklogAppConfiguration {

  // --- Adapter beans ---

  @Bean
  public EventSourcePort eventSource() {
    log.info("Creating event source (in-memory)");
    return new InMemoryEventSourceAdapter();
  }

  @Bean
  public ExternalRecordPort externalRecords() {
    log.info("Creating time entry store (in-memory)");
    return new InMemoryExternalRecordAdapter();
  }

  @Bean
  public TextRecordPort textRecords() {
    return new InMemoryTextRecordAdapter();
  }

  @Bean
  public CandidatePort workItems() {
    return new InMemoryCandidateAdapter();
  }

  @Bean
  public LedgerStorePort ledgerStore(WorklogProperties properties) {
    log.info("Using ledger file {}", properties.ledger().file().toAbsolutePath());
    return new JsonFileLedgerStore(properties.ledger().file());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // --- Application service beans ---

  @Bean
  public SyncLedger syncLedger(LedgerStorePort ledgerStore) {
    return new SyncLedger(ledgerStore);
  }

  @Bean
  public WorkSessionCalculator workSessionCalculator(WorklogProperties properties) {
    return new WorkSessionCalculator(properties.sessionSettings());
  }

  @Bean
  public ReconciliationEngine reconciliationEngine(
      WorkSessionCalculator calculator,
      SyncLedger ledger,
      ExternalRecordPort externalRecords,
      WorklogProperties properties) {
    return new ReconciliationEngine(calculator, ledger, externalRecords, properties.reconciliationSettings());
  }

  @Bean
  public WorkItemLinkingService workItemLinkingService(
      TextRecordPort textRecords, CandidatePort workItems, WorklogProperties properties) {
    return new WorkItemLinkingService(
        textRecords, workItems, new WorkItemMatcher(properties.matching().mode()));
  }

  @Bean(destroyMethod = "shutdown")
  public ScheduledExecutorService syncScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "worklog-sync");
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean(destroyMethod = "stop")
  public CommitSyncJob commitSyncJob(
      EventSourcePort eventSource,
      ReconciliationEngine engine,
      SyncLedger ledger,
      WorklogProperties properties,
      Clock clock) {
    return new CommitSyncJob(
        eventSource,
        engine,
        ledger,
        properties.trackingSettings(),
        properties.sessionSettings().zone(),
        clock);
  }

  // --- Startup ---

  @Bean
  public CommandLineRunner startSync(
      CommitSyncJob job,
      WorkItemLinkingService linking,
      ScheduledExecutorService syncScheduler,
      WorklogProperties properties,
      Clock clock) {
    return args -> {
      log.info(
          "Starting worklog sync for {} repositories",
          properties.trackingSettings().scopes().size());

      ReconciliationReport catchUp = job.runHistorical();
      log.info(
          "Catch-up finished: {} created, {} updated, {} failed",
          catchUp.getCreated(),
          catchUp.getUpdated(),
          catchUp.getFailed());

      var linked =
          linking.link(
              TimeWindow.lastDays(
                  properties.trackingSettings().historyDays(), properties.sessionSettings().zone(), clock));
      log.info(
          "Work item linking: {} of {} entries matched",
          linked.statistics().matchedEntries(),
          linked.statistics().totalEntries());

      if (properties.tracking().scheduleEnabled()) {
        job.start(syncScheduler);
      }
    };
  }
}
