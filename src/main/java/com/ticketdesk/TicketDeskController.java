package com.ticketdesk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
public class TicketDeskController {
  private static final Logger log = LoggerFactory.getLogger(TicketDeskController.class);

  private final ScrapeCycleService cycles;
  private final ScrapeState state;
  private final HistoryStore historyStore;
  private final RelayStore relayStore;
  private final RelayIngestor relayIngestor;
  private final TicketDeskProperties cfg;
  private final Clock clock;

  public TicketDeskController(ScrapeCycleService cycles, ScrapeState state, HistoryStore historyStore,
                              RelayStore relayStore, RelayIngestor relayIngestor,
                              TicketDeskProperties cfg, Clock clock) {
    this.cycles = cycles;
    this.state = state;
    this.historyStore = historyStore;
    this.relayStore = relayStore;
    this.relayIngestor = relayIngestor;
    this.cfg = cfg;
    this.clock = clock;
  }

  @GetMapping("/")
  public Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", cfg.getService());
    body.put("event", cfg.getEvent());
    body.put("section", cfg.getSection());
    body.put("endpoints", List.of("/status", "/scrape?token=XXX", "/data", "/relay"));
    body.put("status", "ok");
    return body;
  }

  @GetMapping("/status")
  public ResponseEntity<Map<String, Object>> status() {
    ScrapeStatus s = state.snapshot();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", cfg.getService());
    body.put("running", s.running());
    body.put("lastSuccess", s.lastSuccess());
    body.put("lastError", s.lastError());
    body.put("startedAt", s.startedAt());
    body.put("lastActivePlatforms", s.lastActivePlatforms());
    body.put("lastAttempts", s.lastAttempts());
    try {
      body.put("relay", relayStore.freshness(today()));
    } catch (RelayStoreException e) {
      log.warn("Relay cache unreadable for status: {}", e.getMessage());
      body.put("relay", Map.of("error", e.getMessage()));
    }
    return ResponseEntity.ok(body);
  }

  @RequestMapping(value = "/scrape", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Map<String, Object>> scrape(@RequestParam(defaultValue = "") String token) {
    if (!tokenMatches(token)) {
      return ResponseEntity.status(401).body(Map.<String, Object>of("error", "unauthorized"));
    }
    TriggerResult result = cycles.trigger("manual");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", result.status());
    body.put("startedAt", result.startedAt());
    return ResponseEntity.ok(body);
  }

  @GetMapping(value = "/data", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> data() {
    return historyStore.readRaw()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.status(404)
            .body("{\"error\":\"no data yet, trigger /scrape first\"}"));
  }

  @GetMapping("/relay")
  public Map<String, RelayEntry> relayEntries() {
    return relayStore.readAll();
  }

  @PostMapping("/relay")
  public ResponseEntity<?> relay(@RequestParam(required = false) String token,
                                 @RequestHeader(value = "X-Relay-Token", required = false) String headerToken,
                                 @RequestBody(required = false) RelaySubmission submission) {
    if (!tokenMatches(headerToken != null ? headerToken : token)) {
      return ResponseEntity.status(401).body(Map.<String, Object>of("error", "unauthorized"));
    }
    try {
      RelayEntry entry = relayIngestor.submit(submission);
      return ResponseEntity.ok(Map.of("status", "ok", "entry", entry));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    } catch (RelayStoreException e) {
      log.error("Relay submission could not be stored: {}", e.getMessage(), e);
      return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
    }
  }

  private boolean tokenMatches(String supplied) {
    if (supplied == null) return false;
    return MessageDigest.isEqual(
        supplied.getBytes(StandardCharsets.UTF_8),
        cfg.getScrapeToken().getBytes(StandardCharsets.UTF_8));
  }

  private LocalDate today() {
    return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
  }
}
