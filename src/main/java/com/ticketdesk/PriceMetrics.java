package com.ticketdesk;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class PriceMetrics {
  static final String CROSS = "cross";

  private final MeterRegistry reg;
  private final TicketDeskProperties cfg;
  private final Map<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

  public PriceMetrics(MeterRegistry reg, TicketDeskProperties cfg) {
    this.reg = reg;
    this.cfg = cfg;
  }

  private AtomicReference<Double> gauge(String name, String source) {
    return gauges.computeIfAbsent(name + "|" + source, k -> {
      AtomicReference<Double> ref = new AtomicReference<>(Double.NaN);
      Gauge.builder(name, ref, r -> {
        Double v = r.get();
        return v == null ? Double.NaN : v.doubleValue();
      })
        .description("Ticket price metric")
        .tag("event", cfg.getEvent())
        .tag("section", cfg.getSection())
        .tag("source", source)
        .register(reg);
      return ref;
    });
  }

  public void recordPlatform(String platform, PlatformResult r) {
    gauge("ticket_floor_price", platform).set((double) r.floor());
    gauge("ticket_median_price", platform).set((double) r.median());
    gauge("ticket_inventory", platform).set((double) r.sampleCount());
  }

  // a platform that went dark should not keep reporting yesterday's numbers
  public void markInactive(String platform) {
    gauge("ticket_floor_price", platform).set(Double.NaN);
    gauge("ticket_median_price", platform).set(Double.NaN);
    gauge("ticket_inventory", platform).set(Double.NaN);
  }

  public void recordComposite(DailyRecord r) {
    gauge("ticket_floor_price", CROSS).set((double) r.crossFloor());
    gauge("ticket_median_price", CROSS).set((double) r.crossMedian());
    gauge("ticket_inventory", CROSS).set((double) r.totalInventory());
    gauge("ticket_platform_spread_pct", CROSS).set(r.platformSpreadPct());
  }

  Double current(String name, String source) {
    AtomicReference<Double> ref = gauges.get(name + "|" + source);
    return ref == null ? null : ref.get();
  }
}
