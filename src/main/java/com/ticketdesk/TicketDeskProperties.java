package com.ticketdesk;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class TicketDeskProperties {

    @Value("${SCRAPE_TOKEN:changeme}")
    private String scrapeToken;

    @Value("${PRICE_MIN:200}")
    private double priceMin;

    @Value("${PRICE_MAX:20000}")
    private double priceMax;

    // politeness delay between platforms, not needed for correctness
    @Value("${PACING_MIN_MS:2000}")
    private long pacingMinMs;

    @Value("${PACING_MAX_MS:6000}")
    private long pacingMaxMs;

    @Value("${FETCH_TIMEOUT_SECONDS:25}")
    private long fetchTimeoutSeconds;

    @Value("${CYCLE_DEADLINE_SECONDS:300}")
    private long cycleDeadlineSeconds;

    // Cron with seconds (default: daily 14:00 UTC)
    @Value("${TICKETDESK_CRON:0 0 14 * * *}")
    private String cron;

    @Value("${TICKETDESK_RUN_ON_STARTUP:false}")
    private boolean runOnStartup;

    @Value("${TICKETDESK_DATA_FILE:ticket_data.json}")
    private String dataFile;

    @Value("${TICKETDESK_RELAY_FILE:relay_data.json}")
    private String relayFile;

    @Value("${TICKETDESK_EVENT:Bruce Springsteen · MSG · May 11, 2026}")
    private String event;

    @Value("${TICKETDESK_SECTION:224}")
    private String section;

    @Value("${TICKETDESK_ROW:17}")
    private String row;

    @Value("${TICKETDESK_SEAT_TYPE:Aisle}")
    private String seatType;

    @Value("${TICKETDESK_SERVICE:Ticket Desk v1.0}")
    private String service;

    public String getScrapeToken() { return scrapeToken; }
    public PriceBounds priceBounds() { return new PriceBounds(priceMin, priceMax); }
    public long getPacingMinMs()  { return pacingMinMs; }
    public long getPacingMaxMs()  { return pacingMaxMs; }
    public long getFetchTimeoutSeconds() { return fetchTimeoutSeconds; }
    public long getCycleDeadlineSeconds() { return cycleDeadlineSeconds; }
    public String getCron() { return cron; }
    public boolean isRunOnStartup() { return runOnStartup; }
    public String getDataFile()  { return dataFile; }
    public String getRelayFile() { return relayFile; }

    public String getEvent()    { return event; }
    public String getSection()  { return section; }
    public String getRow()      { return row; }
    public String getSeatType() { return seatType; }
    public String getService()  { return service; }
}
