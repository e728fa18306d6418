package com.ticketdesk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Shape of the persisted data file, which the dashboard reads as is. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryDocument(HistoryMeta meta, DailyRecord today, Trends trends, List<DailyRecord> history) {}
