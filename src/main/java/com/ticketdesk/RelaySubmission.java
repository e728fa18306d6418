package com.ticketdesk;

/** Body of a relay POST. Boxed so a missing field can be told apart from zero. */
public record RelaySubmission(String platform, Double floor, Double median, Integer sampleCount) {}
