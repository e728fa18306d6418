package com.ticketdesk;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The daily time series behind the dashboard. One record per UTC date; a
 * second save on the same date replaces the first. Each save rewrites the
 * whole document (meta, latest record, trends, history) in one atomic step.
 */
@Component
public class HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    static final int WINDOW = 7;

    private final JsonFile file;
    private final JavaType recordListType;

    @Autowired
    public HistoryStore(ObjectMapper objectMapper, TicketDeskProperties props) {
        this(objectMapper, Path.of(props.getDataFile()));
    }

    HistoryStore(ObjectMapper objectMapper, Path path) {
        this.file = new JsonFile(path, objectMapper);
        this.recordListType = file.mapper().getTypeFactory()
                .constructCollectionType(List.class, DailyRecord.class);
    }

    /**
     * Upserts {@code today} into the stored history and writes the new document.
     * An unreadable existing file aborts the save and is left as it was.
     */
    public HistoryDocument save(DailyRecord today, HistoryMeta meta) {
        try {
            return file.locked(() -> {
                List<DailyRecord> history = upsert(readHistory(), today);
                Trends trends = computeTrends(history);
                HistoryDocument doc = new HistoryDocument(meta, today, trends, history);
                file.write(doc);
                log.info("Saved {} ({} days of history)", file.path(), history.size());
                return doc;
            });
        } catch (IOException e) {
            throw new HistoryStoreException("cannot update " + file.path() + ": " + e.getMessage(), e);
        }
    }

    public List<DailyRecord> loadHistory() {
        try {
            return readHistory();
        } catch (IOException e) {
            throw new HistoryStoreException("cannot read " + file.path() + ": " + e.getMessage(), e);
        }
    }

    /** The persisted document exactly as written, for the data endpoint. */
    public Optional<String> readRaw() {
        try {
            return file.readRaw();
        } catch (IOException e) {
            throw new HistoryStoreException("cannot read " + file.path() + ": " + e.getMessage(), e);
        }
    }

    private List<DailyRecord> readHistory() throws IOException {
        Optional<JsonNode> root = file.read(file.mapper().getTypeFactory().constructType(JsonNode.class));
        if (root.isEmpty()) return new ArrayList<>();
        JsonNode history = root.get().get("history");
        if (history == null || history.isNull()) return new ArrayList<>();
        List<DailyRecord> records = file.mapper().readerFor(recordListType).readValue(history);
        return new ArrayList<>(records);
    }

    // ── Pure history operations ─────────────────────────────────────────────

    /** Drops any record with the same date, appends, and re-sorts by date. */
    public static List<DailyRecord> upsert(List<DailyRecord> history, DailyRecord record) {
        List<DailyRecord> out = new ArrayList<>(history.size() + 1);
        for (DailyRecord h : history) {
            if (!h.date().equals(record.date())) out.add(h);
        }
        out.add(record);
        out.sort(Comparator.comparing(DailyRecord::date));
        return out;
    }

    /** Expects {@code history} sorted ascending by date, as {@link #upsert} leaves it. */
    public static Trends computeTrends(List<DailyRecord> history) {
        int n = history.size();
        double medianSlope = 0;
        double floorAccel = 0;
        Double inventoryWow = null;
        Integer priorInventory = null;

        if (n >= 2) {
            DailyRecord latest = history.get(n - 1);
            DailyRecord previous = history.get(n - 2);
            medianSlope = PriceStatistics.round1((latest.crossMedian() - previous.crossMedian()) / 7.0);
            floorAccel = PriceStatistics.round1(latest.crossFloor() - previous.crossFloor());
            priorInventory = previous.totalInventory();
            if (previous.totalInventory() != 0) {
                inventoryWow = PriceStatistics.round1(
                        (latest.totalInventory() - previous.totalInventory()) * 100.0 / previous.totalInventory());
            }
        }

        List<DailyRecord> window = history.subList(Math.max(0, n - WINDOW), n);
        List<Long> medians = new ArrayList<>();
        List<Long> floors = new ArrayList<>();
        List<Integer> inventory = new ArrayList<>();
        for (DailyRecord r : window) {
            medians.add(r.crossMedian());
            floors.add(r.crossFloor());
            inventory.add(r.totalInventory());
        }
        return new Trends(medianSlope, floorAccel, inventoryWow, priorInventory, medians, floors, inventory);
    }
}
