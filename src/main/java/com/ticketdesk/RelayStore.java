package com.ticketdesk;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Relay submissions on disk, one entry per platform. */
@Component
public class RelayStore {
    private static final Logger log = LoggerFactory.getLogger(RelayStore.class);

    private final JsonFile file;
    private final JavaType mapType;

    @Autowired
    public RelayStore(ObjectMapper objectMapper, TicketDeskProperties props) {
        this(objectMapper, Path.of(props.getRelayFile()));
    }

    RelayStore(ObjectMapper objectMapper, Path path) {
        this.file = new JsonFile(path, objectMapper);
        this.mapType = file.mapper().getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, RelayEntry.class);
    }

    public Map<String, RelayEntry> readAll() {
        try {
            return Collections.unmodifiableMap(load());
        } catch (IOException e) {
            throw new RelayStoreException("cannot read " + file.path(), e);
        }
    }

    /** The platform's entry only if it was submitted on {@code today}; older ones are stale. */
    public Optional<RelayEntry> findFresh(String platform, LocalDate today) {
        RelayEntry entry = readAll().get(platform);
        if (entry == null) return Optional.empty();
        if (!entry.isFor(today)) {
            log.debug("Relay entry for {} is from {}, ignoring on {}", platform, entry.date(), today);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Stores the entry, replacing whatever the platform had.
     *
     * @return the replaced entry, if any
     */
    public Optional<RelayEntry> put(RelayEntry entry) {
        try {
            return file.locked(() -> {
                Map<String, RelayEntry> all = load();
                RelayEntry previous = all.put(entry.platform(), entry);
                file.write(all);
                return Optional.ofNullable(previous);
            });
        } catch (IOException e) {
            throw new RelayStoreException("cannot update " + file.path(), e);
        }
    }

    public Map<String, RelayFreshness> freshness(LocalDate today) {
        Map<String, RelayFreshness> out = new LinkedHashMap<>();
        readAll().forEach((platform, e) -> out.put(platform,
                new RelayFreshness(e.date(), e.timestamp(), e.isFor(today), e.floor(), e.median())));
        return out;
    }

    private Map<String, RelayEntry> load() throws IOException {
        Optional<Map<String, RelayEntry>> stored = file.read(mapType);
        return stored.isPresent() ? new LinkedHashMap<>(stored.get()) : new LinkedHashMap<>();
    }
}
