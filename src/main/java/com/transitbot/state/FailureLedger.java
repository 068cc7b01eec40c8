package com.transitbot.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Persistent memory of transits that failed to fit, keyed by light-curve file name.
 * Entries are only ever added.
 */
public class FailureLedger {
    private static final Logger LOG = LogManager.getLogger(FailureLedger.class);

    private final Map<String, SortedSet<Integer>> failed = new TreeMap<>();

    /**
     * Reads the ledger at {@code path}. A missing or unreadable file yields an empty ledger.
     */
    public static FailureLedger load(Path path) {
        FailureLedger ledger = new FailureLedger();
        if (path == null || !Files.exists(path)) {
            return ledger;
        }
        try {
            JSONObject o = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
            for (String file : o.keySet()) {
                JSONArray arr = o.optJSONArray(file);
                if (arr == null) {
                    continue;
                }
                SortedSet<Integer> indices = ledger.failed.computeIfAbsent(file, k -> new TreeSet<>());
                for (int i = 0; i < arr.length(); i++) {
                    int index = arr.optInt(i, -1);
                    if (index > 0) {
                        indices.add(index);
                    }
                }
            }
        } catch (IOException | JSONException e) {
            LOG.warn("Could not read failure ledger {}, starting empty: {}", path, e.getMessage());
            ledger.failed.clear();
        }
        return ledger;
    }

    public Set<Integer> failedFor(String file) {
        SortedSet<Integer> indices = failed.get(file);
        return indices == null ? Set.of() : Collections.unmodifiableSet(indices);
    }

    /**
     * Adds the given indices to the file's entry.
     *
     * @return true if at least one index was new
     */
    public boolean markFailed(String file, Collection<Integer> indices) {
        if (indices == null || indices.isEmpty()) {
            return false;
        }
        return failed.computeIfAbsent(file, k -> new TreeSet<>()).addAll(indices);
    }

    public void save(Path path) throws IOException {
        JSONObject o = new JSONObject();
        for (Map.Entry<String, SortedSet<Integer>> e : failed.entrySet()) {
            o.put(e.getKey(), new JSONArray(e.getValue()));
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, o.toString(2), StandardCharsets.UTF_8);
    }
}
