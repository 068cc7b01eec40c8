package com.transitbot.utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock durations of named batch stages. A stage may be started and ended repeatedly;
 * its durations accumulate.
 */
public class StepTimer {
    public static final String LOAD = "LOAD";
    public static final String FIT = "FIT";
    public static final String MERGE = "MERGE";
    public static final String TOTAL = "TOTAL";

    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        start.put(step, System.currentTimeMillis());
    }

    public void end(String step) {
        Long s = start.remove(step);
        if (s != null) {
            durMs.merge(step, System.currentTimeMillis() - s, Long::sum);
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder("Timing:");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(' ').append(stepName(e.getKey())).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }

    private static String stepName(String step) {
        if (step == null) {
            return "";
        }
        switch (step) {
            case LOAD:
                return "load";
            case FIT:
                return "fit";
            case MERGE:
                return "merge";
            case TOTAL:
                return "total";
            default:
                return step;
        }
    }
}
