package com.transitbot.data;

import com.transitbot.model.DataType;
import com.transitbot.model.LightCurve;
import com.transitbot.model.PhysicalParams;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Reads light-curve CSV files: a block of {@code Key: value} header lines followed by a
 * {@code Tiempo [BJDS],Flujo} data section.
 */
public final class CsvLightCurveLoader implements LightCurveLoader {
    private static final Logger LOG = LogManager.getLogger(CsvLightCurveLoader.class);

    static final String DATA_HEADER = "Tiempo [BJDS],Flujo";
    static final String DATA_HEADER_TAB = "Tiempo [BJDS]\tFlujo";
    private static final String DATA_HEADER_PREFIX = "Tiempo [BJDS]";
    private static final int TYPE_SCAN_LINES = 40;

    private static final Set<String> TEXT_FIELDS = Set.of("Type", "Planet Name");
    private static final Map<String, Field> SIMULATED_FIELDS = simulatedFields();
    private static final Map<String, Field> REAL_FIELDS = realFields();

    @Override
    public LightCurve load(Path file) throws LightCurveLoadException {
        List<String> lines = readLines(file);
        int dataStart = findDataStart(lines);
        if (dataStart < 0) {
            throw new LightCurveLoadException("No data header ('" + DATA_HEADER + "') found in '" + file + "'");
        }

        DataType dataType = detectType(lines);
        boolean simulated = dataType == DataType.SIMULATED;
        PhysicalParams params = parseHeader(lines, file, simulated ? SIMULATED_FIELDS : REAL_FIELDS, !simulated);

        double[][] columns = parseData(lines.subList(dataStart, lines.size()), file);
        return new LightCurve(
                file.getFileName().toString(),
                columns[0],
                columns[1],
                params,
                simulated ? DataType.SIMULATED : DataType.REAL
        );
    }

    static DataType detectType(List<String> lines) {
        int limit = Math.min(TYPE_SCAN_LINES, lines.size());
        for (int i = 0; i < limit; i++) {
            String cleaned = clean(lines.get(i));
            int colon = cleaned.indexOf(':');
            if (colon < 0) {
                continue;
            }
            if (!cleaned.substring(0, colon).trim().equals("Type")) {
                continue;
            }
            String value = stripQuotes(cleaned.substring(colon + 1).trim()).toLowerCase(Locale.ROOT);
            if (value.contains("simulacion")) {
                return DataType.SIMULATED;
            }
            if (value.contains("real")) {
                return DataType.REAL;
            }
        }
        return null;
    }

    private List<String> readLines(Path file) throws LightCurveLoadException {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            LOG.warn("UTF-8 decode error in '{}', trying latin-1", file);
        } catch (IOException e) {
            throw new LightCurveLoadException("Could not read file '" + file + "': " + e.getMessage(), e);
        }
        try {
            return Files.readAllLines(file, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new LightCurveLoadException("Could not read file '" + file + "': " + e.getMessage(), e);
        }
    }

    private static int findDataStart(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String cleaned = clean(lines.get(i));
            if (cleaned.contains(DATA_HEADER) || cleaned.contains(DATA_HEADER_TAB)) {
                return i + 1;
            }
        }
        return -1;
    }

    private PhysicalParams parseHeader(List<String> lines, Path file, Map<String, Field> fields, boolean firstToken) {
        PhysicalParams.PhysicalParamsBuilder builder = PhysicalParams.builder();
        for (String line : lines) {
            String cleaned = clean(line);
            if (cleaned.contains(DATA_HEADER_PREFIX)) {
                break;
            }
            int colon = cleaned.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = cleaned.substring(0, colon).trim();
            String raw = stripQuotes(cleaned.substring(colon + 1).trim());

            Map.Entry<String, Field> match = findField(key, fields);
            if (match == null) {
                continue;
            }
            boolean numeric = !TEXT_FIELDS.contains(match.getKey());
            try {
                match.getValue().apply(builder, firstToken && numeric ? firstToken(raw) : raw);
            } catch (NumberFormatException e) {
                LOG.warn("Could not convert '{}': '{}' in '{}'", key, raw, file);
            }
        }
        return builder.build();
    }

    private static Map.Entry<String, Field> findField(String key, Map<String, Field> fields) {
        for (Map.Entry<String, Field> entry : fields.entrySet()) {
            if (key.contains(entry.getKey())) {
                return entry;
            }
        }
        return null;
    }

    private static double[][] parseData(List<String> dataLines, Path file) throws LightCurveLoadException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setCommentMarker('#')
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<double[]> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(String.join("\n", dataLines)), format)) {
            for (CSVRecord record : parser) {
                if (record.size() < 2) {
                    throw new LightCurveLoadException("Error loading data from '" + file
                            + "': expected 2 columns at line " + record.getRecordNumber());
                }
                rows.add(new double[]{Double.parseDouble(record.get(0)), Double.parseDouble(record.get(1))});
            }
        } catch (IOException | UncheckedIOException | NumberFormatException | IllegalStateException e) {
            throw new LightCurveLoadException("Error loading data from '" + file + "': " + e.getMessage(), e);
        }

        double[] time = new double[rows.size()];
        double[] flux = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            time[i] = rows.get(i)[0];
            flux[i] = rows.get(i)[1];
        }
        return new double[][]{time, flux};
    }

    private static String clean(String line) {
        return stripQuotes(line == null ? "" : line.trim());
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    private static String firstToken(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.split("\\s+")[0];
    }

    private static double number(String raw) {
        return Double.parseDouble(raw.trim());
    }

    private static int integer(String raw) {
        return Integer.parseInt(raw.trim());
    }

    private static Map<String, Field> simulatedFields() {
        Map<String, Field> fields = new LinkedHashMap<>();
        fields.put("Orbit Period (days)", (b, v) -> b.period(number(v)));
        fields.put("Transit Epoch (BJD)", (b, v) -> b.epoch(number(v)));
        fields.put("Calculated Transit Duration (days)", (b, v) -> b.duration(number(v)));
        fields.put("Star Radius (R_star/R_solar)", (b, v) -> b.starRadius(number(v)));
        fields.put("Planet Radius (R_planet/R_star)", (b, v) -> b.radiusRatio(number(v)));
        fields.put("Planet Semi-major Axis (a/R_star)", (b, v) -> b.axisRatio(number(v)));
        fields.put("Limb Darkening Coeff (u1)", (b, v) -> b.u1(number(v)));
        fields.put("Limb Darkening Coeff (u2)", (b, v) -> b.u2(number(v)));
        fields.put("Planet Inclination (deg)", (b, v) -> b.inclination(number(v)));
        fields.put("Orbital Eccentricity", (b, v) -> b.eccentricity(number(v)));
        fields.put("Longitude of Periastron (deg)", (b, v) -> b.periastron(number(v)));
        fields.put("Exposure Time (days)", (b, v) -> b.exposureTime(number(v)));
        fields.put("Supersample Factor", (b, v) -> b.supersampleFactor(integer(v)));
        fields.put("Noise Sigma", (b, v) -> b.noiseSigma(number(v)));
        fields.put("Type", PhysicalParams.PhysicalParamsBuilder::dataTypeLabel);
        return fields;
    }

    private static Map<String, Field> realFields() {
        Map<String, Field> fields = new LinkedHashMap<>();
        fields.put("Orbit Period (days)", (b, v) -> b.period(number(v)));
        fields.put("Transit Duration (days)", (b, v) -> b.duration(number(v)));
        fields.put("Transit Epoch (BJD)", (b, v) -> b.epoch(number(v)));
        fields.put("Star Radius (R_star/R_solar)", (b, v) -> b.starRadius(number(v)));
        fields.put("Planet Radius (R_planet/R_star)", (b, v) -> b.radiusRatio(number(v)));
        fields.put("Semi-major Axis (a/R_star)", (b, v) -> b.axisRatio(number(v)));
        fields.put("Limb Darkening Coefficient u1", (b, v) -> b.u1(number(v)));
        fields.put("Limb Darkening Coefficient u2", (b, v) -> b.u2(number(v)));
        fields.put("Orbital Inclination (deg)", (b, v) -> b.inclination(number(v)));
        fields.put("Type", PhysicalParams.PhysicalParamsBuilder::dataTypeLabel);
        fields.put("Planet Name", PhysicalParams.PhysicalParamsBuilder::objectName);
        fields.put("Star Teff (K)", (b, v) -> b.starTeff(number(v)));
        fields.put("Star logg", (b, v) -> b.starLogg(number(v)));
        fields.put("Orbital Eccentricity", (b, v) -> b.eccentricity(number(v)));
        fields.put("Longitude of Periastron (deg)", (b, v) -> b.periastron(number(v)));
        fields.put("Exposure Time (days)", (b, v) -> b.exposureTime(number(v)));
        fields.put("Supersample Factor", (b, v) -> b.supersampleFactor(integer(v)));
        return fields;
    }

    @FunctionalInterface
    private interface Field extends BiConsumer<PhysicalParams.PhysicalParamsBuilder, String> {
        default void apply(PhysicalParams.PhysicalParamsBuilder builder, String value) {
            accept(builder, value);
        }
    }
}
