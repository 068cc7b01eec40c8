package com.transitbot.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the diagnostic figure for one transit window.
 */
public interface TransitPlotRenderer {
    void render(TransitPlot plot, Path output) throws IOException;
}
