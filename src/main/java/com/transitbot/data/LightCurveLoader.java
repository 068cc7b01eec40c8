package com.transitbot.data;

import com.transitbot.model.LightCurve;

import java.nio.file.Path;

public interface LightCurveLoader {
    LightCurve load(Path file) throws LightCurveLoadException;
}
