package com.resumeai.infrastructure.ai;

import com.resumeai.domain.rewrite.model.RewriteType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Sampling temperature per content type. Each rejected attempt lowers the temperature
 * by a fixed step down to the type's floor.
 */
@Component
public class TemperatureSchedule {

    private static final double RETRY_STEP = 0.1;

    private static final Map<RewriteType, Range> RANGES = new EnumMap<>(Map.of(
            RewriteType.BULLET, new Range(0.3, 0.1, 0.5),
            RewriteType.SUMMARY, new Range(0.5, 0.2, 0.7),
            RewriteType.SECTION, new Range(0.4, 0.15, 0.6)
    ));

    public double getTemperatureForType(RewriteType type) {
        return RANGES.get(type).base();
    }

    /**
     * @param attempt zero-based attempt index
     */
    public double getTemperatureForAttempt(RewriteType type, int attempt) {
        Range range = RANGES.get(type);
        if (attempt <= 0) {
            return range.base();
        }
        double adjusted = range.base() - attempt * RETRY_STEP;
        // 0.3 - 0.1 * 2 is not 0.1 in floating point
        return Math.max(Math.round(adjusted * 100) / 100.0, range.min());
    }

    public double clampTemperature(RewriteType type, double temperature) {
        Range range = RANGES.get(type);
        return Math.max(range.min(), Math.min(temperature, range.max()));
    }

    private record Range(double base, double min, double max) {}
}
