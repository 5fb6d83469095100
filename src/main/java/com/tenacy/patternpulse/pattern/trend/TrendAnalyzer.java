package com.tenacy.patternpulse.pattern.trend;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.PatternSeverity;
import com.tenacy.patternpulse.domain.PatternType;
import com.tenacy.patternpulse.domain.TrendDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 버킷 시계열로부터 추세 방향, 변화율, 가속 여부, 예측치를 계산한다.
 * 잘못된 입력에도 예외를 던지지 않는다.
 */
@Component
@RequiredArgsConstructor
public class TrendAnalyzer {

    public static final Duration BUCKET_SIZE = Duration.ofHours(1);

    private final PatternPulseProperties properties;

    /**
     * endBucket(포함)에서 끝나는 windowBuckets 개의 버킷을 만든다. 비어 있는 버킷은 0.
     */
    public List<TrendDataPoint> buildSeries(Map<LocalDateTime, Integer> buckets, LocalDateTime endBucket) {
        int size = Math.max(0, properties.getTrend().getWindowBuckets());

        List<TrendDataPoint> series = new ArrayList<>(size);
        LocalDateTime start = endBucket.minus(BUCKET_SIZE.multipliedBy(size - 1L));
        for (int i = 0; i < size; i++) {
            LocalDateTime bucketStart = start.plus(BUCKET_SIZE.multipliedBy(i));
            series.add(new TrendDataPoint(bucketStart, buckets.getOrDefault(bucketStart, 0)));
        }
        return series;
    }

    public PatternTrend analyze(List<TrendDataPoint> series) {
        PatternPulseProperties.Trend settings = properties.getTrend();
        double[] counts = series.stream().mapToDouble(TrendDataPoint::getCount).toArray();

        double slope = slope(counts);
        return PatternTrend.builder()
                .series(List.copyOf(series))
                .slope(slope)
                .direction(direction(slope, settings.getSlopeThreshold()))
                .changeRate(changeRate(counts))
                .accelerating(accelerating(counts, settings.getAccelerationMargin()))
                .forecast(forecast(counts, BUCKET_SIZE, settings.getForecastPeriod()))
                .build();
    }

    public PatternSeverity classifySeverity(double occurrenceRate, PatternTrend trend) {
        double slope = trend.getSlope();
        if (occurrenceRate > 10 || (slope > 0.5 && trend.isAccelerating())) {
            return PatternSeverity.CRITICAL;
        }
        if (occurrenceRate > 2 || slope > 0.2) {
            return PatternSeverity.HIGH;
        }
        if (occurrenceRate > 0.5 || slope > 0) {
            return PatternSeverity.MEDIUM;
        }
        return PatternSeverity.LOW;
    }

    // CYCLIC은 자동으로 부여하지 않는다
    public PatternType classifyType(boolean hasRelatedPatterns, PatternTrend trend, double timespanHours) {
        if (hasRelatedPatterns) {
            return PatternType.CORRELATED;
        }
        if (trend.getDirection() == TrendDirection.INCREASING) {
            return PatternType.TRENDING;
        }
        double persistentHours = properties.getTrend().getPersistentThreshold().toMillis() / 3_600_000.0;
        if (timespanHours >= persistentHours) {
            return PatternType.PERSISTENT;
        }
        return PatternType.TRANSIENT;
    }

    /** 최소제곱 기울기 (x = 버킷 인덱스) */
    static double slope(double[] counts) {
        int n = counts.length;
        if (n < 2) {
            return 0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double c : counts) {
            meanY += c;
        }
        meanY /= n;

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - meanX) * (counts[i] - meanY);
            denominator += (i - meanX) * (i - meanX);
        }
        double slope = denominator == 0 ? 0 : numerator / denominator;
        return Double.isFinite(slope) ? slope : 0;
    }

    static TrendDirection direction(double slope, double threshold) {
        if (slope > threshold) {
            return TrendDirection.INCREASING;
        }
        if (slope < -threshold) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    static double changeRate(double[] counts) {
        if (counts.length == 0) {
            return 0;
        }
        double first = counts[0];
        double last = counts[counts.length - 1];
        if (first == 0) {
            return last > 0 ? 100.0 : 0;
        }
        return (last - first) / first * 100.0;
    }

    static boolean accelerating(double[] counts, double margin) {
        int n = counts.length;
        if (n < 4) {
            return false;
        }
        int half = n / 2;
        double firstAvg = average(counts, 0, half);
        double secondAvg = average(counts, half, n);
        return secondAvg > firstAvg * (1 + margin);
    }

    static PatternForecast forecast(double[] counts, Duration bucketSize, Duration forecastPeriod) {
        int n = counts.length;
        double bucketHours = bucketSize.toMillis() / 3_600_000.0;
        double forecastHours = forecastPeriod.toMillis() / 3_600_000.0;
        if (n == 0 || bucketHours <= 0) {
            return new PatternForecast(0, 0, forecastHours);
        }
        long predicted = Math.round(counts[n - 1] / bucketHours * forecastHours);
        double confidence = 0.9 * n / (n + 6.0);
        return new PatternForecast(Math.max(0, predicted), confidence, forecastHours);
    }

    private static double average(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return to > from ? sum / (to - from) : 0;
    }
}
