package com.tenacy.patternpulse.pattern.trend;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 같은 구간에 정렬된 두 발생 시계열의 피어슨 상관계수.
 */
@Component
@RequiredArgsConstructor
public class CorrelationAnalyzer {

    private final PatternPulseProperties properties;

    public boolean isCorrelated(List<TrendDataPoint> a, List<TrendDataPoint> b) {
        return pearson(toCounts(a), toCounts(b)) > properties.getTrend().getCorrelationThreshold();
    }

    /**
     * 길이가 다르거나 2 미만이거나 분산이 0이면 0을 돌려준다.
     */
    public static double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n != y.length || n < 2) {
            return 0;
        }

        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double covariance = 0;
        double varianceX = 0;
        double varianceY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }
        if (varianceX == 0 || varianceY == 0) {
            return 0;
        }
        double r = covariance / Math.sqrt(varianceX * varianceY);
        return Double.isFinite(r) ? r : 0;
    }

    private static double[] toCounts(List<TrendDataPoint> series) {
        return series.stream().mapToDouble(TrendDataPoint::getCount).toArray();
    }
}
