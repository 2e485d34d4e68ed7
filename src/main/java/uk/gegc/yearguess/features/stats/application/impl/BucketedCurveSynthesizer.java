package uk.gegc.yearguess.features.stats.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.yearguess.features.challenge.domain.model.CurvePoint;
import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;
import uk.gegc.yearguess.features.stats.application.CurveSynthesizer;
import uk.gegc.yearguess.features.stats.domain.model.ScoreDomain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Curve synthesis by bucket selection.
 * <p>
 * Every curve point is a real score bucket. The global minimum and maximum buckets are always
 * kept; the remaining points are the buckets whose cumulative percentile is nearest to evenly
 * spaced percentile targets. Missing points are filled into the widest score gaps, surplus
 * points are pruned where the curve is closest to a straight line.
 * </p>
 * <p>
 * All percentages are rounded half-up with integer arithmetic.
 * </p>
 */
@Component
public class BucketedCurveSynthesizer implements CurveSynthesizer {

    /**
     * Ranks above this value ("top 51%" and worse) are not reported.
     */
    static final int MAX_REPORTED_RANK = 50;

    @Override
    public ProcessedDistribution synthesize(Map<Integer, Long> histogram, Integer userScore, int pointCount) {
        if (pointCount < 2) {
            throw new IllegalArgumentException("Curve needs at least 2 points, got " + pointCount);
        }
        List<CurvePoint> buckets = cumulativeBuckets(histogram);
        long total = buckets.stream().mapToLong(CurvePoint::count).sum();
        if (total == 0) {
            return emptyDistribution();
        }

        Integer percentileRank = userScore == null ? null : percentileRank(buckets, total, userScore);
        return new ProcessedDistribution(
                percentileRank,
                selectCurvePoints(buckets, pointCount),
                total,
                buckets.get(0).score(),
                buckets.get(buckets.size() - 1).score(),
                medianScore(buckets, total)
        );
    }

    static ProcessedDistribution emptyDistribution() {
        return new ProcessedDistribution(
                null,
                List.of(
                        new CurvePoint(ScoreDomain.MIN_SCORE, 0, 0),
                        new CurvePoint(ScoreDomain.MAX_SCORE, 0, 100)
                ),
                0, 0, 0, 0
        );
    }

    /**
     * Sorted buckets, each annotated with the percentage of participants at or below its score.
     */
    static List<CurvePoint> cumulativeBuckets(Map<Integer, Long> histogram) {
        TreeMap<Integer, Long> sorted = new TreeMap<>();
        if (histogram != null) {
            histogram.forEach((score, count) -> {
                if (score != null && count != null && count > 0) {
                    sorted.merge(score, count, Long::sum);
                }
            });
        }
        long total = sorted.values().stream().mapToLong(Long::longValue).sum();

        List<CurvePoint> buckets = new ArrayList<>(sorted.size());
        long cumulative = 0;
        for (Map.Entry<Integer, Long> entry : sorted.entrySet()) {
            cumulative += entry.getValue();
            buckets.add(new CurvePoint(entry.getKey(), entry.getValue(), percentHalfUp(cumulative, total)));
        }
        return buckets;
    }

    /**
     * "Top X%" rank with ties split in half: {@code 100 - round((below + equal / 2) / total * 100)}.
     * Returns {@code null} when the rank is worse than {@value #MAX_REPORTED_RANK}.
     */
    static Integer percentileRank(List<CurvePoint> buckets, long total, int userScore) {
        long below = 0;
        long equal = 0;
        for (CurvePoint bucket : buckets) {
            if (bucket.score() < userScore) {
                below += bucket.count();
            } else if (bucket.score() == userScore) {
                equal += bucket.count();
            }
        }
        int raw = percentHalfUp(2 * below + equal, 2 * total);
        int rank = 100 - raw;
        return rank <= MAX_REPORTED_RANK ? rank : null;
    }

    /**
     * First score whose cumulative count reaches {@code floor(total / 2)}.
     */
    static int medianScore(List<CurvePoint> buckets, long total) {
        long target = total / 2;
        long cumulative = 0;
        for (CurvePoint bucket : buckets) {
            cumulative += bucket.count();
            if (cumulative >= target) {
                return bucket.score();
            }
        }
        return buckets.get(buckets.size() - 1).score();
    }

    static List<CurvePoint> selectCurvePoints(List<CurvePoint> buckets, int pointCount) {
        if (buckets.size() <= pointCount) {
            return List.copyOf(buckets);
        }

        TreeMap<Integer, CurvePoint> chosen = new TreeMap<>();
        CurvePoint first = buckets.get(0);
        CurvePoint last = buckets.get(buckets.size() - 1);
        chosen.put(first.score(), first);
        chosen.put(last.score(), last);

        for (int i = 1; i <= pointCount - 2; i++) {
            double target = 100.0 * i / (pointCount - 1);
            CurvePoint closest = closestByPercentile(buckets, target);
            chosen.putIfAbsent(closest.score(), closest);
        }

        List<CurvePoint> selected = new ArrayList<>(chosen.values());
        if (selected.size() < pointCount) {
            fillWidestGaps(selected, buckets, pointCount);
        }
        if (selected.size() > pointCount) {
            pruneFlattestPoints(selected, pointCount);
        }
        return List.copyOf(selected);
    }

    private static CurvePoint closestByPercentile(List<CurvePoint> buckets, double target) {
        CurvePoint closest = buckets.get(0);
        double minDiff = Math.abs(closest.percentile() - target);
        for (CurvePoint bucket : buckets) {
            double diff = Math.abs(bucket.percentile() - target);
            if (diff < minDiff) {
                closest = bucket;
                minDiff = diff;
            }
        }
        return closest;
    }

    /**
     * Insert real buckets into the widest gaps between selected points until the target count is
     * reached. A gap with no unselected bucket inside it is passed over for the next widest one.
     */
    static void fillWidestGaps(List<CurvePoint> selected, List<CurvePoint> buckets, int pointCount) {
        while (selected.size() < pointCount) {
            List<Integer> gapsWidestFirst = IntStream.range(0, selected.size() - 1)
                    .boxed()
                    .sorted(Comparator.comparingInt((Integer i) ->
                            selected.get(i + 1).score() - selected.get(i).score()).reversed())
                    .toList();

            boolean inserted = false;
            for (int gap : gapsWidestFirst) {
                int left = selected.get(gap).score();
                int right = selected.get(gap + 1).score();
                CurvePoint candidate = closestInside(buckets, left, right, Math.floorDiv(left + right, 2));
                if (candidate != null) {
                    selected.add(gap + 1, candidate);
                    inserted = true;
                    break;
                }
            }
            if (!inserted) {
                return;
            }
        }
    }

    private static CurvePoint closestInside(List<CurvePoint> buckets, int left, int right, int midpoint) {
        CurvePoint closest = null;
        int minDiff = Integer.MAX_VALUE;
        for (CurvePoint bucket : buckets) {
            if (bucket.score() <= left || bucket.score() >= right) {
                continue;
            }
            int diff = Math.abs(bucket.score() - midpoint);
            if (diff < minDiff) {
                closest = bucket;
                minDiff = diff;
            }
        }
        return closest;
    }

    /**
     * Repeatedly drop the interior point whose count deviates least from the straight line
     * between its neighbours. Endpoints are never dropped.
     */
    static void pruneFlattestPoints(List<CurvePoint> selected, int pointCount) {
        while (selected.size() > Math.max(pointCount, 2)) {
            int removeAt = -1;
            double leastDeviation = Double.MAX_VALUE;
            for (int i = 1; i < selected.size() - 1; i++) {
                CurvePoint prev = selected.get(i - 1);
                CurvePoint point = selected.get(i);
                CurvePoint next = selected.get(i + 1);
                double ratio = (double) (point.score() - prev.score()) / (next.score() - prev.score());
                double expected = prev.count() + ratio * (next.count() - prev.count());
                double deviation = Math.abs(point.count() - expected);
                if (deviation < leastDeviation) {
                    leastDeviation = deviation;
                    removeAt = i;
                }
            }
            selected.remove(removeAt);
        }
    }

    /**
     * {@code round(numerator / denominator * 100)}, half-up, for non-negative operands.
     */
    static int percentHalfUp(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0;
        }
        return (int) ((200 * numerator + denominator) / (2 * denominator));
    }
}
