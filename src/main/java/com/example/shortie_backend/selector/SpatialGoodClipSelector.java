package com.example.shortie_backend.selector;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.util.WindowOverlap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Default selector: one winner per timeline bucket, then a score-ordered spread pass honoring the
 * minimum midpoint gap, then a relaxed pass that only rejects near-duplicates.
 *
 * <p>A bucket winner lying closer than the minimum gap to a higher scoring bucket winner is deferred to
 * the later passes, so any close pair in the result was admitted by the relaxed pass.
 */
@Component
public class SpatialGoodClipSelector implements GoodClipSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpatialGoodClipSelector.class);
    private static final Comparator<ClipCandidate> BY_SCORE_DESC = Comparator
            .comparingInt(ClipCandidate::score).reversed()
            .thenComparingDouble(ClipCandidate::startTime);

    private volatile Map<String, String> lastExplanation = Map.of();

    @Override
    public List<ClipCandidate> select(List<ClipCandidate> candidates, Transcript transcript, SelectorConfig cfg) {
        SelectorConfig effective = cfg == null ? SelectorConfig.defaults() : cfg;
        int target = effective.targetShorts();
        if (candidates == null || candidates.isEmpty() || target <= 0) {
            lastExplanation = Map.of();
            return List.of();
        }

        double[] span = span(candidates, transcript);
        List<ClipCandidate> winners = bucketWinners(candidates, span[0], span[1], target);

        List<SelectedClip> selected = new ArrayList<>();
        Map<ClipCandidate, Boolean> taken = new IdentityHashMap<>();
        // A deferred winner can leave its bucket uncovered. The gap between admitted clips takes priority over
        // one clip per bucket; the spread pass may still refill that region from the remainder.
        winners.sort(BY_SCORE_DESC);
        for (ClipCandidate winner : winners) {
            if (keepsGap(winner, selected, effective.minGapSeconds())) {
                selected.add(new SelectedClip(winner, SelectionPass.BUCKET));
                taken.put(winner, Boolean.TRUE);
            } else {
                LOGGER.trace("selector defer bucket winner start={} end={} score={}", winner.startTime(), winner.endTime(), winner.score());
            }
        }

        List<ClipCandidate> remainder = new ArrayList<>();
        for (ClipCandidate candidate : candidates) {
            if (!taken.containsKey(candidate)) {
                remainder.add(candidate);
            }
        }
        remainder.sort(BY_SCORE_DESC);

        for (ClipCandidate candidate : remainder) {
            if (selected.size() >= target) break;
            if (keepsGap(candidate, selected, effective.minGapSeconds())) {
                selected.add(new SelectedClip(candidate, SelectionPass.SPREAD));
                taken.put(candidate, Boolean.TRUE);
            }
        }
        for (ClipCandidate candidate : remainder) {
            if (selected.size() >= target) break;
            if (!taken.containsKey(candidate) && !duplicatesAny(candidate, selected)) {
                selected.add(new SelectedClip(candidate, SelectionPass.RELAXED));
                taken.put(candidate, Boolean.TRUE);
            }
        }

        selected.sort(Comparator.comparingDouble(s -> s.clip().startTime()));
        if (selected.size() > target) {
            selected = new ArrayList<>(selected.subList(0, target));
        }

        Map<String, String> explanations = new LinkedHashMap<>();
        List<ClipCandidate> out = new ArrayList<>(selected.size());
        for (SelectedClip s : selected) {
            out.add(s.clip());
            explanations.put(keyFor(s.clip()), String.format(Locale.ROOT, "pass=%s score=%d mid=%.2f",
                    s.pass(), s.clip().score(), s.clip().midpoint()));
        }
        lastExplanation = explanations;
        LOGGER.debug("SpatialGoodClipSelector candidates={} buckets={} selected={} span={}-{}",
                candidates.size(), target, out.size(), span[0], span[1]);
        return out;
    }

    @Override
    public Map<String, String> explainLast() {
        return lastExplanation;
    }

    private static double[] span(List<ClipCandidate> candidates, Transcript transcript) {
        if (transcript != null && transcript.hasSegments() && transcript.spanEnd() > transcript.spanStart()) {
            return new double[]{transcript.spanStart(), transcript.spanEnd()};
        }
        double start = candidates.stream().mapToDouble(ClipCandidate::startTime).min().orElse(0.0);
        double end = candidates.stream().mapToDouble(ClipCandidate::endTime).max().orElse(start);
        return new double[]{start, end};
    }

    private static List<ClipCandidate> bucketWinners(List<ClipCandidate> candidates, double start, double end, int buckets) {
        double width = (end - start) / buckets;
        ClipCandidate[] best = new ClipCandidate[buckets];
        for (ClipCandidate candidate : candidates) {
            int idx = width > 0 ? (int) Math.floor((candidate.midpoint() - start) / width) : 0;
            idx = Math.max(0, Math.min(buckets - 1, idx));
            if (best[idx] == null || candidate.score() > best[idx].score()) {
                best[idx] = candidate;
            }
        }
        List<ClipCandidate> winners = new ArrayList<>();
        for (ClipCandidate winner : best) {
            if (winner != null) {
                winners.add(winner);
            }
        }
        return winners;
    }

    private static boolean keepsGap(ClipCandidate candidate, List<SelectedClip> selected, double minGap) {
        for (SelectedClip s : selected) {
            if (Math.abs(s.clip().midpoint() - candidate.midpoint()) < minGap) {
                return false;
            }
        }
        return !duplicatesAny(candidate, selected);
    }

    private static boolean duplicatesAny(ClipCandidate candidate, List<SelectedClip> selected) {
        for (SelectedClip s : selected) {
            ClipCandidate c = s.clip();
            if (WindowOverlap.isNearDuplicate(candidate.startTime(), candidate.endTime(), c.startTime(), c.endTime())) {
                return true;
            }
        }
        return false;
    }

    private static String keyFor(ClipCandidate clip) {
        return clip.startTime() + "-" + clip.endTime();
    }
}
