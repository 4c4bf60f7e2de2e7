package com.example.shortie_backend.refine;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.dto.TranscriptSegment;
import com.example.shortie_backend.util.WindowOverlap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Anchors clip windows to transcript segment boundaries and brings them within the configured length
 * bounds. Near-duplicate windows are dropped and the set is backfilled with evenly spaced placeholder
 * clips when it falls below the minimum count.
 */
@Component
public class ClipBoundaryRefiner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipBoundaryRefiner.class);

    public static final String BACKFILL_TITLE = "Auto Clip";
    public static final String BACKFILL_REASON = "Auto-generated to meet minimum clip count.";
    private static final double[] JITTER_STEPS = {0.0, -0.35, 0.35, -0.70, 0.70};
    private static final double EPSILON = 1e-6;

    public List<ClipCandidate> refine(List<ClipCandidate> candidates, Transcript transcript, RefinerConfig cfg) {
        List<ClipCandidate> input = candidates == null ? List.of() : candidates;
        if (transcript == null || !transcript.hasSegments()) {
            List<ClipCandidate> sorted = new ArrayList<>(input);
            sorted.sort(Comparator.comparingDouble(ClipCandidate::startTime));
            return List.copyOf(sorted.subList(0, Math.min(sorted.size(), Math.max(0, cfg.maxShorts()))));
        }

        Run run = new Run(transcript.segments(), cfg);
        List<ClipWindow> windows = new ArrayList<>();
        int outside = 0;
        for (ClipCandidate c : input) {
            if (c.endTime() <= run.spanStart || c.startTime() >= run.spanEnd) {
                outside++;
                continue;
            }
            ClipWindow w = run.expandAndSnap(c.startTime(), c.endTime(), c.midpoint());
            w.title = c.title();
            w.reason = c.reason();
            w.score = c.score();
            windows.add(w);
        }
        if (outside > 0) {
            LOGGER.debug("ClipBoundaryRefiner dropped outsideTranscript={}", outside);
        }

        int backfilledEarly = run.backfill(windows);

        windows.sort(Comparator.comparingDouble(w -> w.start));
        List<ClipWindow> merged = new ArrayList<>();
        for (ClipWindow w : windows) {
            ClipWindow cur = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (cur != null && cfg.mergeGap() > 0 && w.start <= cur.end + cfg.mergeGap()) {
                cur.end = Math.max(cur.end, w.end);
                cur.anchorMid = (cur.anchorMid + w.anchorMid) / 2.0;
                cur.merged = true;
                continue;
            }
            merged.add(w);
        }

        List<ClipWindow> refined = new ArrayList<>();
        for (ClipWindow w : merged) {
            run.enforceLength(w);
            if (run.longEnough(w) && w.hasRoundedSpan() && !run.duplicatesAny(w, refined)) {
                refined.add(w);
            }
        }
        int backfilledLate = run.backfill(refined);

        refined.sort(Comparator.comparingDouble(w -> w.start));
        int cap = Math.max(0, cfg.maxShorts());
        List<ClipCandidate> out = new ArrayList<>();
        for (ClipWindow w : refined) {
            if (out.size() >= cap) break;
            out.add(w.toCandidate());
        }
        LOGGER.info("ClipBoundaryRefiner input={} refined={} backfilled={} merged={}",
                input.size(), out.size(), backfilledEarly + backfilledLate,
                merged.stream().filter(w -> w.merged).count());
        return List.copyOf(out);
    }

    /**
     * Segment lookups and length rules for one transcript.
     */
    private static final class Run {
        private final List<TranscriptSegment> segments;
        private final RefinerConfig cfg;
        private final double spanStart;
        private final double spanEnd;

        Run(List<TranscriptSegment> segments, RefinerConfig cfg) {
            this.segments = segments;
            this.cfg = cfg;
            this.spanStart = segments.stream().mapToDouble(TranscriptSegment::start).min().orElse(0.0);
            this.spanEnd = segments.stream().mapToDouble(TranscriptSegment::end).max().orElse(0.0);
        }

        double span() {
            return spanEnd - spanStart;
        }

        double clamp(double t) {
            return Math.max(spanStart, Math.min(spanEnd, t));
        }

        double snapStart(double t) {
            double earlier = spanStart;
            for (TranscriptSegment seg : segments) {
                if (seg.start() <= t && t < seg.end()) {
                    return seg.start();
                }
                if (seg.start() <= t) {
                    earlier = Math.max(earlier, seg.start());
                }
            }
            return earlier;
        }

        double snapEnd(double t) {
            double later = spanEnd;
            for (TranscriptSegment seg : segments) {
                if (seg.start() < t && t <= seg.end()) {
                    return seg.end();
                }
                if (seg.end() >= t) {
                    later = Math.min(later, seg.end());
                }
            }
            return later;
        }

        ClipWindow expandAndSnap(double start, double end, double anchorMid) {
            double s = snapStart(clamp(start - cfg.pad()));
            double e = snapEnd(clamp(end + cfg.pad()));
            return new ClipWindow(s, e, "", "", 0, anchorMid);
        }

        void enforceLength(ClipWindow w) {
            double dur = w.duration();
            if (dur > cfg.maxLen() || dur < cfg.minLen()) {
                double half = (dur > cfg.maxLen() ? cfg.maxLen() : cfg.minLen()) / 2.0;
                w.start = snapStart(clamp(w.anchorMid - half));
                w.end = snapEnd(clamp(w.anchorMid + half));
            }
            if (w.duration() > cfg.maxLen()) {
                w.end = clamp(w.start + cfg.maxLen());
            }
            if (w.duration() < cfg.minLen() && span() >= cfg.minLen()) {
                double start = w.anchorMid - cfg.minLen() / 2.0;
                start = Math.max(spanStart, Math.min(spanEnd - cfg.minLen(), start));
                w.start = start;
                w.end = start + cfg.minLen();
            }
        }

        boolean longEnough(ClipWindow w) {
            return w.duration() + EPSILON >= Math.min(cfg.minLen(), span());
        }

        boolean duplicatesAny(ClipWindow w, List<ClipWindow> accepted) {
            for (ClipWindow other : accepted) {
                if (WindowOverlap.isNearDuplicate(w.start, w.end, other.start, other.end)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Adds placeholder windows at evenly spaced slots until {@code minShorts} is met.
         *
         * @return number of windows added.
         */
        int backfill(List<ClipWindow> windows) {
            int added = 0;
            int slots = cfg.minShorts();
            if (slots <= 0 || windows.size() >= slots) {
                return added;
            }
            double slotWidth = Math.max(1.0, span()) / slots;
            for (int i = 0; i < slots && windows.size() < slots; i++) {
                double baseMid = spanStart + (i + 0.5) * slotWidth;
                for (double step : JITTER_STEPS) {
                    double mid = clamp(baseMid + step * cfg.minLen());
                    ClipWindow w = expandAndSnap(mid - cfg.minLen() / 2.0, mid + cfg.minLen() / 2.0, mid);
                    enforceLength(w);
                    if (!longEnough(w) || !w.hasRoundedSpan() || duplicatesAny(w, windows)) {
                        continue;
                    }
                    w.title = BACKFILL_TITLE;
                    w.reason = BACKFILL_REASON;
                    w.score = 0;
                    windows.add(w);
                    added++;
                    break;
                }
            }
            if (added > 0) {
                LOGGER.debug("ClipBoundaryRefiner backfill added={} slots={}", added, slots);
            }
            return added;
        }
    }
}
