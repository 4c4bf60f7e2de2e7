package com.example.shortie_backend.selector;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.dto.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SpatialGoodClipSelectorTest {

    private final SpatialGoodClipSelector selector = new SpatialGoodClipSelector();
    private final Transcript transcript = evenTranscript(600, 10);

    @Test
    void picksBestCandidatePerBucket() {
        ClipCandidate a = clip("A", 10, 40, 9);
        ClipCandidate b = clip("B", 50, 80, 8);
        ClipCandidate c = clip("C", 210, 240, 5);
        ClipCandidate d = clip("D", 560, 590, 7);

        List<ClipCandidate> result = selector.select(List.of(b, d, a, c), transcript, new SelectorConfig(3, 90));

        assertThat(result).containsExactly(a, c, d);
        Map<String, String> explain = selector.explainLast();
        assertThat(explain).containsKey("10.0-40.0");
        assertThat(explain.get("10.0-40.0")).contains("pass=BUCKET");
    }

    @Test
    void relaxedPassFillsTargetWithCloseButDistinctClips() {
        ClipCandidate a = clip("A", 10, 40, 9);
        ClipCandidate b = clip("B", 50, 80, 8);
        ClipCandidate c = clip("C", 210, 240, 5);
        ClipCandidate d = clip("D", 560, 590, 7);

        List<ClipCandidate> result = selector.select(List.of(a, b, c, d), transcript, new SelectorConfig(4, 90));

        assertThat(result).containsExactly(a, b, c, d);
        assertThat(selector.explainLast().get("50.0-80.0")).contains("pass=RELAXED");
    }

    @Test
    void closeBucketWinnerIsDeferredInFavourOfSpreadCandidate() {
        ClipCandidate e = clip("E", 260, 290, 9);
        ClipCandidate f = clip("F", 310, 340, 4);
        ClipCandidate g = clip("G", 500, 530, 3);

        List<ClipCandidate> result = selector.select(List.of(e, f, g), transcript, new SelectorConfig(2, 90));

        assertThat(result).containsExactly(e, g);
        assertThat(selector.explainLast().get("500.0-530.0")).contains("pass=SPREAD");
    }

    @Test
    void nearDuplicatesAreNeverSelectedTogether() {
        ClipCandidate h = clip("H", 100, 130, 9);
        ClipCandidate i = clip("I", 100.2, 130.1, 8);
        ClipCandidate j = clip("J", 105, 131, 7);

        List<ClipCandidate> result = selector.select(List.of(h, i, j), transcript, new SelectorConfig(3, 90));

        assertThat(result).containsExactly(h);
    }

    @Test
    void usesCandidateBoundsWithoutSegments() {
        Transcript empty = Transcript.of(List.of(), "en");
        ClipCandidate a = clip("A", 0, 20, 1);
        ClipCandidate b = clip("B", 300, 330, 2);

        List<ClipCandidate> result = selector.select(List.of(b, a), empty, new SelectorConfig(2, 90));

        assertThat(result).containsExactly(a, b);
    }

    @Test
    void emptyInputOrZeroTargetSelectsNothing() {
        assertThat(selector.select(List.of(), transcript, SelectorConfig.defaults())).isEmpty();
        assertThat(selector.select(List.of(clip("A", 1, 20, 1)), transcript, new SelectorConfig(0, 90))).isEmpty();
        assertThat(selector.explainLast()).isEmpty();
    }

    @Test
    void closePairsOnlyComeFromTheRelaxedPass() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<ClipCandidate> candidates = new ArrayList<>();
            for (int k = 0; k < 25; k++) {
                double start = random.nextInt(560);
                double len = 15 + random.nextInt(40);
                candidates.add(clip("C" + k, start, Math.min(600, start + len), random.nextInt(10)));
            }
            int target = 1 + random.nextInt(8);
            double minGap = 30 + random.nextInt(90);

            List<ClipCandidate> result = selector.select(candidates, transcript, new SelectorConfig(target, minGap));
            Map<String, String> explain = selector.explainLast();

            assertThat(result.size()).isLessThanOrEqualTo(target);
            for (int x = 0; x < result.size(); x++) {
                for (int y = x + 1; y < result.size(); y++) {
                    ClipCandidate p = result.get(x);
                    ClipCandidate q = result.get(y);
                    if (Math.abs(p.midpoint() - q.midpoint()) < minGap) {
                        assertThat(explain.get(key(p)) + explain.get(key(q))).contains("pass=RELAXED");
                    }
                }
            }
        }
    }

    private static String key(ClipCandidate c) {
        return c.startTime() + "-" + c.endTime();
    }

    private static ClipCandidate clip(String title, double start, double end, int score) {
        return new ClipCandidate(title, start, end, "reason for " + title, score);
    }

    static Transcript evenTranscript(int seconds, int step) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (int t = 0; t < seconds; t += step) {
            segments.add(new TranscriptSegment(t, t + step, "Segment starting at " + t + " seconds."));
        }
        return Transcript.of(segments, "en");
    }
}
