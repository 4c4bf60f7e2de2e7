package com.example.shortie_backend.refine;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.dto.TranscriptSegment;
import com.example.shortie_backend.util.WindowOverlap;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ClipBoundaryRefinerTest {

    private final ClipBoundaryRefiner refiner = new ClipBoundaryRefiner();
    private final Transcript transcript = transcript(600, 10);
    private final RefinerConfig noBackfill = new RefinerConfig(15, 60, 1.5, 0, 0, 10);

    @Test
    void padsAndSnapsToSegmentBoundaries() {
        List<ClipCandidate> out = refiner.refine(List.of(clip("Hook", 23, 47)), transcript, noBackfill);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).startTime()).isEqualTo(20.0);
        assertThat(out.get(0).endTime()).isEqualTo(50.0);
        assertThat(out.get(0).title()).isEqualTo("Hook");
        assertThat(out.get(0).score()).isEqualTo(5);
    }

    @Test
    void longWindowIsRecenteredAndCappedAtMaxLength() {
        List<ClipCandidate> out = refiner.refine(List.of(clip("Long", 100, 250)), transcript, noBackfill);

        assertThat(out.get(0).startTime()).isEqualTo(140.0);
        assertThat(out.get(0).endTime()).isEqualTo(200.0);
    }

    @Test
    void shortWindowIsExpandedAroundItsMidpoint() {
        RefinerConfig cfg = new RefinerConfig(15, 60, 0, 0, 0, 10);

        List<ClipCandidate> out = refiner.refine(List.of(clip("Short", 301, 305)), transcript, cfg);

        assertThat(out.get(0).startTime()).isEqualTo(290.0);
        assertThat(out.get(0).endTime()).isEqualTo(320.0);
    }

    @Test
    void forcedExpansionStaysInsideTranscriptAtTheEdge() {
        RefinerConfig cfg = new RefinerConfig(15, 60, 0, 0, 0, 10);

        List<ClipCandidate> out = refiner.refine(List.of(clip("Cold open", 0, 4)), transcript(600, 5), cfg);

        assertThat(out.get(0).startTime()).isEqualTo(0.0);
        assertThat(out.get(0).endTime()).isEqualTo(15.0);
    }

    @Test
    void dropsCandidatesOutsideTheTranscriptAndNearDuplicates() {
        List<ClipCandidate> out = refiner.refine(List.of(
                clip("Dup A", 100, 130),
                clip("Dup B", 101, 131),
                clip("Beyond", 700, 730)), transcript, noBackfill);

        assertThat(out).extracting(ClipCandidate::title).containsExactly("Dup A");
    }

    @Test
    void mergesCloseWindowsOnlyWhenEnabled() {
        List<ClipCandidate> input = List.of(clip("First", 100, 120), clip("Second", 122, 140));

        List<ClipCandidate> merged = refiner.refine(input, transcript, new RefinerConfig(15, 60, 0, 5, 0, 10));
        List<ClipCandidate> separate = refiner.refine(input, transcript, new RefinerConfig(15, 60, 0, 0, 0, 10));

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).startTime()).isEqualTo(100.0);
        assertThat(merged.get(0).endTime()).isEqualTo(140.0);
        assertThat(merged.get(0).title()).isEqualTo("First");
        assertThat(separate).hasSize(2);
    }

    @Test
    void backfillsEvenlySpacedPlaceholdersWhenNothingWasFound() {
        RefinerConfig cfg = new RefinerConfig(15, 60, 1.5, 0, 5, 10);

        List<ClipCandidate> out = refiner.refine(List.of(), transcript, cfg);

        assertThat(out).hasSize(5);
        assertThat(out).extracting(ClipCandidate::startTime).containsExactly(50.0, 170.0, 290.0, 410.0, 530.0);
        assertThat(out).extracting(ClipCandidate::endTime).containsExactly(70.0, 190.0, 310.0, 430.0, 550.0);
        assertThat(out).allSatisfy(c -> {
            assertThat(c.title()).isEqualTo(ClipBoundaryRefiner.BACKFILL_TITLE);
            assertThat(c.reason()).isEqualTo(ClipBoundaryRefiner.BACKFILL_REASON);
            assertThat(c.score()).isZero();
        });
        for (int i = 1; i < out.size(); i++) {
            assertThat(out.get(i).startTime()).isGreaterThanOrEqualTo(out.get(i - 1).endTime());
        }
    }

    @Test
    void backfillTopsUpAroundRealClips() {
        RefinerConfig cfg = new RefinerConfig(15, 60, 1.5, 0, 3, 10);

        List<ClipCandidate> out = refiner.refine(List.of(clip("Real", 40, 70)), transcript, cfg);

        assertThat(out).extracting(ClipCandidate::title).containsExactly("Real", "Auto Clip", "Auto Clip");
        assertThat(out.get(0).startTime()).isEqualTo(30.0);
        assertThat(out.get(0).endTime()).isEqualTo(80.0);
        assertThat(out.get(1).startTime()).isEqualTo(90.0);
        assertThat(out.get(2).startTime()).isEqualTo(290.0);
    }

    @Test
    void capKeepsEarliestClips() {
        RefinerConfig cfg = new RefinerConfig(15, 60, 1.5, 0, 0, 2);

        List<ClipCandidate> out = refiner.refine(List.of(
                clip("Late", 400, 430), clip("Early", 10, 40), clip("Middle", 200, 230)), transcript, cfg);

        assertThat(out).extracting(ClipCandidate::title).containsExactly("Early", "Middle");
    }

    @Test
    void returnsInputSortedWithoutSegments() {
        Transcript empty = Transcript.of(List.of(), "en");
        ClipCandidate late = clip("Late", 400, 402);
        ClipCandidate early = clip("Early", 10, 11);

        List<ClipCandidate> out = refiner.refine(List.of(late, early), empty, new RefinerConfig(15, 60, 1.5, 0, 5, 10));

        assertThat(out).containsExactly(early, late);
    }

    @Test
    void outputRespectsLengthBoundsAndHasNoNearDuplicates() {
        Random random = new Random(7);
        RefinerConfig cfg = new RefinerConfig(15, 60, 1.5, 0, 5, 8);
        for (int round = 0; round < 40; round++) {
            List<ClipCandidate> input = new ArrayList<>();
            int n = random.nextInt(10);
            for (int k = 0; k < n; k++) {
                double start = random.nextInt(590);
                double end = start + 1 + random.nextInt(200);
                input.add(clip("C" + k, start, end));
            }

            List<ClipCandidate> out = refiner.refine(input, transcript, cfg);

            assertThat(out.size()).isBetween(1, 8);
            for (int i = 0; i < out.size(); i++) {
                ClipCandidate c = out.get(i);
                assertThat(c.duration()).isBetween(15.0 - 1e-6, 60.0 + 1e-6);
                assertThat(c.startTime()).isGreaterThanOrEqualTo(0.0);
                assertThat(c.endTime()).isLessThanOrEqualTo(600.0);
                for (int j = i + 1; j < out.size(); j++) {
                    ClipCandidate o = out.get(j);
                    assertThat(WindowOverlap.isNearDuplicate(c.startTime(), c.endTime(), o.startTime(), o.endTime())).isFalse();
                }
            }
        }
    }

    private static ClipCandidate clip(String title, double start, double end) {
        return new ClipCandidate(title, start, end, "Because something specific happens here", 5);
    }

    private static Transcript transcript(int seconds, int step) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (int t = 0; t < seconds; t += step) {
            segments.add(new TranscriptSegment(t, t + step, "Line " + t));
        }
        return Transcript.of(segments, "en");
    }
}
