package com.example.shortie_backend.refine;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.util.TranscriptUtil;

/**
 * Mutable working window. Lives only inside one refinement run.
 */
final class ClipWindow {
    double start;
    double end;
    String title;
    String reason;
    int score;
    /** Requested center; length enforcement re-centers here. */
    double anchorMid;
    boolean merged;

    ClipWindow(double start, double end, String title, String reason, int score, double anchorMid) {
        this.start = start;
        this.end = end;
        this.title = title;
        this.reason = reason;
        this.score = score;
        this.anchorMid = anchorMid;
    }

    double duration() {
        return end - start;
    }

    boolean hasRoundedSpan() {
        return TranscriptUtil.round2(end) > TranscriptUtil.round2(start);
    }

    ClipCandidate toCandidate() {
        return new ClipCandidate(title, TranscriptUtil.round2(start), TranscriptUtil.round2(end), reason, score);
    }
}
