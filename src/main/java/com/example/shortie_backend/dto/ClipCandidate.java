package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Validated clip recommendation. Always satisfies {@code endTime > startTime}.
 *
 * @param title     headline for the clip.
 * @param startTime start offset in seconds.
 * @param endTime   end offset in seconds.
 * @param reason    why the clip is worth cutting.
 * @param score     integer quality score, {@code 0} when unknown.
 */
public record ClipCandidate(String title,
                            @JsonProperty("start_time") double startTime,
                            @JsonProperty("end_time") double endTime,
                            String reason,
                            int score) {

    public ClipCandidate {
        if (!(endTime > startTime)) {
            throw new IllegalArgumentException("CLIP_END_NOT_AFTER_START start=" + startTime + " end=" + endTime);
        }
        title = title == null ? "" : title;
        reason = reason == null ? "" : reason;
    }

    public double midpoint() {
        return (startTime + endTime) / 2.0;
    }

    public double duration() {
        return endTime - startTime;
    }

    public ClipCandidate withText(String newTitle, String newReason) {
        return new ClipCandidate(newTitle, startTime, endTime, newReason, score);
    }
}
