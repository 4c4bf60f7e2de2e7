package com.example.shortie_backend.dto.web;

import com.example.shortie_backend.dto.BrandInfo;
import com.example.shortie_backend.dto.Transcript;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request payload for clip selection.
 *
 * @param transcript   timestamped transcript to cut.
 * @param brand        optional brand context appended to the prompt.
 * @param targetShorts optional override for the number of clips.
 */
public record ShortsSelectRequest(@NotNull @Valid Transcript transcript,
                                  BrandInfo brand,
                                  @Min(1) @Max(50) Integer targetShorts) {
}
