package com.example.shortie_backend.controller;

import com.example.shortie_backend.dto.ClipSet;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.dto.web.ParseRequest;
import com.example.shortie_backend.dto.web.ShortsSelectRequest;
import com.example.shortie_backend.service.ShortsSelectionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST controller exposing clip selection over a transcript.
 */
@RestController
@RequestMapping("/v1/shorts")
public class ShortsController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortsController.class);

    private final ShortsSelectionService selectionService;

    public ShortsController(ShortsSelectionService selectionService) {
        this.selectionService = selectionService;
    }

    /**
     * Selects, refines and enriches clips for the transcript.
     *
     * @param body transcript plus optional brand context and clip count.
     * @return final clip set ordered by start.
     */
    @PostMapping("/select")
    public ClipSet select(@Valid @RequestBody ShortsSelectRequest body) {
        Transcript transcript = body.transcript();
        if (!transcript.hasSegments() && transcript.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TRANSCRIPT_EMPTY");
        }
        try {
            return selectionService.selectShorts(transcript, body.brand(), body.targetShorts());
        } catch (RuntimeException e) {
            LOGGER.error("ShortsController select failed segments={} error={}", transcript.segments().size(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "SHORTS_GENERATION_FAILED", e);
        }
    }

    /**
     * Runs extraction and coercion over raw provider output without calling the provider.
     *
     * @param body raw reply text.
     * @return recovered candidates.
     */
    @PostMapping("/parse")
    public ClipSet parse(@Valid @RequestBody ParseRequest body) {
        return selectionService.parseOnly(body.content());
    }
}
