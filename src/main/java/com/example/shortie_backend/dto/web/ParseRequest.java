package com.example.shortie_backend.dto.web;

import jakarta.validation.constraints.NotNull;

/**
 * Raw provider output to run through extraction and coercion.
 */
public record ParseRequest(@NotNull String content) {
}
