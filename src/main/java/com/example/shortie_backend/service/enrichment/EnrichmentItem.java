package com.example.shortie_backend.service.enrichment;

/**
 * One flagged clip sent to the enrichment request, addressed by its position in the clip list.
 */
public record EnrichmentItem(int index, double startTime, double endTime, String title, String reason, String excerpt) {
}
