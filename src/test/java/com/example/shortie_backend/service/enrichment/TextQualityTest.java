package com.example.shortie_backend.service.enrichment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextQualityTest {

    @Test
    void detectsGenericAndFillerTitles() {
        assertThat(TextQuality.isGenericTitle("Compelling Title!")).isTrue();
        assertThat(TextQuality.isGenericTitle("  untitled   segment ")).isTrue();
        assertThat(TextQuality.isGenericTitle("Why the launch nearly failed")).isFalse();
        assertThat(TextQuality.startsWithFiller("and then it broke")).isTrue();
        assertThat(TextQuality.startsWithFiller("um, so yeah")).isTrue();
        assertThat(TextQuality.startsWithFiller("And then it broke")).isFalse();
        assertThat(TextQuality.startsWithFiller("likeable founders win")).isFalse();
    }

    @Test
    void flagsWeakReasons() {
        assertThat(TextQuality.isWeakReason("", "en")).isTrue();
        assertThat(TextQuality.isWeakReason("Strong standalone moment", "en")).isTrue();
        assertThat(TextQuality.isWeakReason("Auto-generated to meet minimum clip count.", "en")).isTrue();
        assertThat(TextQuality.isWeakReason("The founder admits the company nearly went bankrupt.", "en")).isFalse();
    }

    @Test
    void scriptHeuristicAppliesOnlyToLatinScriptLanguages() {
        assertThat(TextQuality.isForeignScript("مرحبا بالعالم", "en")).isTrue();
        assertThat(TextQuality.isForeignScript("नमस्ते दुनिया", null)).isTrue();
        assertThat(TextQuality.isForeignScript("Привет мир", "en")).isTrue();
        assertThat(TextQuality.isForeignScript("Ça va très bien", "fr")).isFalse();
        assertThat(TextQuality.isForeignScript("Привет мир", "ru")).isFalse();
        assertThat(TextQuality.isForeignScript("Hello world", "en-US")).isFalse();
    }
}
