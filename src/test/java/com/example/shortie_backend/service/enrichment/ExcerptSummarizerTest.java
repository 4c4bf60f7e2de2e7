package com.example.shortie_backend.service.enrichment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExcerptSummarizerTest {

    @Test
    void titleIsLeadClauseWithoutLeadingArticle() {
        assertThat(ExcerptSummarizer.title("The market crashed overnight, and nobody saw it coming. Then it got worse."))
                .isEqualTo("Market crashed overnight");
    }

    @Test
    void titlesFollowSentenceOrder() {
        assertThat(ExcerptSummarizer.titles("The market crashed overnight, and nobody saw it coming. Then it got worse. ..."))
                .containsExactly("Market crashed overnight", "Then it got worse");
    }

    @Test
    void titleIsTruncatedAtWordBoundary() {
        String excerpt = "We " + "kept building another feature nobody asked for ".repeat(5) + "until the money ran out.";

        String title = ExcerptSummarizer.title(excerpt);

        assertThat(title.length()).isLessThanOrEqualTo(90);
        assertThat(title).startsWith("Kept building");
        assertThat(title).doesNotEndWith(" ");
    }

    @Test
    void reasonJoinsSentencesAndEndsWithPeriod() {
        String reason = ExcerptSummarizer.reason(
                "We raised money. Then it vanished! The bank called at midnight and said everything was frozen until further notice. Extra.");

        assertThat(reason).startsWith("We raised money. Then it vanished! The bank called");
        assertThat(reason).endsWith("notice.");
        assertThat(reason).doesNotContain("Extra");
    }

    @Test
    void reasonIsCappedAt180Characters() {
        String reason = ExcerptSummarizer.reason("word ".repeat(100) + "end?");

        assertThat(reason.length()).isLessThanOrEqualTo(180);
        assertThat(reason).endsWith(".");
    }

    @Test
    void emptyExcerptGivesEmptyText() {
        assertThat(ExcerptSummarizer.title("  ")).isEmpty();
        assertThat(ExcerptSummarizer.reason(null)).isEmpty();
        assertThat(ExcerptSummarizer.fallbackTitle(3)).isEqualTo("Clip 3");
    }
}
