package com.example.shortie_backend.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.shortie_backend.config.ShortsProperties;
import com.example.shortie_backend.engine.GenerationException;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.parser.LenientJsonExtractor;
import com.example.shortie_backend.parser.ParsedShorts;
import com.example.shortie_backend.parser.SchemaCoercer;
import com.example.shortie_backend.parser.TimeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShortsResponseParserTest {

    private static final String VALID = "{\"shorts\": [{\"title\": \"A\", \"start_time\": 1, \"end_time\": 30}], \"total_shorts\": 1}";

    private GenerationEngine engine;
    private ShortsResponseParser parser;

    @BeforeEach
    void setUp() {
        engine = Mockito.mock(GenerationEngine.class);
        when(engine.provider()).thenReturn("mock");
        TimeParser timeParser = new TimeParser();
        LenientJsonExtractor extractor = new LenientJsonExtractor(timeParser);
        ShortsProperties props = new ShortsProperties();
        props.setRepairInputMaxChars(40);
        parser = new ShortsResponseParser(extractor, new SchemaCoercer(timeParser, extractor), engine, new ShortsPromptFactory(), props);
    }

    @Test
    void parsableReplyNeedsNoRepair() {
        ParsedShorts parsed = parser.parseOrRepair(VALID);

        assertThat(parsed.totalShorts()).isEqualTo(1);
        verify(engine, never()).complete(anyList());
    }

    @Test
    void emptyListIsAcceptedWithoutRepair() {
        ParsedShorts parsed = parser.parseOrRepair("{\"shorts\": [], \"total_shorts\": 0}");

        assertThat(parsed.isEmpty()).isTrue();
        verify(engine, never()).complete(anyList());
    }

    @Test
    void extractionFailureTriggersOneRepairWithTruncatedInput() {
        String garbage = "Sorry, here are my thoughts about the video and nothing else at all, really.";
        when(engine.complete(anyList())).thenReturn(VALID);

        ParsedShorts parsed = parser.parseOrRepair(garbage);

        assertThat(parsed.shorts()).hasSize(1);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<GenerationEngine.Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(engine).complete(captor.capture());
        String user = captor.getValue().get(1).content();
        assertThat(user).contains(garbage.substring(0, 40)).doesNotContain("really");
        assertThat(captor.getValue().get(0).content()).contains("strict JSON repair tool");
    }

    @Test
    void failedRepairDegradesToEmptySet() {
        when(engine.complete(anyList())).thenReturn("still not json");
        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(ShortsResponseParser.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);

        try {
            ParsedShorts parsed = parser.parseOrRepair("no json here");

            assertThat(parsed.isEmpty()).isTrue();
            assertThat(parsed.totalShorts()).isZero();
            List<String> warnMessages = listAppender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage)
                    .toList();
            assertThat(warnMessages).hasSize(2);
            assertThat(warnMessages.get(0)).contains("requesting repair provider=mock");
            assertThat(warnMessages.get(1)).contains("repair failed preview='still not json'");
        } finally {
            logger.detachAppender(listAppender);
            listAppender.stop();
        }
    }

    @Test
    void repairTransportFailurePropagates() {
        when(engine.complete(anyList())).thenThrow(new GenerationException("LLM_UNREACHABLE provider=mock"));

        assertThatThrownBy(() -> parser.parseOrRepair("no json here"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("LLM_UNREACHABLE");
    }
}
