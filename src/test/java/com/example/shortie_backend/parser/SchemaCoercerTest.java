package com.example.shortie_backend.parser;

import com.example.shortie_backend.dto.ClipCandidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaCoercerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final TimeParser timeParser = new TimeParser();
    private final SchemaCoercer coercer = new SchemaCoercer(timeParser, new LenientJsonExtractor(timeParser));

    @Test
    void coercesValidCandidatesAndRecountsTotal() throws Exception {
        ParsedShorts parsed = coercer.coerce(payload("""
                {"shorts": [
                  {"title": "Hook", "start_time": 10, "end_time": 40, "reason": "Opens with a bold claim", "score": "7.8"},
                  {"title": "Missing end", "start_time": 50},
                  {"title": "Backwards", "start_time": 90, "end_time": 80},
                  {"title": "Zero length", "start_time": 90, "end_time": 90},
                  {"start": "2:00", "end": "2:30", "score": "high"}
                ], "total_shorts": 9}"""));

        assertThat(parsed.totalShorts()).isEqualTo(2);
        assertThat(parsed.shorts()).hasSize(2);
        ClipCandidate first = parsed.shorts().get(0);
        assertThat(first.title()).isEqualTo("Hook");
        assertThat(first.score()).isEqualTo(7);
        ClipCandidate second = parsed.shorts().get(1);
        assertThat(second.title()).isEqualTo(SchemaCoercer.FALLBACK_TITLE);
        assertThat(second.reason()).isEqualTo(SchemaCoercer.FALLBACK_REASON);
        assertThat(second.startTime()).isEqualTo(120.0);
        assertThat(second.endTime()).isEqualTo(150.0);
        assertThat(second.score()).isZero();
        assertThat(parsed.shorts()).allSatisfy(c -> assertThat(c.endTime()).isGreaterThan(c.startTime()));
    }

    @Test
    void singleObjectListBecomesOneElementList() throws Exception {
        ParsedShorts parsed = coercer.coerce(payload("{\"shorts\": {\"title\": \"Only\", \"start_time\": 1, \"end_time\": 20}}"));

        assertThat(parsed.shorts()).extracting(ClipCandidate::title).containsExactly("Only");
    }

    @Test
    void scalarListIsTreatedAsEmpty() throws Exception {
        assertThat(coercer.coerce(payload("{\"shorts\": \"none\"}")).isEmpty()).isTrue();
        assertThat(coercer.coerce(payload("{\"total_shorts\": 3}")).totalShorts()).isZero();
        assertThat(coercer.coerce(null).isEmpty()).isTrue();
    }

    @Test
    void unwrapsNestedItemsAndReparsesStringItems() throws Exception {
        ParsedShorts parsed = coercer.coerce(payload("""
                {"shorts": [
                  {"short": {"title": "Wrapped", "start_time": 5, "end_time": 25}},
                  {"candidate": {"title": "Also wrapped", "start": "0:40", "end": "1:05"}},
                  "{\\"title\\": \\"From text\\", \\"start_time\\": 70, \\"end_time\\": 95,}",
                  42
                ]}"""));

        assertThat(parsed.shorts()).extracting(ClipCandidate::title)
                .containsExactly("Wrapped", "Also wrapped", "From text");
        assertThat(parsed.shorts().get(1).startTime()).isEqualTo(40.0);
        assertThat(parsed.shorts().get(1).endTime()).isEqualTo(65.0);
    }

    @Test
    void blankTextFieldsFallBack() throws Exception {
        ParsedShorts parsed = coercer.coerce(payload(
                "{\"shorts\": [{\"title\": \"  \", \"reason\": null, \"start_time\": 1, \"end_time\": 20, \"score\": 3}]}"));

        assertThat(parsed.shorts().get(0).title()).isEqualTo(SchemaCoercer.FALLBACK_TITLE);
        assertThat(parsed.shorts().get(0).reason()).isEqualTo(SchemaCoercer.FALLBACK_REASON);
        assertThat(parsed.shorts().get(0).score()).isEqualTo(3);
    }

    private ObjectNode payload(String json) throws Exception {
        return (ObjectNode) om.readTree(json);
    }
}
