package com.example.tscribe_backend.util;

import com.example.tscribe_backend.dto.TranscriptSegment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SubtitleParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void json3EventsBecomeSegments() throws Exception {
        String json = """
                {"events":[
                  {"tStartMs":0,"dDurationMs":1500,"segs":[{"utf8":"Hallo"},{"utf8":" Welt"}]},
                  {"tStartMs":1500,"dDurationMs":500,"segs":[{"utf8":"\\n"}]},
                  {"tStartMs":2000},
                  {"tStartMs":2000,"dDurationMs":1000,"segs":[{"utf8":"zweite Zeile"}]}
                ]}
                """;

        List<TranscriptSegment> segments = SubtitleParser.parseJson3(mapper.readTree(json));

        assertThat(segments).containsExactly(
                new TranscriptSegment(0.0, 1.5, "Hallo Welt"),
                new TranscriptSegment(2.0, 3.0, "zweite Zeile"));
    }

    @Test
    void vttCuesWithTagsAndMultipleLines() {
        String vtt = """
                WEBVTT
                Kind: captions
                Language: en

                1
                00:00:01.000 --> 00:00:02.500 align:start position:0%
                <c>first</c> line
                continued

                00:05.250 --> 00:07.000
                second
                """;

        List<TranscriptSegment> segments = SubtitleParser.parseVtt(vtt);

        assertThat(segments).containsExactly(
                new TranscriptSegment(1.0, 2.5, "first line continued"),
                new TranscriptSegment(5.25, 7.0, "second"));
    }

    @Test
    void srtCommaMillisAndHours() {
        String srt = """
                1
                01:00:00,100 --> 01:00:01,200
                late cue
                """;

        List<TranscriptSegment> segments = SubtitleParser.parseVtt(srt);

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).start()).isCloseTo(3600.1, within(1e-6));
        assertThat(segments.get(0).end()).isCloseTo(3601.2, within(1e-6));
    }

    @Test
    void emptyInputGivesNoSegments() {
        assertThat(SubtitleParser.parseVtt(null)).isEmpty();
        assertThat(SubtitleParser.parseVtt("WEBVTT\n\n")).isEmpty();
        assertThat(SubtitleParser.parseJson3(null)).isEmpty();
    }
}
