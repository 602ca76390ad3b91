package com.alibaba.cloud.ai.organizer.cache.codec;

import com.alibaba.cloud.ai.organizer.cache.exception.CacheCorruptionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonStageCodecTest {

    private final ObjectMapper mapper = CacheJson.deterministicMapper();

    @Test
    void decodesWhatItEncoded() {
        JacksonStageCodec<Sample> codec = JacksonStageCodec.of(mapper, "sample", 1, Sample.class);
        Sample sample = new Sample("report.pdf", 3, List.of("a", "b"));

        assertThat(codec.decode(codec.encode(sample))).isEqualTo(sample);
    }

    @Test
    void encodingIsDeterministicForMaps() {
        JacksonStageCodec<Map<String, String>> codec = new JacksonStageCodec<>(mapper, "map", 1,
                mapper.getTypeFactory().constructMapType(Map.class, String.class, String.class));
        Map<String, String> ordered = new TreeMap<>(Map.of("b", "2", "a", "1"));
        Map<String, String> unordered = new java.util.LinkedHashMap<>();
        unordered.put("b", "2");
        unordered.put("a", "1");

        assertThat(codec.encode(unordered)).isEqualTo(codec.encode(ordered));
    }

    @Test
    void versionMismatchIsCorruption() {
        JacksonStageCodec<Sample> v1 = JacksonStageCodec.of(mapper, "sample", 1, Sample.class);
        JacksonStageCodec<Sample> v2 = JacksonStageCodec.of(mapper, "sample", 2, Sample.class);
        byte[] payload = v1.encode(new Sample("x", 1, List.of()));

        assertThatThrownBy(() -> v2.decode(payload)).isInstanceOf(CacheCorruptionException.class);
    }

    @Test
    void schemaMismatchIsCorruption() {
        JacksonStageCodec<Sample> scan = JacksonStageCodec.of(mapper, "scan-result", 1, Sample.class);
        JacksonStageCodec<Sample> move = JacksonStageCodec.of(mapper, "move-result", 1, Sample.class);
        byte[] payload = scan.encode(new Sample("x", 1, List.of()));

        assertThatThrownBy(() -> move.decode(payload)).isInstanceOf(CacheCorruptionException.class);
    }

    @Test
    void malformedPayloadIsCorruption() {
        JacksonStageCodec<Sample> codec = JacksonStageCodec.of(mapper, "sample", 1, Sample.class);

        assertThatThrownBy(() -> codec.decode("{\"schema\":".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CacheCorruptionException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CacheCorruptionException.class);
        assertThatThrownBy(() -> codec.decode(
                "{\"schema\":\"sample\",\"version\":1,\"data\":{\"count\":\"many\"}}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CacheCorruptionException.class);
    }

    @Test
    void listCodecKeepsOrder() {
        JacksonStageCodec<List<Sample>> codec = JacksonStageCodec.listOf(mapper, "samples", 1, Sample.class);
        List<Sample> samples = List.of(new Sample("b", 2, List.of()), new Sample("a", 1, List.of()));

        assertThat(codec.decode(codec.encode(samples))).containsExactlyElementsOf(samples);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class Sample {

        private String name;

        private int count;

        private List<String> tags;
    }
}
