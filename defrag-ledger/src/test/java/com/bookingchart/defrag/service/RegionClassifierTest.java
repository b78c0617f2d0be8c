package com.bookingchart.defrag.service;

import com.bookingchart.defrag.model.PropertyRecord;
import com.bookingchart.defrag.model.RegionCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

@DisplayName("RegionClassifier")
class RegionClassifierTest {

    private final RegionClassifier classifier = new RegionClassifier();

    private static PropertyRecord record(String code, String name) {
        return PropertyRecord.builder().code(code).name(name).build();
    }

    @Nested
    @DisplayName("explicit field")
    class ExplicitField {

        @Test
        @DisplayName("state attribute wins over name and code")
        void stateAttributeWins() {
            PropertyRecord record = PropertyRecord.builder()
                    .code("NSYD")
                    .name("Sydney Harbour Apartments")
                    .attribute("state", "VIC")
                    .build();

            assertThat(classifier.classify(record)).contains(RegionCode.VIC);
        }

        @Test
        @DisplayName("lookup is case-insensitive and falls through unknown values")
        void caseInsensitiveAndFallsThrough() {
            PropertyRecord record = PropertyRecord.builder()
                    .code("ZZ1")
                    .name("Nowhere Lodge")
                    .attribute("state", "Narnia")
                    .attribute("region", " qld ")
                    .build();

            assertThat(classifier.classify(record)).contains(RegionCode.QLD);
        }
    }

    @Nested
    @DisplayName("name keywords")
    class NameKeywords {

        @Test
        @DisplayName("Alice Springs resolves to NT")
        void aliceSprings() {
            assertThat(classifier.classify(record("CALI", "Alice Springs Lodge"))).contains(RegionCode.NT);
        }

        @Test
        @DisplayName("a place name overrides the code prefix")
        void keywordBeatsPrefix() {
            // 'C' would map to NT
            assertThat(classifier.classify(record("CBH", "Cairns Beach House"))).contains(RegionCode.QLD);
        }

        @Test
        @DisplayName("full state names resolve")
        void fullStateName() {
            assertThat(classifier.classify(record("ZZ2", "Victoria Cottage"))).contains(RegionCode.VIC);
            assertThat(classifier.classify(record("ZZ3", "Western Australia Retreat"))).contains(RegionCode.WA);
        }

        @Test
        @DisplayName("earlier keywords take priority")
        void priorityOrder() {
            assertThat(classifier.classify(record("ZZ4", "Sydney to Perth Tours"))).contains(RegionCode.NSW);
        }

        @Test
        @DisplayName("abbreviations only match whole words")
        void abbreviationsWholeWordOnly() {
            assertThat(classifier.fromName("Salty Waters")).isEmpty();
            assertThat(classifier.fromName("Beach House SA")).contains(RegionCode.SA);
            assertThat(classifier.fromName("Lodge (TAS)")).contains(RegionCode.TAS);
        }
    }

    @Nested
    @DisplayName("code prefix")
    class CodePrefix {

        @Test
        @DisplayName("first character of the code is the last resort")
        void prefixFallback() {
            assertThat(classifier.classify(record("v123", "Seaside"))).contains(RegionCode.VIC);
            assertThat(classifier.classify(record("WMR", "Seaside"))).contains(RegionCode.WA);
        }

        @Test
        @DisplayName("nothing matches, unresolved")
        void unresolved() {
            assertThat(classifier.classify(record("ZZZ", "Nowhere"))).isEmpty();
        }

        @Test
        @DisplayName("null record is unresolved")
        void nullRecord() {
            assertThat(classifier.classify(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("classifyAll")
    class ClassifyAll {

        @Test
        @DisplayName("keeps input order")
        void keepsOrder() {
            Map<String, Optional<RegionCode>> result = classifier.classifyAll(List.of(
                    record("ZZZ", "Nowhere"),
                    record("CALI", "Alice Springs Lodge"),
                    record("HOB1", "Hobart Waterfront")));

            assertThat(result.keySet()).containsExactly("ZZZ", "CALI", "HOB1");
            assertThat(result.get("ZZZ")).isEmpty();
            assertThat(result.get("CALI")).contains(RegionCode.NT);
            assertThat(result.get("HOB1")).contains(RegionCode.TAS);
        }

        @Test
        @DisplayName("one failing record does not abort the rest")
        void failureIsIsolated() {
            RegionClassifier failing = spy(new RegionClassifier());
            PropertyRecord bad = record("BAD", "Broken");
            doThrow(new IllegalStateException("boom")).when(failing).classify(bad);

            Map<String, Optional<RegionCode>> result = failing.classifyAll(Arrays.asList(
                    bad,
                    record("VMEL", "Melbourne Loft")));

            assertThat(result.get("BAD")).isEmpty();
            assertThat(result.get("VMEL")).contains(RegionCode.VIC);
        }
    }
}
