package com.sailfish.retrydispatch.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordIdSetConverterTest {

    private final RecordIdSetConverter recordIds = new RecordIdSetConverter();
    private final StatusCodeSetConverter statusCodes = new StatusCodeSetConverter();

    @Test
    void emptyRetryIdsAreStoredAsNull() {
        assertThat(recordIds.convertToDatabaseColumn(Collections.emptySet())).isNull();
        assertThat(recordIds.convertToDatabaseColumn(null)).isNull();
        assertThat(recordIds.convertToEntityAttribute(null)).isEmpty();
    }

    @Test
    void readsIdsInStoredOrderIgnoringBlanksAndDuplicates() {
        assertThat(recordIds.convertToEntityAttribute("B-2, A-1,,B-2 ")).containsExactly("B-2", "A-1");
        assertThat(recordIds.convertToDatabaseColumn(new LinkedHashSet<>(Arrays.asList("Z", "A")))).isEqualTo("Z,A");
    }

    @Test
    void statusCodesAreStoredSorted() {
        assertThat(statusCodes.convertToDatabaseColumn(new LinkedHashSet<>(Arrays.asList(503, 429, 502)))).isEqualTo("429,502,503");
        assertThat(statusCodes.convertToEntityAttribute(" 503,429 ")).containsExactly(429, 503);
    }

    @Test
    void invalidStatusCodeIsRejected() {
        assertThatThrownBy(() -> statusCodes.convertToEntityAttribute("429,abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abc");
    }
}
