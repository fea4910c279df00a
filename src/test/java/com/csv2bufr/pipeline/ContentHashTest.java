package com.csv2bufr.pipeline;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ContentHash.
 */
class ContentHashTest {

    @Test
    void testMd5Hex() {
        assertThat(ContentHash.of("abc".getBytes(StandardCharsets.US_ASCII)))
                .isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }

    @Test
    void testEmptyInput() {
        assertThat(ContentHash.of(new byte[0])).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    }
}
