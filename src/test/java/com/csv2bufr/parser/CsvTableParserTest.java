package com.csv2bufr.parser;

import com.csv2bufr.exception.MalformedRowException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.Row;
import com.csv2bufr.model.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CsvTableParser.
 */
class CsvTableParserTest {

    private final CsvTableParser parser = new CsvTableParser();

    @Test
    void testHeaderAndTypedCells() {
        CsvTable table = parser.parse("""
                station, temp ,name
                1,10.5,Oslo
                """);

        assertThat(table.getColumns()).containsExactly("station", "temp", "name");
        Row row = table.toRow(table.getRecords().get(0));
        assertThat(row.get("station")).isEqualTo(FieldValue.of(1L));
        assertThat(row.get("temp")).isEqualTo(FieldValue.of(10.5));
        assertThat(row.get("name")).isEqualTo(FieldValue.of("Oslo"));
    }

    @Test
    void testQuotedNumberStaysString() {
        CsvTable table = parser.parse("id\n\"0042\"\n");

        FieldValue value = table.getRecords().get(0).getCells().get(0);
        assertThat(value.getKind()).isEqualTo(ValueKind.STRING);
        assertThat(value.asText()).isEqualTo("0042");
    }

    @Test
    void testEmptyUnquotedCellIsMissing() {
        CsvTable table = parser.parse("a,b\n1,\n");

        assertThat(table.getRecords().get(0).getCells().get(1).isMissing()).isTrue();
    }

    @Test
    void testEmptyQuotedCellIsEmptyString() {
        CsvTable table = parser.parse("a,b\n1,\"\"\n");

        FieldValue value = table.getRecords().get(0).getCells().get(1);
        assertThat(value.getKind()).isEqualTo(ValueKind.STRING);
        assertThat(value.asText()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "42, INTEGER",
            "-7, INTEGER",
            "3.14, FLOAT",
            "1e3, FLOAT",
            ".5, FLOAT",
            "NaN, STRING",
            "NA, STRING",
            "abc, STRING"
    })
    void testUnquotedTokenTyping(String text, ValueKind expected) {
        CsvToken token = new CsvToken(CsvToken.TokenType.UNQUOTED, text, 1, 1);

        assertThat(CsvTableParser.toValue(token).getKind()).isEqualTo(expected);
    }

    @Test
    void testBlankLinesSkippedAndLineNumbersKept() {
        CsvTable table = parser.parse("temp\n\n10\n\n200\n");

        assertThat(table.getRecords()).hasSize(2);
        assertThat(table.getRecords()).extracting(CsvTable.CsvRecord::getLine).containsExactly(3, 5);
    }

    @Test
    void testEmptyCellInSingleColumnFileReadsAsBlankLine() {
        CsvTable table = parser.parse("temp\n10\n\n20\n");

        assertThat(table.getRecords()).extracting(CsvTable.CsvRecord::getLine).containsExactly(2, 4);
    }

    @Test
    void testQuotedEmptyCellInSingleColumnFileIsKept() {
        CsvTable table = parser.parse("temp\n10\n\"\"\n20\n");

        assertThat(table.getRecords()).hasSize(3);
    }

    @Test
    void testColumnCountMismatchIsMalformed() {
        CsvTable table = parser.parse("a,b\n1,2,3\n");

        assertThatThrownBy(() -> table.toRow(table.getRecords().get(0)))
                .isInstanceOfSatisfying(MalformedRowException.class, e -> {
                    assertThat(e.getLineNumber()).isEqualTo(2);
                    assertThat(e.getExpectedColumns()).isEqualTo(2);
                    assertThat(e.getActualColumns()).isEqualTo(3);
                });
    }

    @Test
    void testEmptyDocument() {
        CsvTable table = parser.parse("");

        assertThat(table.getColumns()).isEmpty();
        assertThat(table.isEmpty()).isTrue();
    }
}
