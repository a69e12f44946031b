package com.analyzer.report.report;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TextTable.
 */
class TextTableTest {

    @Test
    void testAbbreviatedHeadersAreUnique() {
        TextTable table = new TextTable();
        table.declareColumn("package");
        table.declareColumn("AnalyzerError", true);
        table.declareColumn("AssignmentError", true);
        table.declareColumn("LinesOfCode", true);

        assertThat(table.getHeader()).containsExactly("package", "AE", "AE'", "LOC");
        assertThat(table.getAbbreviations()).containsExactly(
                entry("AE", "AnalyzerError"),
                entry("AE'", "AssignmentError"),
                entry("LOC", "LinesOfCode"));
        assertThat(table.getWidth(0)).isEqualTo(8);
        assertThat(table.getWidth(1)).isEqualTo(TextTable.MIN_WIDTH);
        assertThat(table.getWidth(3)).isEqualTo(TextTable.MIN_WIDTH);
    }

    @Test
    void testRenderAlignsFirstColumnLeftAndOthersRight() {
        TextTable table = new TextTable();
        table.declareColumn("name");
        table.declareColumn("Count", true);
        table.addHeader();
        table.addEntry("a");
        table.addEntry(3);

        assertThat(table.render()).isEqualTo("\n"
                + "name      C\n"
                + "a         3\n"
                + "\n"
                + "Where:\n"
                + "  C:    Count\n");
    }

    @Test
    void testLongEntryWidensColumn() {
        TextTable table = new TextTable();
        table.declareColumn("key");
        table.declareColumn("value");
        int before = table.getWidth(1);

        table.addEntry("k");
        table.addEntry("a-rather-long-value");

        assertThat(table.getWidth(1)).isGreaterThan(before).isEqualTo(20);
        assertThat(table.getWidth(0)).isEqualTo(TextTable.MIN_WIDTH);
    }

    @Test
    void testAllRowsHaveTheSameLengthEvenAfterEarlyDivider() {
        TextTable table = new TextTable();
        table.declareColumn("key");
        table.declareColumn("Value", true);
        table.addHeader();
        table.addEntry("x");
        table.addEntry(1);
        table.addDivider();
        table.addEntry("a-much-longer-key");
        table.addEntry(123456789);

        List<String> lines = tableLines(table.render());

        assertThat(lines).hasSize(4);
        assertThat(lines).extracting(String::length).containsOnly(18 + 11);
        assertThat(lines.get(2)).isEqualTo("-".repeat(18) + " " + "-".repeat(10));
    }

    @Test
    void testHeaderCanBeRepeated() {
        TextTable table = new TextTable();
        table.declareColumn("a");
        table.addHeader();
        table.addEntry("x");
        table.addHeader();

        assertThat(tableLines(table.render())).extracting(String::trim).containsExactly("a", "x", "a");
    }

    @Test
    void testDeclaringColumnAfterEntriesFails() {
        TextTable table = new TextTable();
        table.declareColumn("a");
        table.addEntry("x");

        assertThatThrownBy(() -> table.declareColumn("b"))
                .isInstanceOf(SchemaFrozenException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void testIncompleteRowIsRejected() {
        TextTable table = new TextTable();
        table.declareColumn("a");
        table.declareColumn("b");
        table.addEntry("x");

        assertThatThrownBy(table::render).isInstanceOf(MalformedTableException.class);
        assertThatThrownBy(table::addDivider).isInstanceOf(MalformedTableException.class);
        assertThatThrownBy(table::addHeader).isInstanceOf(MalformedTableException.class);
    }

    @Test
    void testEntriesNeedColumns() {
        assertThatThrownBy(() -> new TextTable().addEntry("x")).isInstanceOf(MalformedTableException.class);
    }

    @Test
    void testCsvUsesFullNamesOnce() {
        TextTable table = new TextTable();
        table.declareColumn("package");
        table.declareColumn("TypeError", true);
        table.addHeader();
        table.addEntry("a,b");
        table.addEntry(1);
        table.addDivider();
        table.addHeader();
        table.addEntry("say \"hi\"");
        table.addEntry(2);

        assertThat(table.renderCsv()).isEqualTo("package,TypeError\n\"a,b\",1\n\"say \"\"hi\"\"\",2\n");
    }

    static List<String> tableLines(String rendered) {
        List<String> lines = new ArrayList<>();
        String[] all = rendered.split("\n", -1);
        for (int i = 1; i < all.length && !all[i].isEmpty(); i++) {
            lines.add(all[i]);
        }
        return lines;
    }
}
