package org.formulafmt;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import au.com.origin.snapshots.Expect;
import au.com.origin.snapshots.junit5.SnapshotExtension;

import org.junit.jupiter.api.extension.ExtendWith;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import java.util.*;

@ExtendWith({SnapshotExtension.class})
class FormattedOutputSnapshotTest {
    private Expect expect;

    private static String readResource(String name) {
        try (InputStream in = FormattedOutputSnapshotTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, name + " is missing from the test classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException(name + " couldn't be read", e);
        }
    }

    private static List<String> sampleFormulas() {
        var formulas = new ArrayList<String>();
        for (var line : Positions.splitLines(readResource("formulas.txt"))) {
            if (!line.isBlank()) {
                formulas.add(line.startsWith("=") ? line.substring(1) : line);
            }
        }
        return formulas;
    }

    private static String formatAll(FormatOptions options) {
        var sb = new StringBuilder();
        for (var formula : sampleFormulas()) {
            var formatted = Formatter.format(List.of(formula), options);
            sb.append("=").append(String.join("\n", formatted)).append("\n");
        }
        return sb.toString();
    }

    @Test void defaultWidth() {
        var formatted = formatAll(FormatOptions.defaults());

        assertEquals(readResource("formulas-width80.txt"), formatted);
        expect
            .scenario("width 80")
            .toMatchSnapshot(formatted);
    }

    @Test void narrowWidth() {
        var formatted = formatAll(FormatOptions.defaults().withLineWidth(20));

        assertEquals(readResource("formulas-width20.txt"), formatted);
        expect
            .scenario("width 20")
            .toMatchSnapshot(formatted);
    }
}
