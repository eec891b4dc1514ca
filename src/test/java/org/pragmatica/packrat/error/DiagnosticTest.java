package org.pragmatica.packrat.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.tree.LineIndex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for diagnostic severities and rendering.
 */
class DiagnosticTest {

    @Test
    void severity_followsErrorCodeLevel() {
        assertEquals(Diagnostic.Severity.INFO, ErrorCode.RESUME_NOTICE.severity());
        assertEquals(Diagnostic.Severity.WARNING, ErrorCode.OPTIONAL_REDUNDANTLY_NESTED_WARNING.severity());
        assertEquals(Diagnostic.Severity.ERROR, ErrorCode.MANDATORY_CONTINUATION.severity());
        assertTrue(ErrorCode.RECURSION_DEPTH_LIMIT_HIT.isError());
        assertFalse(ErrorCode.CAPTURE_STACK_NOT_EMPTY_WARNING.isError());
    }

    @Test
    void format_rendersRustStyleWithUnderline() {
        var source = "let x = 42.;\nnext";
        var diagnostic = Diagnostic.of(ErrorCode.MANDATORY_CONTINUATION,
                                       "'/\\d+/' expected by parser 'number', but »;...« found instead!", 11)
                                   .withHelp("add digits after the dot");

        var formatted = diagnostic.format(source, "input.txt");

        assertThat(formatted).startsWith("error[1010]: '/\\d+/' expected by parser 'number'");
        assertThat(formatted).contains("--> input.txt:1:12");
        assertThat(formatted).contains("1 | let x = 42.;");
        assertThat(formatted).contains("  |            ^");
        assertThat(formatted).contains("= help: add digits after the dot");
    }

    @Test
    void format_withoutFilename_omitsIt() {
        var formatted = Diagnostic.of(ErrorCode.PARSER_STOPPED_BEFORE_END, "stopped", 3).format("ab\ncd", null);

        assertThat(formatted).contains("  --> 2:1");
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = Diagnostic.of(ErrorCode.RESUME_NOTICE, "resuming", 3);

        assertEquals("2:1: notice (50): resuming", diagnostic.formatSimple(LineIndex.of("ab\ncd")));
    }

    @Test
    void toString_includesPositionAndCode() {
        assertEquals("7: warning (340): zero", Diagnostic.of(ErrorCode.ZERO_LENGTH_CAPTURE_POSSIBLE_WARNING, "zero", 7)
                                                           .toString());
    }
}
