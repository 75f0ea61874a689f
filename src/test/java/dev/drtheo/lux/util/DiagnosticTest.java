package dev.drtheo.lux.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticTest {

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = { "LEXICAL", "SYNTAX", "RESOLUTION" })
    public void staticKindsFormatWithLocation(ErrorKind kind) {
        assertTrue(kind.isStatic());
        assertEquals(65, kind.exitCode());
        assertEquals("[line 7] Error at 'x': oops", new Diagnostic(kind, 7, " at 'x'", "oops").format());
    }

    @Test
    public void runtimeKindPutsTheLineBelowTheMessage() {
        assertFalse(ErrorKind.RUNTIME.isStatic());
        assertEquals(70, ErrorKind.RUNTIME.exitCode());
        assertEquals("Operand must be a number.\n[line 3]",
                new Diagnostic(ErrorKind.RUNTIME, 3, "", "Operand must be a number.").format());
    }
}
