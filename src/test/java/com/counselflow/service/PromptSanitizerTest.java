package com.counselflow.service;

import com.counselflow.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptSanitizerTest {

    private final PromptSanitizer sanitizer = new PromptSanitizer(100);

    @Test
    void testStripsScriptsAndHandlers() {
        String cleaned = sanitizer.sanitize("Review <script type=\"text/javascript\">steal()</script>this <b onclick=x>clause</b>");
        assertEquals("Review this <b x>clause</b>", cleaned);
    }

    @Test
    void testStripsCodeExecutionFragments() {
        assertEquals("run('x') and system('y')", sanitizer.sanitize("eval(run('x') and exec (system('y')"));
        assertEquals("alert(1)", sanitizer.sanitize("JavaScript:alert(1)"));
        assertEquals("a b", sanitizer.sanitize("a<iframe src=x>\nframe</iframe> b"));
    }

    @Test
    void testNestedFragmentsAreRemovedUntilNoneRemain() {
        assertEquals("Keep  terms", sanitizer.sanitize("Keep <scr<script></script>ipt>alert(1)</script> terms"));
        assertEquals("alert(1)", sanitizer.sanitize("javajavascript:script:alert(1)"));
    }

    @Test
    void testRemovesNullBytesAndTrims() {
        assertEquals("clause text", sanitizer.sanitize("  clause\u0000 text \n"));
    }

    @Test
    void testTruncatesToMaxLength() {
        assertEquals(100, sanitizer.sanitize("a".repeat(150)).length());
    }

    @Test
    void testEmptyPromptIsRejected() {
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(null));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize("   "));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize("<script>alert(1)</script>"));
    }
}
