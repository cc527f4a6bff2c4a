package com.example.usagemeter.service;

import com.example.usagemeter.config.UsageMeterProperties;
import com.example.usagemeter.model.UsageAction;
import com.example.usagemeter.model.UsageEvent;
import com.example.usagemeter.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UsageEventSanitizerTest {

    private UsageEventSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        UsageMeterProperties properties = TestFixtures.properties();
        properties.getTracker().setMaxMetadataStringLength(20);
        sanitizer = new UsageEventSanitizer(properties);
    }

    @Test
    void shouldStripScriptBlocksAndTags() {
        assertEquals("hello world", sanitizer.sanitizeText("<script type=\"text/javascript\">steal()</script>hello <b>world</b>"));
    }

    @Test
    void shouldStripScriptSchemesAndHandlers() {
        assertEquals("alert(1)", sanitizer.sanitizeText("javascript:alert(1)"));
        assertEquals(" x", sanitizer.sanitizeText("onload= x"));
    }

    @Test
    void shouldRemoveNestedAndEncodedTraversal() {
        assertEquals("etc/passwd", sanitizer.sanitizeText("../../../etc/passwd"));
        assertEquals("etc/passwd", sanitizer.sanitizeText("....//etc/passwd"));
        assertEquals("windows", sanitizer.sanitizeText("..\\..\\windows"));
        assertEquals("etc", sanitizer.sanitizeText("%2e%2e%2fetc"));
    }

    @Test
    void shouldTruncateLongStrings() {
        assertEquals(20, sanitizer.sanitizeText("a".repeat(50)).length());
    }

    @Test
    void shouldLeaveCleanTextAndNullsAlone() {
        assertEquals("report-2024.pdf", sanitizer.sanitizeText("report-2024.pdf"));
        assertNull(sanitizer.sanitizeText(null));
    }

    @Test
    void shouldSanitizeNestedMetadataAndKeepNonStrings() {
        UsageEvent event = UsageEvent.builder()
                .tenantId("t1")
                .action(UsageAction.UPLOAD)
                .resourceId("<i>doc</i>")
                .metadata("size", 1024)
                .metadata("tags", List.of("<b>a</b>", "b"))
                .metadata("nested", Map.of("path", "../secret"))
                .build();

        UsageEvent clean = sanitizer.sanitize(event);

        assertEquals("doc", clean.getResourceId());
        assertEquals(1024, clean.getMetadata().get("size"));
        assertEquals(List.of("a", "b"), clean.getMetadata().get("tags"));
        assertEquals(Map.of("path", "secret"), clean.getMetadata().get("nested"));
    }
}
