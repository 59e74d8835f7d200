package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.util.MessageTemplateRenderer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class MessageTemplateRendererTest {

    private MessageTemplateRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new MessageTemplateRenderer(Clock.fixed(Instant.parse("2024-03-05T08:04:09Z"), ZoneOffset.UTC),
                new SchedulerProperties());
    }

    @Test
    void testRender_DateAndTime() {
        assertEquals("Report 2024-03-05 08:04:09", renderer.render("Report {{date}} {{time}}"));
    }

    @Test
    void testRender_AllFields() {
        // Given
        String template = "{{datetime}}|{{year}}|{{month}}|{{day}}|{{hour}}|{{minute}}|{{second}}|{{weekday}}|{{timestamp}}";

        // When
        String result = renderer.render(template);

        // Then
        assertEquals("2024-03-05 08:04:09|2024|03|05|08|04|09|Tuesday|1709625849", result);
    }

    @Test
    void testRender_UnknownPlaceholderUntouched() {
        assertEquals("Hi {{name}} on 2024-03-05", renderer.render("Hi {{name}} on {{date}}"));
    }

    @Test
    void testRender_ToleratesInnerSpaces() {
        assertEquals("2024", renderer.render("{{ year }}"));
    }

    @Test
    void testRender_Idempotent() {
        // Given
        String once = renderer.render("Daily {{date}} {{unknown}} $5 \\o/");

        // When
        String twice = renderer.render(once);

        // Then
        assertEquals(once, twice);
        assertEquals("Daily 2024-03-05 {{unknown}} $5 \\o/", once);
    }

    @Test
    void testRender_NullAndPlainText() {
        assertNull(renderer.render(null));
        assertEquals("plain", renderer.render("plain"));
    }
}
