package io.notify4j.internal;

import io.notify4j.core.Digest;
import io.notify4j.core.NotificationType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DigestFormatterTest {

    @Test
    void oneLineShouldStripTagsJoinLinesAndTruncate() {
        assertEquals("hello world", DigestFormatter.oneLine("<b>hello</b>\n  world"));
        assertEquals("a".repeat(40) + "…", DigestFormatter.oneLine("a".repeat(41)));
        assertEquals("a".repeat(40), DigestFormatter.oneLine("a".repeat(40)));
    }

    @Test
    void truncationShouldNotSplitSurrogatePairs() {
        String text = "a".repeat(39) + "😀😀";

        String line = DigestFormatter.oneLine(text);

        assertEquals("a".repeat(39) + "😀…", line);
    }

    @Test
    void existingEntitiesShouldNotBeEscapedTwice() {
        Digest digest = new Digest("C1", LocalDate.of(2026, 1, 7), List.of(),
                List.of(new Digest.Item("1", "sync", NotificationType.FIXED, LocalTime.of(9, 0), null,
                        "<b>R&amp;D</b> &lt;weekly&gt;")));

        String text = DigestFormatter.format(digest);

        assertThat(text)
                .contains("R&amp;D &lt;weekly&gt;")
                .doesNotContain("&amp;amp;");
    }

    @Test
    void namesShouldBeEscaped() {
        Digest digest = new Digest("C1", LocalDate.of(2026, 1, 7), List.of(),
                List.of(new Digest.Item("1", "R&D <sync>", NotificationType.FIXED, LocalTime.of(14, 5), null, "x < y")));

        String text = DigestFormatter.format(digest);

        assertThat(text)
                .contains("<b>R&amp;D &lt;sync&gt;</b>")
                .contains("⏰ 2:05 PM")
                .contains("x &lt; y")
                .contains("Total <b>1</b> (alarms 1, events 0)");
    }

    @Test
    void eventTimeShouldOverrideFireTime() {
        Digest.Item item = new Digest.Item("1", "lunch", NotificationType.MANUAL, LocalTime.of(11, 0), "12:30", "lunch");

        assertEquals("12:30 PM", DigestFormatter.displayTime(item));
    }

    @Test
    void digestShouldListEventsBeforeAlarms() {
        Digest digest = new Digest("C1", LocalDate.of(2026, 1, 11),
                List.of(new Digest.Item("e", "party", NotificationType.EVENT, null, null, "cake")),
                List.of(new Digest.Item("a", "gym", NotificationType.FIXED, LocalTime.of(7, 0), null, "gym")));

        String text = DigestFormatter.format(digest);

        assertThat(text).contains("2026-01-11 (Sun)");
        assertThat(text.indexOf("📌 <b>party</b>")).isLessThan(text.indexOf("1. <b>gym</b>"));
    }
}
