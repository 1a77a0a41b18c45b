package io.notify4j.internal;

import io.notify4j.core.Digest;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a {@link Digest} as Telegram HTML.
 */
final class DigestFormatter {

    static final int MAX_TEXT_LENGTH = 40;

    private static final String RULE = "━━━━━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\s*[\\r\\n]+\\s*");
    private static final Pattern HH_MM = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");

    private DigestFormatter() {
    }

    static String format(Digest digest) {
        StringBuilder sb = new StringBuilder();
        sb.append("📆 <b>Today's notifications</b>\n");
        sb.append("📅 ").append(digest.date()).append(" (")
                .append(digest.date().getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .append(")\n");
        sb.append(RULE).append('\n');

        List<Digest.Item> events = digest.events();
        if (!events.isEmpty()) {
            sb.append("\n🗓 <b>Events</b>\n\n");
            for (Digest.Item ev : events) {
                sb.append("📌 <b>").append(escape(ev.name())).append("</b>");
                if (ev.eventTime() != null) {
                    sb.append(" ⏰ ").append(displayTime(ev));
                }
                appendText(sb, ev);
                sb.append('\n');
            }
        }

        List<Digest.Item> alarms = digest.alarms();
        if (!alarms.isEmpty()) {
            sb.append("\n🔔 <b>Alarms</b> (").append(alarms.size()).append(")\n");
            for (int i = 0; i < alarms.size(); i++) {
                Digest.Item item = alarms.get(i);
                sb.append('\n').append(i + 1).append(". <b>").append(escape(item.name())).append("</b>\n");
                sb.append("   ⏰ ").append(displayTime(item));
                appendText(sb, item);
                sb.append('\n');
            }
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("Total <b>").append(digest.total()).append("</b> (alarms ")
                .append(alarms.size()).append(", events ").append(events.size()).append(')');
        return sb.toString();
    }

    static String displayTime(Digest.Item item) {
        if (item.eventTime() != null && !item.eventTime().isBlank()) {
            Matcher m = HH_MM.matcher(item.eventTime().trim());
            if (!m.matches()) {
                return escape(item.eventTime());
            }
            return TIME.format(LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }
        return item.time() == null ? "" : TIME.format(item.time());
    }

    /**
     * Single line of plain text: tags removed, entities decoded, cut to {@value #MAX_TEXT_LENGTH}
     * code points with a trailing ellipsis. The result is unescaped; pass it through {@link #escape}.
     */
    static String oneLine(String text) {
        if (text == null) {
            return "";
        }
        String plain = unescape(TAG.matcher(text).replaceAll(""));
        plain = LINE_BREAKS.matcher(plain).replaceAll(" ").trim();
        if (plain.codePointCount(0, plain.length()) <= MAX_TEXT_LENGTH) {
            return plain;
        }
        return plain.substring(0, plain.offsetByCodePoints(0, MAX_TEXT_LENGTH)) + "…";
    }

    static String escape(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    // &amp; last so "&amp;lt;" stays a literal "&lt;"
    static String unescape(String s) {
        return s.replace("&lt;", "<").replace("&gt;", ">").replace("&quot;", "\"")
                .replace("&#39;", "'").replace("&amp;", "&");
    }

    private static void appendText(StringBuilder sb, Digest.Item item) {
        String line = oneLine(item.text());
        if (!line.isEmpty()) {
            sb.append("\n   ").append(escape(line));
        }
    }
}
