package org.gc.contentscheduler.service;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Cleans model output into storable post fields: a bare title, a markdown body
 * without wrapping fences or a duplicated heading, and a plain-text excerpt.
 */
@Component
public class ContentFormatter {

    static final int EXCERPT_LENGTH = 160;

    private static final Pattern OPENING_FENCE = Pattern.compile("^```\\w*\\n?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\n?```\\s*$");
    private static final Pattern LEADING_H1 = Pattern.compile("^\\s*#\\s+[^\\n]*\\n+");
    private static final Pattern HEADING_MARKS = Pattern.compile("(?m)^#{1,6}\\s*");
    private static final Pattern LINKS = Pattern.compile("!?\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern EMPHASIS = Pattern.compile("[*_`]+");
    private static final Pattern BLOCKQUOTE = Pattern.compile("(?m)^\\s*>\\s?");
    private static final Pattern LIST_MARKS = Pattern.compile("(?m)^\\s*(?:[-+]|\\d+\\.)\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String cleanTitle(String raw) {
        if (raw == null) {
            return "";
        }
        String title = raw.strip();
        // first non-empty line only
        int newline = title.indexOf('\n');
        if (newline > 0) {
            title = title.substring(0, newline).strip();
        }
        title = title.replaceFirst("^#+\\s*", "");
        title = title.replaceFirst("(?i)^title:\\s*", "");
        title = title.replaceAll("^[\"“”‘’']+|[\"“”‘’']+$", "");
        title = title.replaceAll("\\*{1,3}(.*?)\\*{1,3}", "$1");
        title = title.replaceAll("_{1,3}(.*?)_{1,3}", "$1");
        if (title.endsWith(".") && !title.endsWith("...")) {
            title = title.substring(0, title.length() - 1);
        }
        return title.strip();
    }

    public String formatBody(String rawMarkdown) {
        if (rawMarkdown == null) {
            return "";
        }
        String body = rawMarkdown.strip();
        if (body.startsWith("```")) {
            body = OPENING_FENCE.matcher(body).replaceFirst("");
            body = CLOSING_FENCE.matcher(body).replaceFirst("");
        }
        // the title is stored separately
        body = LEADING_H1.matcher(body).replaceFirst("");
        return body.strip();
    }

    public String extractExcerpt(String markdown) {
        String text = toPlainText(markdown);
        if (text.isEmpty() || text.length() <= EXCERPT_LENGTH) {
            return text;
        }

        int minLength = (int) (EXCERPT_LENGTH * 0.4);
        String candidate = text.substring(0, EXCERPT_LENGTH);

        for (int i = candidate.length() - 1; i >= minLength; i--) {
            char c = candidate.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                return candidate.substring(0, i + 1);
            }
        }

        int lastSpace = candidate.lastIndexOf(' ');
        if (lastSpace > minLength) {
            return candidate.substring(0, lastSpace) + "...";
        }
        return candidate + "...";
    }

    String toPlainText(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        String text = HEADING_MARKS.matcher(markdown).replaceAll("");
        text = LIST_MARKS.matcher(text).replaceAll("");
        text = BLOCKQUOTE.matcher(text).replaceAll("");
        text = LINKS.matcher(text).replaceAll("$1");
        text = EMPHASIS.matcher(text).replaceAll("");
        // models occasionally mix raw HTML into markdown
        text = Jsoup.parse(text).text();
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
