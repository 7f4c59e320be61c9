package com.ecowatch.core.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Best-effort HTML helpers for scraped bulletin and feed pages.
 *
 * <p>Nothing here throws on malformed markup: unreadable input degrades to empty text or an
 * empty row list.
 */
public final class HtmlUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DASHES = Pattern.compile("[\\u2013\\u2014]");
    private static final Pattern ROW_TAG = Pattern.compile("<tr[\\s>]", Pattern.CASE_INSENSITIVE);

    private HtmlUtils() {
    }

    /**
     * Decodes entities, drops script and style blocks, strips the remaining tags and collapses
     * whitespace. {@code null} or blank input yields an empty string.
     */
    public static String normalizeText(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        Document fragment = Jsoup.parseBodyFragment(raw);
        return textOf(fragment.body());
    }

    /**
     * Extracts every table row in document order as the list of its normalized cell texts.
     * Rows without any {@code td} or {@code th} cell are skipped.
     */
    public static List<List<String>> extractTableRows(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html);
        Elements rows = document.select("tr");
        if (rows.isEmpty() && ROW_TAG.matcher(html).find()) {
            // Rows outside a table are dropped by the HTML5 tree builder.
            rows = Jsoup.parse("<table>" + html + "</table>").select("tr");
        }

        List<List<String>> extracted = new ArrayList<>();
        for (Element row : rows) {
            List<String> cells = new ArrayList<>();
            for (Element child : row.children()) {
                String tag = child.tagName().toLowerCase(Locale.ROOT);
                if (tag.equals("td") || tag.equals("th")) {
                    cells.add(textOf(child));
                }
            }
            if (!cells.isEmpty()) {
                extracted.add(List.copyOf(cells));
            }
        }
        return List.copyOf(extracted);
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }

    private static String textOf(Element element) {
        Element copy = element.clone();
        copy.select("script, style").remove();
        String text = DASHES.matcher(copy.text()).replaceAll("-");
        return collapseWhitespace(text);
    }
}
