package com.titlesearch.pipeline.adapter;

import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.util.DocumentTypeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses recorder search result pages. Tables are read row by row; when a header row is present
 * its labels decide which cell holds which field, otherwise cells are sniffed for links, document
 * type keywords and dates.
 */
public final class RecorderResultParser {
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
        DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.US),
        DateTimeFormatter.ofPattern("MM-dd-yyyy", Locale.US),
        DateTimeFormatter.ofPattern("MM/dd/yy", Locale.US),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US)
    );
    private static final Pattern NAME_SEPARATORS = Pattern.compile("\\s*(?:;|\\bAND\\b|&|/)\\s*", Pattern.CASE_INSENSITIVE);
    private static final List<String> TYPE_HINTS = List.of(
        "deed", "mortgage", "lien", "trust", "release", "satisfaction", "judgment", "easement", "lis pendens", "plat"
    );

    private RecorderResultParser() {
    }

    public static List<SearchResult> parse(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
        Map<String, SearchResult> results = new LinkedHashMap<>();
        for (Element table : doc.select("table")) {
            parseTable(table, results);
        }
        if (results.isEmpty()) {
            for (Element block : doc.select(".result, .record, [class*=result], [class*=record]")) {
                SearchResult result = parseBlock(block);
                if (result != null) {
                    results.putIfAbsent(result.instrumentNumber(), result);
                }
            }
        }
        return List.copyOf(results.values());
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = tryParse(trimmed, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDate tryParse(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    public static List<String> parseNames(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(NAME_SEPARATORS.split(value.trim()))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
    }

    private static void parseTable(Element table, Map<String, SearchResult> results) {
        Elements rows = table.select("tr");
        if (rows.isEmpty()) {
            return;
        }
        Map<String, Integer> columns = headerColumns(rows.get(0));
        boolean hasHeader = !columns.isEmpty() || !rows.get(0).select("th").isEmpty();
        int start = hasHeader ? 1 : 0;
        for (int i = start; i < rows.size(); i++) {
            SearchResult result = parseRow(rows.get(i), columns);
            if (result != null) {
                results.putIfAbsent(result.instrumentNumber(), result);
            }
        }
    }

    private static Map<String, Integer> headerColumns(Element headerRow) {
        Map<String, Integer> columns = new HashMap<>();
        Elements cells = headerRow.select("th, td");
        for (int i = 0; i < cells.size(); i++) {
            String label = cells.get(i).text().toLowerCase(Locale.ROOT);
            if (label.contains("grantor") || label.contains("seller")) {
                columns.putIfAbsent("grantor", i);
            } else if (label.contains("grantee") || label.contains("buyer")) {
                columns.putIfAbsent("grantee", i);
            } else if (label.contains("type")) {
                columns.putIfAbsent("type", i);
            } else if (label.contains("date") || label.contains("recorded")) {
                columns.putIfAbsent("date", i);
            } else if (label.contains("book")) {
                columns.putIfAbsent("bookPage", i);
            } else if (label.contains("status")) {
                columns.putIfAbsent("status", i);
            }
        }
        return columns;
    }

    private static SearchResult parseRow(Element row, Map<String, Integer> columns) {
        Elements cells = row.select("td");
        if (cells.size() < 2 || row.text().isBlank()) {
            return null;
        }

        String instrumentNumber = null;
        String downloadUrl = null;
        DocumentType documentType = DocumentType.OTHER;
        LocalDate recordingDate = null;

        for (Element cell : cells) {
            String text = cell.text().trim();
            Element link = cell.selectFirst("a[href]");
            if (link != null && instrumentNumber == null && !text.isEmpty()) {
                instrumentNumber = text;
                downloadUrl = link.absUrl("href");
                if (downloadUrl.isEmpty()) {
                    downloadUrl = link.attr("href");
                }
            }
            String lower = text.toLowerCase(Locale.ROOT);
            if (!columns.containsKey("type") && TYPE_HINTS.stream().anyMatch(lower::contains)) {
                documentType = DocumentTypeClassifier.classify(text);
            }
            if (!columns.containsKey("date") && recordingDate == null && text.length() <= 12
                && (text.contains("/") || text.contains("-"))) {
                recordingDate = parseDate(text);
            }
        }

        if (columns.containsKey("type")) {
            documentType = DocumentTypeClassifier.classify(cellText(cells, columns.get("type")));
        }
        if (columns.containsKey("date")) {
            recordingDate = parseDate(cellText(cells, columns.get("date")));
        }
        if (instrumentNumber == null) {
            String first = cells.get(0).text().trim();
            if (first.length() > 3) {
                instrumentNumber = first;
            }
        }
        if (instrumentNumber == null) {
            return null;
        }

        Map<String, String> attributes = new HashMap<>();
        if (columns.containsKey("status")) {
            attributes.put("status", cellText(cells, columns.get("status")));
        }
        return new SearchResult(
            instrumentNumber,
            documentType,
            recordingDate,
            parseNames(cellText(cells, columns.get("grantor"))),
            parseNames(cellText(cells, columns.get("grantee"))),
            downloadUrl,
            emptyToNull(cellText(cells, columns.get("bookPage"))),
            attributes
        );
    }

    private static SearchResult parseBlock(Element block) {
        Element link = block.selectFirst("a[href]");
        if (link == null || link.text().isBlank()) {
            return null;
        }
        return new SearchResult(
            link.text().trim(),
            DocumentTypeClassifier.classify(block.text()),
            null,
            List.of(),
            List.of(),
            link.absUrl("href").isEmpty() ? link.attr("href") : link.absUrl("href"),
            null,
            Map.of()
        );
    }

    private static String cellText(Elements cells, Integer index) {
        if (index == null || index < 0 || index >= cells.size()) {
            return "";
        }
        return cells.get(index).text().trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
