package com.unit.catalog.fetch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts availability from a unit detail page.
 *
 * <p>The page is an accordion: each panel is one era (name in the heading link, with an
 * optional year range in parentheses) holding a table with one faction link per row.</p>
 */
public class AvailabilityParser {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityParser.class);

    public List<AvailabilityNote> parse(String html) {
        Document document = Jsoup.parse(html);
        List<AvailabilityNote> notes = new ArrayList<>();

        for (Element panel : document.select(".panel.panel-default")) {
            Element heading = panel.selectFirst(".panel-heading .media-body a");
            Element body = panel.selectFirst(".panel-body");
            if (heading == null || body == null) {
                continue;
            }
            String eraName = stripYearRange(heading.text());
            for (Element row : body.select("tbody tr")) {
                Element link = row.selectFirst("a");
                if (link == null) {
                    continue;
                }
                String factionName = link.text().trim();
                if (!factionName.isEmpty()) {
                    notes.add(new AvailabilityNote(eraName, factionName));
                }
            }
        }

        if (notes.isEmpty() && document.selectFirst("h2") != null) {
            log.warn("detail.availability.empty title='{}'", document.selectFirst("h2").text());
        }
        return notes;
    }

    /**
     * {@code "Star League (2571 - 2780)"} becomes {@code "Star League"}.
     */
    static String stripYearRange(String raw) {
        String name = raw.trim();
        int paren = name.indexOf('(');
        return paren >= 0 ? name.substring(0, paren).trim() : name;
    }
}
