package com.leadharvest.scrape.extract;

import com.leadharvest.scrape.model.AttrSelector;
import com.leadharvest.scrape.model.FieldSpec;
import com.leadharvest.scrape.model.PlainSelector;
import com.leadharvest.scrape.model.StructuredSpec;
import com.leadharvest.scrape.model.TargetConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SelectorExtractor {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    public List<Map<String, String>> extractItems(String html, String pageUrl, TargetConfig config) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = parse(html, pageUrl);
        List<Map<String, String>> rows = new ArrayList<>();
        for (Element container : document.select(config.itemSelector())) {
            Map<String, String> row = new LinkedHashMap<>();
            for (Map.Entry<String, FieldSpec> field : config.fields().entrySet()) {
                row.put(field.getKey(), extractField(container, field.getValue()));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * @return the absolute next-page URL, or an empty string when there is none
     */
    public String extractNextPageUrl(String html, String pageUrl, String nextPageSelector) {
        if (html == null || html.isBlank() || nextPageSelector == null || nextPageSelector.isBlank()) {
            return "";
        }
        Element anchor = parse(html, pageUrl).selectFirst(nextPageSelector);
        if (anchor == null) {
            return "";
        }
        String href = anchor.attr("href").trim();
        if (href.isEmpty()) {
            return "";
        }
        String absolute = anchor.absUrl("href");
        if (!absolute.isEmpty()) {
            return absolute;
        }
        return pageUrl == null || pageUrl.isBlank() ? href : "";
    }

    String extractField(Element container, FieldSpec spec) {
        if (spec instanceof PlainSelector plain) {
            return normalizeText(container.selectFirst(plain.selector()));
        }
        if (spec instanceof AttrSelector attrSelector) {
            return firstNonEmpty(container, attrSelector);
        }
        if (spec instanceof StructuredSpec structured) {
            return extractStructured(container, structured);
        }
        return "";
    }

    private String firstNonEmpty(Element container, AttrSelector spec) {
        for (AttrSelector.Alternative alternative : spec.alternatives()) {
            Element element = container.selectFirst(alternative.selector());
            if (element == null) {
                continue;
            }
            String value = alternative.readsText()
                ? normalizeText(element)
                : element.attr(alternative.attribute()).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private String extractStructured(Element container, StructuredSpec spec) {
        if (spec.selector() == null || spec.selector().isBlank()) {
            return spec.defaultValue();
        }
        Element element = container.selectFirst(spec.selector());
        if (element == null) {
            return spec.defaultValue();
        }
        String value;
        if (spec.attribute() != null) {
            value = element.attr(spec.attribute());
        } else {
            value = normalizeText(element);
        }
        if (value == null || value.isEmpty()) {
            value = spec.defaultValue();
        }
        if (spec.regex() == null) {
            return value;
        }
        Matcher matcher = spec.regex().matcher(value);
        if (!matcher.find()) {
            return "";
        }
        if (matcher.groupCount() > 0) {
            String group = matcher.group(1);
            return group == null ? "" : group;
        }
        return matcher.group();
    }

    static String normalizeText(Element element) {
        if (element == null) {
            return "";
        }
        return normalizeWhitespace(element.text());
    }

    public static String normalizeWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private Document parse(String html, String pageUrl) {
        return pageUrl == null || pageUrl.isBlank() ? Jsoup.parse(html) : Jsoup.parse(html, pageUrl);
    }
}
