package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.BoardListing;
import com.gpu.specharvester.dto.ListingEntry;
import com.gpu.specharvester.dto.ProductAttributes;
import com.gpu.specharvester.dto.ProductDetail;
import com.gpu.specharvester.dto.ReviewContent;
import com.gpu.specharvester.dto.ReviewDataItem;
import com.gpu.specharvester.dto.ReviewOption;
import com.gpu.specharvester.dto.SpecItem;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jsoup rule set for the GPU catalog site
 */
@Service
@Slf4j
public class JsoupGpuPageParser implements GpuPageParser {

    private static final Pattern OPTION_PREFIX = Pattern.compile("^\\d+-\\s*");
    private static final Pattern VALUE_WITH_UNIT = Pattern.compile("^([-+]?\\d+(?:[.,]\\d+)?)\\s*(\\S.*)?$");

    private static final List<String> REVIEW_PAGE_KEYWORDS = List.of(
            "pictures & teardown",
            "temperatures & fan noise",
            "cooler performance comparison",
            "overclocking & power limits",
            "pcb analysis",
            "circuit board",
            "pcb & power",
            "teardown & pcb",
            "board analysis"
    );

    private static final Map<String, List<String>> VENDOR_KEYWORDS = new LinkedHashMap<>();

    static {
        VENDOR_KEYWORDS.put("NVIDIA", List.of("NVIDIA", "GEFORCE", "RTX", "GTX", "QUADRO", "TESLA"));
        VENDOR_KEYWORDS.put("AMD", List.of("AMD", "RADEON", "RX", "VEGA", "FURY", "FIREPRO"));
        VENDOR_KEYWORDS.put("Intel", List.of("INTEL", "ARC", "IRIS", "UHD GRAPHICS", "HD GRAPHICS"));
        VENDOR_KEYWORDS.put("Matrox", List.of("MATROX"));
        VENDOR_KEYWORDS.put("3dfx", List.of("3DFX", "VOODOO"));
        VENDOR_KEYWORDS.put("ATI", List.of("ATI"));
    }

    private final String baseUrl;

    public JsoupGpuPageParser(HarvesterProperties properties) {
        this.baseUrl = properties.getBaseUrl();
    }

    @Override
    public List<ListingEntry> parseProductList(String html) {
        List<ListingEntry> entries = new ArrayList<>();
        Document doc = Jsoup.parse(html, baseUrl);

        Element table = doc.selectFirst("table.processors");
        if (table == null) {
            log.warn("Listing table not found");
            return entries;
        }

        int nameIndex = 0;
        Elements headers = table.select("thead th");
        for (int i = 0; i < headers.size(); i++) {
            if ("Product Name".equals(headers.get(i).text().trim())) {
                nameIndex = i;
                break;
            }
        }

        for (Element row : table.select("tr")) {
            Elements cells = row.select("td");
            if (cells.size() <= nameIndex) {
                continue;
            }
            Element link = cells.get(nameIndex).selectFirst("a");
            if (link == null) {
                continue;
            }
            String name = link.text().trim();
            String url = link.attr("href");
            if (!name.isEmpty() && !url.isEmpty()) {
                entries.add(new ListingEntry(name, url));
            }
        }

        log.info("Found {} GPUs in listing", entries.size());
        return entries;
    }

    @Override
    public Optional<ProductDetail> parseProductDetail(String html, String url) {
        Document doc = Jsoup.parse(html, baseUrl);

        Element h1 = doc.selectFirst("h1");
        if (h1 == null || h1.text().isBlank()) {
            log.warn("No product title on {}", url);
            return Optional.empty();
        }
        String name = h1.text().trim();

        Element desc = doc.selectFirst(".desc.p");
        ProductAttributes attributes = ProductAttributes.builder()
                .name(name)
                .vendor(extractVendor(name))
                .description(desc != null ? desc.text().trim() : null)
                .imageUrl(findImage(doc))
                .build();

        List<SpecItem> specs = new ArrayList<>();
        for (Element section : doc.select(".sectioncontainer section")) {
            if ("boards".equals(section.id()) || section.selectFirst(".gpudb-relative-performance") != null) {
                continue;
            }
            Element header = section.selectFirst("h2");
            if (header == null) {
                continue;
            }
            String category = header.text().trim();
            specs.addAll(definitionSpecs(section, category));
            specs.addAll(tableSpecs(section, category));
        }

        log.info("Parsed {} with {} specs", name, specs.size());
        return Optional.of(new ProductDetail(attributes, specs));
    }

    @Override
    public List<BoardListing> parseBoards(String html) {
        List<BoardListing> boards = new ArrayList<>();
        Document doc = Jsoup.parse(html, baseUrl);

        Element table = doc.selectFirst("#boards table");
        if (table == null) {
            return boards;
        }

        Elements headerCells = table.select("thead th.sort-key");
        if (headerCells.isEmpty()) {
            headerCells = table.select("thead th");
        }
        List<String> headers = headerCells.eachText();

        for (Element row : table.select("tbody tr")) {
            Element link = row.selectFirst(".board-table-title__inner a");
            if (link == null || link.text().isBlank()) {
                continue;
            }
            Element reviewLink = row.selectFirst("a.board-review-by-tpu");

            Map<String, String> columns = new LinkedHashMap<>();
            Elements cells = row.select("td");
            for (int i = 0; i < headers.size() && i < cells.size(); i++) {
                String value = cells.get(i).text().trim();
                if (!headers.get(i).isBlank() && !value.isEmpty()) {
                    columns.put(headers.get(i), value);
                }
            }

            boards.add(new BoardListing(
                    link.text().trim(),
                    emptyToNull(link.attr("href")),
                    reviewLink != null ? emptyToNull(reviewLink.attr("href")) : null,
                    columns));
        }
        return boards;
    }

    @Override
    public List<ReviewOption> parseReviewOptions(String html) {
        List<ReviewOption> options = new ArrayList<>();
        Document doc = Jsoup.parse(html, baseUrl);

        for (Element option : doc.select("#pagesel option")) {
            String value = option.attr("value");
            if (value.isEmpty()) {
                continue;
            }
            String text = OPTION_PREFIX.matcher(option.text().trim()).replaceFirst("");
            String lower = text.toLowerCase();
            if (REVIEW_PAGE_KEYWORDS.stream().anyMatch(lower::contains)) {
                options.add(new ReviewOption(text, value));
            }
        }
        return options;
    }

    @Override
    public Optional<ReviewContent> parseReviewContent(String html, String reviewType) {
        Document doc = Jsoup.parse(html, baseUrl);

        Elements containers = doc.select("div.text.p");
        if (containers.isEmpty()) {
            return Optional.empty();
        }

        Element titleElement = containers.select("h2").first();
        if (titleElement == null) {
            titleElement = doc.selectFirst("h1");
        }
        String title = titleElement != null ? titleElement.text().trim() : reviewType;

        List<String> paragraphs = new ArrayList<>();
        List<ReviewDataItem> data = new ArrayList<>();
        List<SpecItem> specs = new ArrayList<>();

        for (Element container : containers) {
            String heading = reviewType;
            for (Element child : container.children()) {
                switch (child.tagName()) {
                    case "h2", "h3" -> heading = child.text().trim();
                    case "p" -> {
                        String text = child.text().trim();
                        if (!text.isEmpty()) {
                            paragraphs.add(text);
                        }
                    }
                    case "dl" -> specs.addAll(definitionSpecs(child, heading));
                    case "table" -> data.addAll(tableData(child, reviewType));
                    default -> {
                    }
                }
            }
        }

        String body = String.join("\n\n", paragraphs);
        if (body.isBlank() && data.isEmpty() && specs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ReviewContent(title, body, data, specs));
    }

    @Override
    public Optional<LocalDate> parsePostedDate(String html) {
        Document doc = Jsoup.parse(html, baseUrl);

        Element time = doc.selectFirst("time[datetime]");
        if (time != null) {
            Optional<LocalDate> date = parseIsoDate(time.attr("datetime"));
            if (date.isPresent()) {
                return date;
            }
        }
        Element meta = doc.selectFirst("meta[property=article:published_time]");
        if (meta != null) {
            return parseIsoDate(meta.attr("content"));
        }
        return Optional.empty();
    }

    @Override
    public String extractVendor(String productName) {
        if (productName == null || productName.isBlank()) {
            return "Unknown";
        }
        String trimmed = productName.trim();
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            return trimmed.substring(0, space);
        }
        String upper = trimmed.toUpperCase();
        for (Map.Entry<String, List<String>> entry : VENDOR_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(upper::contains)) {
                return entry.getKey();
            }
        }
        return "Unknown";
    }

    private String findImage(Document doc) {
        Element img = doc.selectFirst(".gpudb-large-image__wrapper img[src]");
        if (img == null) {
            img = doc.selectFirst(".product-showcase img[src], .card-body img[src], .product-image img[src]");
        }
        if (img == null) {
            return null;
        }
        String abs = img.absUrl("src");
        return abs.isEmpty() ? img.attr("src") : abs;
    }

    private List<SpecItem> definitionSpecs(Element scope, String category) {
        List<SpecItem> specs = new ArrayList<>();
        Elements lists = "dl".equals(scope.tagName()) ? new Elements(scope) : scope.select("dl");
        for (Element dl : lists) {
            Elements terms = dl.select("dt");
            Elements values = dl.select("dd");
            for (int i = 0; i < Math.min(terms.size(), values.size()); i++) {
                String name = terms.get(i).text().trim();
                String value = values.get(i).text().trim();
                if (!name.isEmpty() && !value.isEmpty()) {
                    specs.add(new SpecItem(category, name, value));
                }
            }
        }
        return specs;
    }

    private List<SpecItem> tableSpecs(Element section, String category) {
        List<SpecItem> specs = new ArrayList<>();
        for (Element row : section.select("table tbody tr")) {
            Elements cells = row.select("td, th");
            if (cells.size() > 1) {
                String name = cells.get(0).text().trim();
                String value = cells.get(1).text().trim();
                if (!name.isEmpty() && !value.isEmpty()) {
                    specs.add(new SpecItem(category, name, value));
                }
            }
        }
        return specs;
    }

    /**
     * Result tables: the first column is the key; every further column holds the value for the
     * product named in its header
     */
    private List<ReviewDataItem> tableData(Element table, String reviewType) {
        List<ReviewDataItem> items = new ArrayList<>();
        List<String> headers = table.select("thead th").eachText();
        for (Element row : table.select("tbody tr")) {
            Elements cells = row.select("td, th");
            if (cells.size() < 2) {
                continue;
            }
            String key = cells.get(0).text().trim();
            for (int col = 1; col < cells.size(); col++) {
                String raw = cells.get(col).text().trim();
                if (key.isEmpty() || raw.isEmpty()) {
                    continue;
                }
                String productName = col < headers.size() ? emptyToNull(headers.get(col).trim()) : null;
                Matcher matcher = VALUE_WITH_UNIT.matcher(raw);
                if (matcher.matches()) {
                    items.add(new ReviewDataItem(reviewType, key, matcher.group(1), matcher.group(2), productName));
                } else {
                    items.add(new ReviewDataItem(reviewType, key, raw, null, productName));
                }
            }
        }
        return items;
    }

    private Optional<LocalDate> parseIsoDate(String value) {
        if (value == null || value.length() < 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.substring(0, 10)));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable posted date: {}", value);
            return Optional.empty();
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
