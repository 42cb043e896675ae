package com.scaleunlimited.politecrawler.output;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;
import com.scaleunlimited.politecrawler.pojos.ParsedPage;
import com.scaleunlimited.politecrawler.utils.CrawlToolUtils;

/**
 * Writes one flattened row per page. Lists are reduced to counts, except
 * for the first three h1 headings, which are joined with " | ".
 */
public class CsvResultWriter extends BaseResultWriter {

    public static final String[] COLUMNS = {
        "url", "domain", "title", "meta_description", "meta_keywords", "text_length",
        "status_code", "timestamp", "num_links", "num_images", "h1_count", "h2_count",
        "h3_count", "h1_text"
    };

    private static final String LINE_SEPARATOR = "\r\n";
    private static final int MAX_H1_TEXTS = 3;

    @Override
    public void write(List<CrawlResult> results, Writer out) throws IOException {
        writeRow(out, COLUMNS);

        for (CrawlResult result : results) {
            ParsedPage page = result.getPage();
            List<String> h1 = page.getHeadings(1);

            writeRow(out,
                    result.getUrl(),
                    result.getDomain(),
                    page.getTitle(),
                    page.getMetaDescription(),
                    page.getMetaKeywords(),
                    Integer.toString(page.getTextLength()),
                    Integer.toString(result.getHttpStatus()),
                    CrawlToolUtils.formatTimestamp(result.getFetchTime()),
                    Integer.toString(page.getLinks().size()),
                    Integer.toString(page.getImages().size()),
                    Integer.toString(h1.size()),
                    Integer.toString(page.getHeadings(2).size()),
                    Integer.toString(page.getHeadings(3).size()),
                    String.join(" | ", new ArrayList<>(h1.subList(0, Math.min(MAX_H1_TEXTS, h1.size())))));
        }

        out.flush();
    }

    private static void writeRow(Writer out, String... values) throws IOException {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                out.write(',');
            }

            out.write(escape(values[i]));
        }

        out.write(LINE_SEPARATOR);
    }

    /**
     * Quote a field if it contains a delimiter, quote or line break, doubling
     * any embedded quotes.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }

        if ((value.indexOf(',') == -1) && (value.indexOf('"') == -1) && (value.indexOf('\n') == -1)
                && (value.indexOf('\r') == -1)) {
            return value;
        }

        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
