package com.scaleunlimited.politecrawler.output;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;

/**
 * Human-readable summary of each page.
 */
public class TextResultWriter extends BaseResultWriter {

    private static final String SEPARATOR = "--------------------------------------------------";

    @Override
    public void write(List<CrawlResult> results, Writer out) throws IOException {
        for (CrawlResult result : results) {
            out.write(String.format("URL: %s%n", result.getUrl()));
            out.write(String.format("Title: %s%n", result.getPage().getTitle()));
            out.write(String.format("Description: %s%n", result.getPage().getMetaDescription()));
            out.write(String.format("Text length: %d%n", result.getPage().getTextLength()));
            out.write(String.format("Links found: %d%n", result.getPage().getLinks().size()));
            out.write(String.format("Status: %d%n", result.getHttpStatus()));
            out.write(String.format("%s%n%n", SEPARATOR));
        }

        out.flush();
    }
}
