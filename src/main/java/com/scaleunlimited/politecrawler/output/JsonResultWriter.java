package com.scaleunlimited.politecrawler.output;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.scaleunlimited.politecrawler.pojos.CrawlResult;
import com.scaleunlimited.politecrawler.pojos.ParsedPage;
import com.scaleunlimited.politecrawler.pojos.ParsedPage.ImageRef;
import com.scaleunlimited.politecrawler.utils.CrawlToolUtils;

/**
 * Writes results as a pretty-printed JSON array, one object per page.
 * Non-ASCII characters are written as-is.
 */
public class JsonResultWriter extends BaseResultWriter {

    private final Gson _gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @Override
    public void write(List<CrawlResult> results, Writer out) throws IOException {
        JsonArray array = new JsonArray();
        for (CrawlResult result : results) {
            array.add(toJson(result));
        }

        _gson.toJson(array, out);
        out.write('\n');
        out.flush();
    }

    public static JsonObject toJson(CrawlResult result) {
        ParsedPage page = result.getPage();

        JsonObject json = new JsonObject();
        json.addProperty("url", result.getUrl());
        json.addProperty("domain", result.getDomain());
        json.addProperty("title", page.getTitle());
        json.addProperty("meta_description", page.getMetaDescription());
        json.addProperty("meta_keywords", page.getMetaKeywords());

        JsonObject headings = new JsonObject();
        for (int level = 1; level <= 3; level++) {
            headings.add("h" + level, toJsonArray(page.getHeadings(level)));
        }

        json.add("headings", headings);
        json.add("links", toJsonArray(page.getLinks()));

        JsonArray images = new JsonArray();
        for (ImageRef image : page.getImages()) {
            JsonObject imageJson = new JsonObject();
            imageJson.addProperty("src", image.getSrc());
            imageJson.addProperty("alt", image.getAlt());
            images.add(imageJson);
        }

        json.add("images", images);
        json.addProperty("text_length", page.getTextLength());
        json.addProperty("status_code", result.getHttpStatus());
        json.addProperty("timestamp", CrawlToolUtils.formatTimestamp(result.getFetchTime()));
        json.addProperty("depth", result.getDepth());
        return json;
    }

    private static JsonArray toJsonArray(List<String> values) {
        JsonArray result = new JsonArray();
        for (String value : values) {
            result.add(value);
        }

        return result;
    }
}
