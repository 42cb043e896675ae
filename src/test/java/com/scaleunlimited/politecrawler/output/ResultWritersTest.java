package com.scaleunlimited.politecrawler.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.scaleunlimited.politecrawler.pojos.CrawlResult;
import com.scaleunlimited.politecrawler.pojos.ParsedPage;

public class ResultWritersTest {

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    @Test
    public void testJson() throws Exception {
        StringWriter out = new StringWriter();
        new JsonResultWriter().write(makeResults(), out);

        JsonArray array = JsonParser.parseString(out.toString()).getAsJsonArray();
        assertEquals(2, array.size());

        JsonObject first = array.get(0).getAsJsonObject();
        assertEquals("http://domain.com/", first.get("url").getAsString());
        assertEquals("domain.com", first.get("domain").getAsString());
        assertEquals("Café, \"quoted\"", first.get("title").getAsString());
        assertEquals("A description", first.get("meta_description").getAsString());
        assertEquals("", first.get("meta_keywords").getAsString());
        assertEquals("First", first.getAsJsonObject("headings").getAsJsonArray("h1").get(0).getAsString());
        assertEquals(0, first.getAsJsonObject("headings").getAsJsonArray("h3").size());
        assertEquals(2, first.getAsJsonArray("links").size());
        assertEquals("Logo", first.getAsJsonArray("images").get(0).getAsJsonObject().get("alt").getAsString());
        assertEquals(1234, first.get("text_length").getAsInt());
        assertEquals(200, first.get("status_code").getAsInt());
        assertEquals(0, first.get("depth").getAsInt());
        assertThat(first.get("timestamp").getAsString()).matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");

        // Non-ASCII is written as-is.
        assertThat(out.toString()).contains("Café");
    }

    @Test
    public void testCsv() throws Exception {
        StringWriter out = new StringWriter();
        new CsvResultWriter().write(makeResults(), out);

        String[] lines = out.toString().split("\r\n");
        assertEquals(3, lines.length);
        assertEquals(String.join(",", CsvResultWriter.COLUMNS), lines[0]);
        assertThat(lines[1]).startsWith("http://domain.com/,domain.com,\"Café, \"\"quoted\"\"\",A description,,1234,200,");
        assertThat(lines[1]).endsWith(",2,1,2,1,0,First | Second");
    }

    @Test
    public void testCsvEscaping() throws Exception {
        assertEquals("plain", CsvResultWriter.escape("plain"));
        assertEquals("\"a,b\"", CsvResultWriter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvResultWriter.escape("say \"hi\""));
        assertEquals("\"two\nlines\"", CsvResultWriter.escape("two\nlines"));
        assertEquals("", CsvResultWriter.escape(null));
    }

    @Test
    public void testText() throws Exception {
        StringWriter out = new StringWriter();
        new TextResultWriter().write(makeResults(), out);

        String text = out.toString();
        assertThat(text).contains("URL: http://domain.com/");
        assertThat(text).contains("Title: Café, \"quoted\"");
        assertThat(text).contains("Text length: 1234");
        assertThat(text).contains("Links found: 2");
        assertThat(text).contains("Status: 200");
        assertThat(text).contains("--------------------------------------------------");
    }

    @Test
    public void testWriteToFile() throws Exception {
        File file = new File(_folder.getRoot(), "subdir/results.json");
        new JsonResultWriter().write(makeResults(), file);

        String content = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        assertThat(content).contains("\"url\": \"http://domain.com/page\"");
    }

    @Test
    public void testOutputFormat() throws Exception {
        assertEquals(OutputFormat.CSV, OutputFormat.fromName("csv"));
        assertEquals(OutputFormat.PRINT, OutputFormat.fromName(" Print "));
        assertEquals("json", OutputFormat.JSON.toString());
        assertThat(OutputFormat.JSON.makeWriter()).isInstanceOf(JsonResultWriter.class);
        assertThat(OutputFormat.PRINT.makeWriter()).isInstanceOf(TextResultWriter.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidOutputFormat() throws Exception {
        OutputFormat.fromName("xml");
    }

    static List<CrawlResult> makeResults() {
        ParsedPage page1 = new ParsedPage();
        page1.setTitle("Café, \"quoted\"");
        page1.setMetaDescription("A description");
        page1.addHeading(1, "First");
        page1.addHeading(1, "Second");
        page1.addHeading(2, "Sub");
        page1.addLink("http://domain.com/page");
        page1.addLink("http://other.com/");
        page1.addImage("http://domain.com/logo.png", "Logo");
        page1.setTextLength(1234);

        ParsedPage page2 = new ParsedPage();
        page2.setTitle("Page");

        return Arrays.asList(
                new CrawlResult("http://domain.com/", "domain.com", 0, page1, 200, System.currentTimeMillis()),
                new CrawlResult("http://domain.com/page", "domain.com", 1, page2, 200, System.currentTimeMillis()));
    }
}
