package com.scaleunlimited.politecrawler.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;

public class ResultSaverTest {

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    @Test
    public void testSaveToFile() throws Exception {
        File file = new File(_folder.getRoot(), "output.csv");
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ResultSaver saver = new ResultSaver(OutputFormat.CSV, file.getAbsolutePath(), console);

        assertTrue(saver.save(ResultWritersTest.makeResults()));
        assertThat(FileUtils.readFileToString(file, StandardCharsets.UTF_8)).startsWith("url,domain,title");
        assertThat(console.size()).isEqualTo(0);
    }

    @Test
    public void testSaveToConsole() throws Exception {
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ResultSaver saver = new ResultSaver(OutputFormat.PRINT, null, console);

        assertTrue(saver.save(ResultWritersTest.makeResults()));
        assertThat(new String(console.toByteArray(), StandardCharsets.UTF_8)).contains("URL: http://domain.com/page");
    }

    @Test
    public void testNothingToSave() throws Exception {
        File file = new File(_folder.getRoot(), "output.json");
        ResultSaver saver = new ResultSaver(OutputFormat.JSON, file.getAbsolutePath());

        assertFalse(saver.save(Collections.<CrawlResult> emptyList()));
        assertFalse(file.exists());
    }
}
