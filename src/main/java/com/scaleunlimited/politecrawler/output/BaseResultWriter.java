package com.scaleunlimited.politecrawler.output;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;

public abstract class BaseResultWriter {

    /**
     * Write results to a file (creating any missing parent directories),
     * using UTF-8.
     * 
     * @param results results to write
     * @param file target file, which is overwritten
     * @throws IOException
     */
    public void write(List<CrawlResult> results, File file) throws IOException {
        try (Writer out = new OutputStreamWriter(FileUtils.openOutputStream(file), StandardCharsets.UTF_8)) {
            write(results, out);
        }
    }

    public abstract void write(List<CrawlResult> results, Writer out) throws IOException;
}
