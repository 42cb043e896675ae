package com.scaleunlimited.politecrawler.output;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.pojos.CrawlResult;

/**
 * Saves crawl results to a file, or to a stream (normally stdout) if no
 * file is given. Write failures are logged and rethrown, since a crawl
 * whose results can't be saved has failed.
 */
public class ResultSaver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultSaver.class);

    private final OutputFormat _format;
    private final String _outputFile;
    private final OutputStream _console;

    public ResultSaver(OutputFormat format, String outputFile) {
        this(format, outputFile, System.out);
    }

    /**
     * @param format output format
     * @param outputFile path of the file to write, or null to use <code>console</code>
     * @param console stream used when there's no output file (never closed)
     */
    public ResultSaver(OutputFormat format, String outputFile, OutputStream console) {
        _format = format;
        _outputFile = outputFile;
        _console = console;
    }

    /**
     * @param results results to save
     * @return true if anything was written
     * @throws IOException if the results couldn't be written
     */
    public boolean save(List<CrawlResult> results) throws IOException {
        if (results.isEmpty()) {
            LOGGER.warn("No data to save");
            return false;
        }

        BaseResultWriter writer = _format.makeWriter();
        try {
            if (_outputFile != null) {
                LOGGER.info("Attempting to save {} items to {}", results.size(), _outputFile);
                writer.write(results, new File(_outputFile));
                LOGGER.info("Successfully saved {} data to {}", _format, _outputFile);
            } else {
                Writer out = new OutputStreamWriter(_console, StandardCharsets.UTF_8);
                writer.write(results, out);
                out.flush();
            }
        } catch (IOException e) {
            LOGGER.error(String.format("Error saving results to %s", (_outputFile == null) ? "console" : _outputFile), e);
            throw e;
        }

        return true;
    }

    public OutputFormat getFormat() {
        return _format;
    }

    public String getOutputFile() {
        return _outputFile;
    }
}
