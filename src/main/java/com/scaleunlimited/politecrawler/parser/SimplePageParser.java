package com.scaleunlimited.politecrawler.parser;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URL;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.html.HtmlMapper;
import org.apache.tika.parser.html.HtmlParser;
import org.apache.tika.parser.html.IdentityHtmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaleunlimited.politecrawler.pojos.FetchedPage;
import com.scaleunlimited.politecrawler.pojos.ParsedPage;
import com.scaleunlimited.politecrawler.utils.IoUtils;

/**
 * Parses HTML with Tika, and extracts the page fields plus the outlinks to
 * follow. Honors <code>&lt;meta name="robots" content="nofollow"&gt;</code>
 * by returning no outlinks (the page's fields still list its links).
 */
public class SimplePageParser extends BasePageParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimplePageParser.class);

    private Parser _parser;
    private ParseContext _parseContext;

    public SimplePageParser() {
        super();
    }

    public SimplePageParser(int maxOutlinks) {
        super(maxOutlinks);
    }

    @Override
    public void open() throws Exception {
        super.open();

        _parser = new HtmlParser();

        // We want all elements (not just the "safe" ones), so that we see
        // headings and images.
        _parseContext = new ParseContext();
        _parseContext.set(HtmlMapper.class, IdentityHtmlMapper.INSTANCE);
    }

    @Override
    public ParserResult parse(FetchedPage page) throws Exception {
        if (_parser == null) {
            open();
        }

        LOGGER.trace("Parsing '{}'", page.getFetchedUrl());

        URL baseUrl = getContentLocation(page);

        // Provide clues to the parser about the format of the content.
        Metadata metadata = new Metadata();
        metadata.add(Metadata.RESOURCE_NAME_KEY, page.getFetchedUrl());
        metadata.add(Metadata.CONTENT_LOCATION, baseUrl.toExternalForm());
        if (page.getContentType() != null) {
            metadata.add(Metadata.CONTENT_TYPE, page.getContentType());
        }

        byte[] content = (page.getContent() == null) ? new byte[0] : page.getContent();
        InputStream is = new ByteArrayInputStream(content, 0, content.length);

        PageContentHandler handler = new PageContentHandler(baseUrl, getMaxOutlinks());
        try {
            _parser.parse(is, handler, metadata, _parseContext);
        } finally {
            IoUtils.safeClose(is);
        }

        ParsedPage parsedPage = handler.getPage();
        parsedPage.setTitle(metadata.get(TikaCoreProperties.TITLE));
        parsedPage.setMetaDescription(getMetaValue(metadata, "description"));
        parsedPage.setMetaKeywords(getMetaValue(metadata, "keywords"));

        List<String> outlinks = handler.getOutlinks();
        if (isNoFollow(metadata)) {
            LOGGER.debug("Skipping outlinks for '{}' due to robots meta tag", page.getFetchedUrl());
            outlinks = Collections.emptyList();
        }

        return new ParserResult(parsedPage, outlinks);
    }

    private static boolean isNoFollow(Metadata metadata) {
        String content = getMetaValue(metadata, "robots");
        if (content == null) {
            return false;
        }

        for (String directive : content.split(",")) {
            directive = directive.trim().toLowerCase(Locale.ROOT);
            if (directive.equals("none") || directive.equals("nofollow")) {
                return true;
            }
        }

        return false;
    }

    /**
     * Tika keeps the name of a meta tag as written in the HTML, so match it
     * without regard to case.
     */
    private static String getMetaValue(Metadata metadata, String name) {
        for (String metaName : metadata.names()) {
            if (metaName.equalsIgnoreCase(name)) {
                return metadata.get(metaName);
            }
        }

        return null;
    }
}
