package com.scaleunlimited.politecrawler.parser;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import com.scaleunlimited.politecrawler.pojos.ParsedPage;

/**
 * Collects headings, anchors, images and visible text from the XHTML SAX
 * events that Tika generates for an HTML page.
 */
public class PageContentHandler extends DefaultHandler {

    private final URL _baseUrl;
    private final int _maxOutlinks;

    private ParsedPage _page = new ParsedPage();
    private Set<String> _outlinks = new LinkedHashSet<>();

    private int _skipDepth = 0;
    private int _headingLevel = 0;
    private StringBuilder _headingText = new StringBuilder();
    private StringBuilder _text = new StringBuilder();
    private boolean _pendingSpace = false;

    public PageContentHandler(URL baseUrl, int maxOutlinks) {
        _baseUrl = baseUrl;
        _maxOutlinks = maxOutlinks;
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes)
            throws SAXException {
        String name = getName(localName, qName);

        if (name.equals("script") || name.equals("style") || name.equals("title")) {
            _skipDepth += 1;
        } else if (isHeading(name)) {
            _headingLevel = name.charAt(1) - '0';
            _headingText.setLength(0);
        } else if (name.equals("a")) {
            String href = resolve(attributes.getValue("href"));
            if (href != null) {
                _page.addLink(href);
                if (_outlinks.size() < _maxOutlinks) {
                    _outlinks.add(href);
                }
            }
        } else if (name.equals("img")) {
            String src = resolve(attributes.getValue("src"));
            if (src != null) {
                _page.addImage(src, attributes.getValue("alt"));
            }
        }
    }

    @Override
    public void endElement(String uri, String localName, String qName) throws SAXException {
        String name = getName(localName, qName);

        if (name.equals("script") || name.equals("style") || name.equals("title")) {
            _skipDepth = Math.max(0, _skipDepth - 1);
        } else if (isHeading(name) && (_headingLevel != 0)) {
            _page.addHeading(_headingLevel, _headingText.toString().replaceAll("\\s+", " "));
            _headingLevel = 0;
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) throws SAXException {
        if (_skipDepth > 0) {
            return;
        }

        if (_headingLevel != 0) {
            _headingText.append(ch, start, length);
        }

        // Collapse runs of whitespace, so the text length isn't dominated by
        // indentation in the markup.
        for (int i = start; i < start + length; i++) {
            char c = ch[i];
            if (Character.isWhitespace(c)) {
                _pendingSpace = true;
            } else {
                if (_pendingSpace && (_text.length() > 0)) {
                    _text.append(' ');
                }

                _pendingSpace = false;
                _text.append(c);
            }
        }
    }

    @Override
    public void ignorableWhitespace(char[] ch, int start, int length) throws SAXException {
        _pendingSpace = true;
    }

    public ParsedPage getPage() {
        _page.setTextLength(_text.length());
        return _page;
    }

    public List<String> getOutlinks() {
        return new ArrayList<>(_outlinks);
    }

    private String resolve(String reference) {
        if (reference == null) {
            return null;
        }

        try {
            return new URL(_baseUrl, reference.trim()).toExternalForm();
        } catch (MalformedURLException e) {
            return null;
        }
    }

    private static boolean isHeading(String name) {
        return name.equals("h1") || name.equals("h2") || name.equals("h3");
    }

    private static String getName(String localName, String qName) {
        String name = ((localName == null) || localName.isEmpty()) ? qName : localName;
        return name.toLowerCase(Locale.ROOT);
    }
}
