package com.scaleunlimited.politecrawler.pojos;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured fields extracted from one HTML page.
 */
public class ParsedPage {

    public static final int MAX_HEADINGS_PER_LEVEL = 5;
    public static final int MAX_LINKS = 50;
    public static final int MAX_IMAGES = 20;

    public static class ImageRef {
        private String _src;
        private String _alt;

        public ImageRef(String src, String alt) {
            _src = src;
            _alt = alt;
        }

        public String getSrc() {
            return _src;
        }

        public String getAlt() {
            return _alt;
        }

        @Override
        public String toString() {
            return String.format("%s (%s)", _src, _alt);
        }
    }

    private String _title = "";
    private String _metaDescription = "";
    private String _metaKeywords = "";
    private List<String> _h1 = new ArrayList<>();
    private List<String> _h2 = new ArrayList<>();
    private List<String> _h3 = new ArrayList<>();
    private List<String> _links = new ArrayList<>();
    private List<ImageRef> _images = new ArrayList<>();
    private int _textLength;

    public String getTitle() {
        return _title;
    }

    public void setTitle(String title) {
        _title = clean(title);
    }

    public String getMetaDescription() {
        return _metaDescription;
    }

    public void setMetaDescription(String metaDescription) {
        _metaDescription = clean(metaDescription);
    }

    public String getMetaKeywords() {
        return _metaKeywords;
    }

    public void setMetaKeywords(String metaKeywords) {
        _metaKeywords = clean(metaKeywords);
    }

    public List<String> getHeadings(int level) {
        switch (level) {
            case 1:
                return _h1;
            case 2:
                return _h2;
            case 3:
                return _h3;
            default:
                throw new IllegalArgumentException("Only h1, h2 and h3 headings are extracted: " + level);
        }
    }

    /**
     * Record a heading, dropping empty ones and anything past the limit for
     * that level.
     * 
     * @param level 1, 2 or 3
     * @param text heading text
     */
    public void addHeading(int level, String text) {
        List<String> headings = getHeadings(level);
        String cleaned = clean(text);
        if (!cleaned.isEmpty() && (headings.size() < MAX_HEADINGS_PER_LEVEL)) {
            headings.add(cleaned);
        }
    }

    public List<String> getLinks() {
        return _links;
    }

    public void addLink(String link) {
        if (_links.size() < MAX_LINKS) {
            _links.add(link);
        }
    }

    public List<ImageRef> getImages() {
        return _images;
    }

    public void addImage(String src, String alt) {
        if (_images.size() < MAX_IMAGES) {
            _images.add(new ImageRef(src, clean(alt)));
        }
    }

    public int getTextLength() {
        return _textLength;
    }

    public void setTextLength(int textLength) {
        _textLength = textLength;
    }

    private static String clean(String s) {
        return (s == null) ? "" : s.trim();
    }

    @Override
    public String toString() {
        return String.format("'%s' (%d links, %d images, %d chars)", _title, _links.size(),
                _images.size(), _textLength);
    }
}
