package com.scaleunlimited.politecrawler.parser;

import java.util.List;

import com.scaleunlimited.politecrawler.pojos.ParsedPage;

public class ParserResult {

    ParsedPage _parsedPage;
    List<String> _outlinks;

    public ParserResult(ParsedPage parsedPage, List<String> outlinks) {
        _parsedPage = parsedPage;
        _outlinks = outlinks;
    }

    public ParsedPage getParsedPage() {
        return _parsedPage;
    }

    /**
     * @return absolute outlink URLs in document order, without duplicates
     */
    public List<String> getOutlinks() {
        return _outlinks;
    }
}
