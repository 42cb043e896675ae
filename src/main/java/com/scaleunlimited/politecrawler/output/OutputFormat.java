package com.scaleunlimited.politecrawler.output;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    CSV,
    PRINT;  // Plain text

    public BaseResultWriter makeWriter() {
        switch (this) {
            case JSON:
                return new JsonResultWriter();
            case CSV:
                return new CsvResultWriter();
            case PRINT:
                return new TextResultWriter();
            default:
                throw new IllegalStateException("Unknown output format: " + this);
        }
    }

    public static OutputFormat fromName(String name) {
        try {
            return OutputFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Invalid output format '%s' (expected json, csv or print)", name));
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
