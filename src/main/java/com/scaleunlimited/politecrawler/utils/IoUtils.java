package com.scaleunlimited.politecrawler.utils;

import java.io.Closeable;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IoUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(IoUtils.class);

    private IoUtils() {
        // Enforce class isn't instantiated
    }

    /**
     * Close something we only read from, where a failure to close
     * doesn't lose any data.
     * 
     * @param c stream, reader, etc. (may be null)
     */
    public static void safeClose(Closeable c) {
        if (c == null) {
            return;
        }

        try {
            c.close();
        } catch (IOException e) {
            LOGGER.warn("IOException closing " + c.getClass().getSimpleName(), e);
        }
    }
}
