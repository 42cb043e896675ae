package com.scaleunlimited.politecrawler.utils;

import java.util.Locale;

import org.apache.tika.mime.MediaType;

public class HttpUtils {

    private HttpUtils() {
        // Enforce class isn't instantiated
    }

    /**
     * @param contentType Content-Type header value, e.g. "text/html; charset=UTF-8"
     * @return lower-case "type/subtype", or an empty string if it can't be parsed
     */
    public static String getMimeTypeFromContentType(String contentType) {
        String result = "";
        MediaType mt = MediaType.parse(contentType);
        if (mt != null) {
            result = (mt.getType() + "/" + mt.getSubtype()).toLowerCase(Locale.ROOT);
        }

        return result;
    }

    public static boolean isSuccess(int httpStatus) {
        return (httpStatus >= 200) && (httpStatus < 300);
    }
}
