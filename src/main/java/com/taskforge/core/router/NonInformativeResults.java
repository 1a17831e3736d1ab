package com.taskforge.core.router;

import java.util.Locale;
import java.util.Map;

/**
 * Recognises results that carry no usable information, such as pending async
 * markers or failures without an error message.
 */
public final class NonInformativeResults {

    private NonInformativeResults() {}

    public static boolean isNonInformative(Object result) {
        if (result == null) {
            return true;
        }
        if (result instanceof CharSequence text) {
            String s = text.toString();
            return s.isBlank() || s.toLowerCase(Locale.ROOT).contains("async pending");
        }
        if (result instanceof Map<?, ?> map) {
            if ("pending".equals(map.get("status"))) {
                return true;
            }
            if (Boolean.TRUE.equals(map.get("async"))) {
                return true;
            }
            Object error = map.get("error");
            return Boolean.FALSE.equals(map.get("success"))
                    && (error == null || error.toString().isBlank());
        }
        return false;
    }
}
