package com.shieldmail.spamengine.domain.service;

import java.util.regex.Pattern;

final class InputText {

    private static final Pattern EDGE_WHITESPACE = Pattern.compile(
            "\\A[\\s\\x1C-\\x1F]+|[\\s\\x1C-\\x1F]+\\z", Pattern.UNICODE_CHARACTER_CLASS);

    private InputText() {
    }

    static String strip(String text) {
        return text == null ? "" : EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    static boolean isBlank(String text) {
        return strip(text).isEmpty();
    }
}
