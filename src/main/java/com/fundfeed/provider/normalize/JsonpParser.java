package com.fundfeed.provider.normalize;

import com.fundfeed.exception.SchemaException;

/** Extracts JSON out of JavaScript payloads: JSONP callbacks and {@code var x = ...;} assignments. */
public final class JsonpParser {

    private JsonpParser() {}

    /**
     * Unwraps {@code callback({...});} and returns the inner JSON text.
     *
     * @throws SchemaException if the payload is not a callback invocation or the callback is empty
     */
    public static String unwrap(String payload) {
        if (payload == null) {
            throw new SchemaException("Empty JSONP payload");
        }
        String text = payload.trim();
        int open = text.indexOf('(');
        int close = text.lastIndexOf(')');
        if (open <= 0 || close <= open) {
            throw new SchemaException("Not a JSONP payload: " + abbreviate(text));
        }
        String inner = text.substring(open + 1, close).trim();
        if (inner.isEmpty()) {
            throw new SchemaException("JSONP callback carries no data: " + abbreviate(text));
        }
        return inner;
    }

    /**
     * Returns the JSON literal assigned to {@code var name = ...;} in a script, matching
     * brackets and skipping string contents.
     *
     * @throws SchemaException if the variable is absent or its literal is unterminated
     */
    public static String extractVariable(String script, String name) {
        String marker = "var " + name;
        int start = script.indexOf(marker + " ");
        if (start < 0) {
            start = script.indexOf(marker + "=");
        }
        if (start < 0) {
            throw new SchemaException("Variable " + name + " not found in script");
        }
        int eq = script.indexOf('=', start + marker.length());
        int pos = eq + 1;
        while (pos < script.length() && Character.isWhitespace(script.charAt(pos))) {
            pos++;
        }
        if (eq < 0 || pos >= script.length()) {
            throw new SchemaException("Variable " + name + " has no value");
        }
        char first = script.charAt(pos);
        if (first != '[' && first != '{') {
            int end = script.indexOf(';', pos);
            if (end < 0) {
                throw new SchemaException("Variable " + name + " is unterminated");
            }
            return script.substring(pos, end).trim();
        }
        int depth = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = pos; i < script.length(); i++) {
            char c = script.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                inString = true;
                quote = c;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return script.substring(pos, i + 1);
                }
            }
        }
        throw new SchemaException("Variable " + name + " is unterminated");
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
