package com.example.oncallrotation.service.command;

import com.example.oncallrotation.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits slash command text into arguments the way a POSIX shell would.
 * <p>
 * Typographic quotes, which Slack clients like to substitute, are turned into plain quotes first.
 * Single quotes are literal, double quotes honour backslash escapes of {@code "} and {@code \}.
 */
public final class CommandTokenizer {

    private CommandTokenizer() {
    }

    public static String cleanse(String text) {
        return text
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'');
    }

    /**
     * @throws InvalidInputException on an unterminated quote or a trailing backslash
     */
    public static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        if (text == null) {
            return tokens;
        }

        var input = cleanse(text);
        var current = new StringBuilder();
        var inToken = false;
        var i = 0;

        while (i < input.length()) {
            var c = input.charAt(i);

            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                var end = input.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new InvalidInputException("text", "Unterminated single quote in: " + text);
                }
                current.append(input, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(input, i + 1, current, text);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= input.length()) {
                    throw new InvalidInputException("text", "Trailing backslash in: " + text);
                }
                current.append(input.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }

        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * @return index just past the closing quote
     */
    private static int readDoubleQuoted(String input, int start, StringBuilder current, String original) {
        var i = start;
        while (i < input.length()) {
            var c = input.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < input.length() && (input.charAt(i + 1) == '"' || input.charAt(i + 1) == '\\')) {
                current.append(input.charAt(i + 1));
                i += 2;
            } else {
                current.append(c);
                i++;
            }
        }
        throw new InvalidInputException("text", "Unterminated double quote in: " + original);
    }
}
