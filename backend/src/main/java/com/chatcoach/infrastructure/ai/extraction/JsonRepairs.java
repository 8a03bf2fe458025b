package com.chatcoach.infrastructure.ai.extraction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * String-level repairs for model output that should have been JSON.
 * All methods are pure and never throw; null is treated as the empty string.
 */
public final class JsonRepairs {

    private static final String FENCE = "```";
    private static final String VALID_ESCAPES = "\"\\/bfnrtu";

    private JsonRepairs() {
    }

    /**
     * Remove a markdown code fence (with optional language tag) around the payload,
     * plus stray backticks at either end.
     */
    public static String stripCodeFence(String text) {
        String result = nullToEmpty(text).strip();
        int open = result.indexOf(FENCE);
        int firstStructural = indexOfAny(result, "{[");
        if (open >= 0 && (firstStructural < 0 || open < firstStructural)) {
            int contentStart = open + FENCE.length();
            while (contentStart < result.length() && isLanguageTagChar(result.charAt(contentStart))) {
                contentStart++;
            }
            int close = result.lastIndexOf(FENCE);
            result = close >= contentStart
                    ? result.substring(contentStart, close)
                    : result.substring(contentStart);
        }
        result = result.strip();
        int start = 0;
        int end = result.length();
        while (start < end && result.charAt(start) == '`') {
            start++;
        }
        while (end > start && result.charAt(end - 1) == '`') {
            end--;
        }
        return result.substring(start, end).strip();
    }

    /**
     * With an odd number of unescaped quotes, close the last opened string before the next
     * structural delimiter ({@code , } ] newline}) or at the end of the text.
     */
    public static String balanceQuotes(String text) {
        String source = nullToEmpty(text);
        int count = 0;
        int lastQuote = -1;
        boolean escaped = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                count++;
                lastQuote = i;
            }
        }
        if (count % 2 == 0) {
            return source;
        }
        int insertAt = source.length();
        for (int i = lastQuote + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == ',' || c == '}' || c == ']' || c == '\n') {
                insertAt = i;
                break;
            }
        }
        // A dangling backslash would escape the inserted quote.
        String head = source.substring(0, insertAt);
        if (endsWithOddBackslashes(head)) {
            head = head.substring(0, head.length() - 1);
        }
        return head + '"' + source.substring(insertAt);
    }

    /**
     * Append closers for every {@code {} / {@code [} left open, innermost first.
     * Braces and brackets inside strings are ignored; surplus closers are left alone.
     */
    public static String closeDelimiters(String text) {
        String source = nullToEmpty(text);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> open.push(c);
                case '}' -> popIfMatches(open, '{');
                case ']' -> popIfMatches(open, '[');
                default -> { }
            }
        }
        if (open.isEmpty()) {
            return source;
        }
        StringBuilder sb = new StringBuilder(source);
        while (!open.isEmpty()) {
            sb.append(open.pop() == '{' ? '}' : ']');
        }
        return sb.toString();
    }

    /**
     * Drop commas directly followed (ignoring whitespace) by {@code }} or {@code ]}.
     */
    public static String removeTrailingCommas(String text) {
        String source = nullToEmpty(text);
        StringBuilder sb = new StringBuilder(source.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (inString) {
                sb.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == ',') {
                int next = i + 1;
                while (next < source.length() && Character.isWhitespace(source.charAt(next))) {
                    next++;
                }
                if (next < source.length() && (source.charAt(next) == '}' || source.charAt(next) == ']')) {
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * {@code 'key':} → {@code "key":}. Only keys outside double-quoted strings are rewritten.
     */
    public static String quoteSingleQuotedKeys(String text) {
        String source = nullToEmpty(text);
        StringBuilder sb = new StringBuilder(source.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (inString) {
                sb.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '\'' && startsKey(source, i)) {
                int close = i + 1;
                while (close < source.length() && "'\"\n".indexOf(source.charAt(close)) < 0) {
                    close++;
                }
                int colon = close + 1;
                while (colon < source.length() && Character.isWhitespace(source.charAt(colon))) {
                    colon++;
                }
                if (close < source.length() && source.charAt(close) == '\''
                        && colon < source.length() && source.charAt(colon) == ':') {
                    sb.append('"').append(source, i + 1, close).append('"').append(source, close + 1, colon);
                    i = colon - 1;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean startsKey(String source, int quote) {
        if (quote == 0) {
            return true;
        }
        char before = source.charAt(quote - 1);
        return before == '{' || before == ',' || Character.isWhitespace(before);
    }

    /**
     * Remove {@code //} line comments and block comments that appear outside strings.
     */
    public static String stripComments(String text) {
        String source = nullToEmpty(text);
        StringBuilder sb = new StringBuilder(source.length());
        boolean inString = false;
        boolean escaped = false;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (inString) {
                sb.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == '/' && i + 1 < source.length()) {
                char next = source.charAt(i + 1);
                if (next == '/') {
                    int newline = source.indexOf('\n', i);
                    i = newline < 0 ? source.length() : newline;
                    continue;
                }
                if (next == '*') {
                    int end = source.indexOf("*/", i + 2);
                    i = end < 0 ? source.length() : end + 2;
                    continue;
                }
            }
            if (c == '"') {
                inString = true;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * Drop a backslash that precedes a character outside the JSON escape set, keeping the character.
     * {@code \[} becomes {@code [}; {@code \n}, {@code \"}, {@code \\} and {@code é} are kept as is.
     */
    public static String removeInvalidEscapes(String text) {
        String source = nullToEmpty(text);
        if (source.indexOf('\\') < 0) {
            return source;
        }
        StringBuilder sb = new StringBuilder(source.length());
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= source.length()) {
                i++;
                continue;
            }
            char next = source.charAt(i + 1);
            if (VALID_ESCAPES.indexOf(next) < 0) {
                sb.append(next);
            } else {
                sb.append(c).append(next);
            }
            i += 2;
        }
        return sb.toString();
    }

    /**
     * Every syntactically complete top-level object in the text, in order of appearance.
     * Braces inside quoted strings are ignored.
     */
    public static List<String> completeObjects(String text) {
        String source = nullToEmpty(text);
        List<String> objects = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escapeNext = false;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (escapeNext) {
                escapeNext = false;
                continue;
            }
            if (c == '\\' && inString) {
                escapeNext = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) {
                continue;
            }
            if (c == '{') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    objects.add(source.substring(start, i + 1));
                    start = -1;
                }
            }
        }
        return objects;
    }

    private static void popIfMatches(Deque<Character> open, char opener) {
        if (!open.isEmpty() && open.peek() == opener) {
            open.pop();
        }
    }

    private static boolean endsWithOddBackslashes(String s) {
        int n = 0;
        for (int i = s.length() - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            n++;
        }
        return n % 2 == 1;
    }

    private static boolean isLanguageTagChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '+';
    }

    private static int indexOfAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
