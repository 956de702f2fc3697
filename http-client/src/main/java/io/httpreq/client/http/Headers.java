package io.httpreq.client.http;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * HTTP header multimap.
 *
 * <p>Keys are case-insensitive and stored in canonical MIME form: the first letter and
 * every letter following a hyphen are upper case, all other letters lower case, so
 * {@code content-type} is stored as {@code Content-Type}. A key that is not a valid
 * HTTP token, for example one containing a space, is stored unchanged.
 *
 * <p>Values keep the order in which they were added. Instances are not thread-safe.
 */
public final class Headers {

    private final Map<String, List<String>> entries = new LinkedHashMap<>();

    public Headers() {
    }

    private Headers(Headers other) {
        for (Map.Entry<String, List<String>> entry : other.entries.entrySet()) {
            entries.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
    }

    /**
     * Replaces every value associated with {@code key} by the single {@code value}.
     *
     * @param key the header name, any casing
     * @param value the header value
     * @return this instance
     */
    public Headers set(String key, String value) {
        checkNotNullParam("value", value);
        List<String> values = new ArrayList<>(1);
        values.add(value);
        entries.put(canonicalKey(checkNotNullParam("key", key)), values);
        return this;
    }

    /**
     * Appends {@code value} to the values associated with {@code key}.
     *
     * @param key the header name, any casing
     * @param value the header value
     * @return this instance
     */
    public Headers add(String key, String value) {
        checkNotNullParam("value", value);
        entries.computeIfAbsent(canonicalKey(checkNotNullParam("key", key)), k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * @param key the header name, any casing
     * @return the first value associated with {@code key}, or {@code null} if there is none
     */
    public @Nullable String get(String key) {
        List<String> values = entries.get(canonicalKey(key));
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * @param key the header name, any casing
     * @return every value associated with {@code key} in insertion order, never {@code null}
     */
    public List<String> values(String key) {
        List<String> values = entries.get(canonicalKey(key));
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public boolean contains(String key) {
        return entries.containsKey(canonicalKey(key));
    }

    public Headers remove(String key) {
        entries.remove(canonicalKey(key));
        return this;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return an unmodifiable snapshot of all entries keyed by canonical name
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            snapshot.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public Headers copy() {
        return new Headers(this);
    }

    /**
     * Returns the canonical form of a header key.
     *
     * @param key the header key
     * @return the canonical key, or {@code key} itself when it is not a valid token
     */
    public static String canonicalKey(String key) {
        if (!isToken(key)) {
            return key;
        }
        char[] chars = key.toCharArray();
        boolean upper = true;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (upper && c >= 'a' && c <= 'z') {
                chars[i] = (char) (c - ('a' - 'A'));
            } else if (!upper && c >= 'A' && c <= 'Z') {
                chars[i] = (char) (c + ('a' - 'A'));
            }
            upper = c == '-';
        }
        return new String(chars);
    }

    /**
     * @param s the string to check
     * @return whether {@code s} is a non-empty RFC 7230 token
     */
    static boolean isToken(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!isTokenChar(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTokenChar(char c) {
        if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') {
            return true;
        }
        return "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
