package com.sunorcnys.mapping;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization used for fuzzy title/artist comparison and catalog queries.
 */
public final class TrackNormalizer {

    private static final Pattern QUALIFIER = Pattern.compile("\\(([^)]*)\\)|\\[([^\\]]*)\\]|\\s+-\\s+(.*)$");
    private static final Pattern VERSION_MARKER = Pattern.compile(
            "(?i)\\b(live|remix(?:ed)?|acoustic|instrumental|demo|karaoke|unplugged)\\b");

    private TrackNormalizer() {}

    /**
     * First credited artist of a combined credit such as {@code "A feat. B"} or {@code "A & B"}.
     * Names containing a bare slash (AC/DC) stay intact.
     */
    public static String primaryArtist(String artist) {
        if (artist == null) return null;
        String[] tokens = artist.split("\\s*(?:,|;|\\s+/\\s+|&|\\s+(?:feat\\.?|featuring|ft\\.?|with|x)\\s+)\\s*", -1);
        if (tokens.length == 0) {
            return artist.trim();
        }
        String primary = tokens[0].trim();
        return primary.isEmpty() ? artist.trim() : primary;
    }

    /**
     * Lower-cased title without diacritics, bracketed parts, remaster/version suffixes or punctuation.
     */
    public static String title(String title) {
        if (title == null) return null;
        String t = stripDiacritics(title);
        t = removeVersionSuffix(t);
        t = removeBracketedContent(t);
        return comparable(t.replace("&", "and"));
    }

    public static String artist(String artist) {
        String a = primaryArtist(artist);
        if (a == null) return null;
        return comparable(stripDiacritics(a).replace("&", "and"));
    }

    /**
     * Catalog search text: light clean-up only, the service does its own ranking.
     */
    public static String searchText(String title, String artist) {
        StringBuilder sb = new StringBuilder();
        if (title != null) {
            sb.append(canonicalizeWhitespace(removeBracketedContent(removeVersionSuffix(title))).trim());
        }
        String a = primaryArtist(artist);
        if (a != null && !a.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(a.trim());
        }
        return sb.toString();
    }

    /**
     * Recording variants named in a title's brackets or dash suffix, e.g. {@code live} for "Song (Live)".
     * Words in the main title do not count, so "Live Forever" has none.
     */
    public static Set<String> versionMarkers(String title) {
        Set<String> markers = new TreeSet<>();
        if (title == null) return markers;
        Matcher qualifier = QUALIFIER.matcher(stripDiacritics(title));
        while (qualifier.find()) {
            String part = qualifier.group(1) != null ? qualifier.group(1)
                    : qualifier.group(2) != null ? qualifier.group(2) : qualifier.group(3);
            Matcher marker = VERSION_MARKER.matcher(part);
            while (marker.find()) {
                String word = marker.group(1).toLowerCase(Locale.ROOT);
                markers.add(word.startsWith("remix") ? "remix" : word);
            }
        }
        return markers;
    }

    public static String stripDiacritics(String s) {
        if (s == null) return null;
        String norm = Normalizer.normalize(s, Normalizer.Form.NFD);
        return norm.replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
    }

    public static String canonicalizeWhitespace(String s) {
        return s == null ? null : s.replaceAll("\\s+", " ");
    }

    private static String comparable(String s) {
        String lowered = s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ");
        return canonicalizeWhitespace(lowered).trim();
    }

    private static String removeVersionSuffix(String t) {
        return t.replaceAll("(?i)\\s+-\\s+(\\d{4}\\s+)?(Remaster(ed)?|Live|Radio Edit|Single Version|Mono|Stereo|Deluxe|Remix|Edit)\\b.*$", "");
    }

    private static String removeBracketedContent(String t) {
        return t.replaceAll("\\s*\\([^)]*\\)", "")
                .replaceAll("\\s*\\[[^]]*\\]", "")
                .replaceAll("\\s*\\{[^}]*\\}", "");
    }
}
