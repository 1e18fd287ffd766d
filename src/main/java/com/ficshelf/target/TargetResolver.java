package com.ficshelf.target;

import com.ficshelf.errors.InvalidReferenceException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns user-supplied references (bare ids or URLs) into {@link Target}s.
 * Resolution is a pure function over a fixed table of supported sites; no
 * network access happens here.
 */
public final class TargetResolver {

    public static final String UNKNOWN_SOURCE = "unknown";
    public static final String DEFAULT_SOURCE = "ffnet";

    private static final Pattern BARE_ID = Pattern.compile("^\\d+$");
    private static final Pattern ANY_HTTP_URL = Pattern.compile("^https?://[^\\s/?#]+(?:[/?#]\\S*)?$", Pattern.CASE_INSENSITIVE);

    private static final List<Site> SITES = List.of(
        new Site("ffnet", "(?:www\\.|m\\.)?fanfiction\\.net/s/(\\d+)", "https://www.fanfiction.net/s/%s/1/"),
        new Site("fpcom", "(?:www\\.|m\\.)?fictionpress\\.com/s/(\\d+)", "https://www.fictionpress.com/s/%s/1/"),
        new Site("ao3", "(?:www\\.)?archiveofourown\\.org/(?:collections/[^/\\s]+/)?works/(\\d+)", "https://archiveofourown.org/works/%s"),
        new Site("fsb", "forums\\.spacebattles\\.com/threads/(?:[^/?#\\s]*\\.)?(\\d+)", "https://forums.spacebattles.com/threads/%s/"),
        new Site("fsv", "forums\\.sufficientvelocity\\.com/threads/(?:[^/?#\\s]*\\.)?(\\d+)", "https://forums.sufficientvelocity.com/threads/%s/"),
        new Site("fqq", "forum\\.questionablequesting\\.com/threads/(?:[^/?#\\s]*\\.)?(\\d+)", "https://forum.questionablequesting.com/threads/%s/")
    );

    private TargetResolver() {
    }

    /**
     * Resolve a reference to a target.
     *
     * @param reference a positive numeric fanfiction.net id or an http(s) URL
     * @return the target, with its canonical URL
     * @throws InvalidReferenceException if the reference matches no supported form
     */
    public static Target resolve(String reference) {
        if (reference == null) {
            throw new InvalidReferenceException("null");
        }
        String trimmed = reference.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidReferenceException(reference);
        }

        if (BARE_ID.matcher(trimmed).matches()) {
            String id = normalizeId(trimmed);
            if ("0".equals(id)) {
                throw new InvalidReferenceException(reference);
            }
            return siteFor(DEFAULT_SOURCE).target(id);
        }

        for (Site site : SITES) {
            Matcher m = site.exact.matcher(trimmed);
            if (m.matches()) {
                return site.target(normalizeId(m.group(1)));
            }
        }

        if (ANY_HTTP_URL.matcher(trimmed).matches()) {
            return new Target(trimmed, new TargetIdentity(UNKNOWN_SOURCE, bleachName(trimmed)));
        }

        throw new InvalidReferenceException(reference);
    }

    /**
     * Whether {@link #resolve(String)} would accept the reference.
     */
    public static boolean isValid(String reference) {
        try {
            resolve(reference);
            return true;
        } catch (InvalidReferenceException e) {
            return false;
        }
    }

    /**
     * Find every supported-site story URL mentioned in free text, in order of
     * appearance. Later mentions of an already found story are dropped.
     */
    public static List<Target> findAllReferences(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        TreeMap<Integer, Target> byPosition = new TreeMap<>();
        for (Site site : SITES) {
            Matcher m = site.embedded.matcher(text);
            while (m.find()) {
                byPosition.putIfAbsent(m.start(), site.target(normalizeId(m.group(1))));
            }
        }
        Map<TargetIdentity, Target> unique = new LinkedHashMap<>();
        for (Target target : byPosition.values()) {
            unique.putIfAbsent(target.getIdentity(), target);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Source abbreviations with a dedicated URL pattern.
     */
    public static List<String> knownSources() {
        List<String> result = new ArrayList<>();
        for (Site site : SITES) {
            result.add(site.abbrev);
        }
        return result;
    }

    /**
     * Make a name safe for use as a single path segment. Empty and dot-only
     * names become underscores.
     */
    public static String bleachName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            switch (c) {
                case '\0':
                case '/':
                case '\\':
                case '#':
                case '?':
                case '&':
                case '=':
                case ':':
                    sb.append('_');
                    break;
                default:
                    sb.append(c);
            }
        }
        if (sb.length() == 0) {
            return "_";
        }
        if (sb.toString().chars().allMatch(ch -> ch == '.')) {
            return sb.toString().replace('.', '_');
        }
        return sb.toString();
    }

    private static String normalizeId(String digits) {
        return new BigInteger(digits).toString();
    }

    private static Site siteFor(String abbrev) {
        for (Site site : SITES) {
            if (site.abbrev.equals(abbrev)) {
                return site;
            }
        }
        throw new IllegalStateException("No site registered for " + abbrev);
    }

    private static final class Site {
        private final String abbrev;
        private final Pattern exact;
        private final Pattern embedded;
        private final String canonicalFormat;

        Site(String abbrev, String hostAndPath, String canonicalFormat) {
            this.abbrev = abbrev;
            this.exact = Pattern.compile("^https?://" + hostAndPath + "(?:[/?#.]\\S*)?$", Pattern.CASE_INSENSITIVE);
            this.embedded = Pattern.compile("(?:https?://)?" + hostAndPath, Pattern.CASE_INSENSITIVE);
            this.canonicalFormat = canonicalFormat;
        }

        Target target(String id) {
            return new Target(String.format(canonicalFormat, id), new TargetIdentity(abbrev, id));
        }
    }
}
