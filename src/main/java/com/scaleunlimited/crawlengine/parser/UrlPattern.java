package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A URL matches when it's found by at least one of the allow expressions (or
 * there are none), and by none of the deny expressions.
 */
@SuppressWarnings("serial")
public class UrlPattern implements Serializable {

    private final List<Pattern> _allow;
    private final List<Pattern> _deny;

    public UrlPattern(List<String> allow, List<String> deny) {
        _allow = compile(allow);
        _deny = compile(deny);
    }

    public static UrlPattern allowAll() {
        return new UrlPattern(Collections.<String> emptyList(), Collections.<String> emptyList());
    }

    public static UrlPattern allow(String... regexes) {
        return new UrlPattern(Arrays.asList(regexes), Collections.<String> emptyList());
    }

    /**
     * @return a new pattern that also excludes URLs matching <regexes>
     */
    public UrlPattern deny(String... regexes) {
        List<String> allow = new ArrayList<>();
        for (Pattern p : _allow) {
            allow.add(p.pattern());
        }

        List<String> deny = new ArrayList<>();
        for (Pattern p : _deny) {
            deny.add(p.pattern());
        }
        deny.addAll(Arrays.asList(regexes));
        return new UrlPattern(allow, deny);
    }

    public boolean matches(String url) {
        boolean allowed = _allow.isEmpty();
        for (Pattern p : _allow) {
            if (p.matcher(url).find()) {
                allowed = true;
                break;
            }
        }

        if (!allowed) {
            return false;
        }

        for (Pattern p : _deny) {
            if (p.matcher(url).find()) {
                return false;
            }
        }

        return true;
    }

    private static List<Pattern> compile(List<String> regexes) {
        List<Pattern> result = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            result.add(Pattern.compile(regex));
        }

        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return String.format("allow=%s deny=%s", _allow, _deny);
    }
}
