package com.scaleunlimited.crawlengine.urls;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Restricts a crawl to a set of domains (and their sub-domains).
 */
@SuppressWarnings("serial")
public class DomainUrlValidator extends SimpleUrlValidator {
    private List<String> _domains;

    public DomainUrlValidator(Collection<String> domains) {
        super();

        _domains = new ArrayList<>(domains.size());
        for (String domain : domains) {
            _domains.add(domain.toLowerCase(Locale.ROOT));
        }
    }

    @Override
    public boolean isValid(String urlString) {
        if (!(super.isValid(urlString))) {
            return false;
        }

        for (String domain : _domains) {
            if (isUrlWithinDomain(urlString, domain)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Check whether the host of the URL is the given domain or a subdomain of it.
     * 
     * @param url
     * @param domain lower-cased domain name
     * @return true iff url is "within" domain
     */
    public static boolean isUrlWithinDomain(String url, String domain) {
        try {
            String host = new URL(url).getHost().toLowerCase(Locale.ROOT);
            return host.equals(domain) || host.endsWith("." + domain);
        } catch (MalformedURLException e) {
            return false;
        }
    }

}
