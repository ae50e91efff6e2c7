package com.scaleunlimited.crawlengine.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.tika.utils.CharsetUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import com.scaleunlimited.crawlengine.pojos.FetchedResponse;
import com.scaleunlimited.crawlengine.utils.HttpUtils;

/**
 * A parsed HTML response, plus the helpers that extractors use to pull values
 * out of it. A page may also be scoped to a single element, for nested fields.
 */
public class Page {

    private static final String DEFAULT_CHARSET = "UTF-8";

    private final FetchedResponse _response;
    private final URL _baseUrl;
    private final Document _document;
    private final Element _root;

    private Page(FetchedResponse response, URL baseUrl, Document document, Element root) {
        _response = response;
        _baseUrl = baseUrl;
        _document = document;
        _root = root;
    }

    public static Page parse(FetchedResponse response) throws ExtractionException {
        String url = response.getUrl();

        URL baseUrl;
        try {
            baseUrl = getContentLocation(response);
        } catch (MalformedURLException e) {
            throw new ExtractionException(url, "Invalid base URL", e);
        }

        String charset = getCharset(response);
        try {
            Document doc = Jsoup.parse(new ByteArrayInputStream(response.getContent()), charset,
                    baseUrl.toExternalForm());
            return new Page(response, baseUrl, doc, doc);
        } catch (IOException | IllegalArgumentException e) {
            // Jsoup reports a bad charset name as an IllegalArgumentException subclass.
            throw new ExtractionException(url, "Can't parse HTML using " + charset, e);
        }
    }

    public FetchedResponse getResponse() {
        return _response;
    }

    public String getUrl() {
        return _response.getUrl();
    }

    public URL getBaseUrl() {
        return _baseUrl;
    }

    public Document getDocument() {
        return _document;
    }

    /**
     * @return a page whose selectors and regexes only see <element>
     */
    public Page scopedTo(Element element) {
        return new Page(_response, _baseUrl, _document, element);
    }

    public Elements select(String cssSelector) throws ExtractionException {
        try {
            return _root.select(cssSelector);
        } catch (Selector.SelectorParseException e) {
            throw new ExtractionException(getUrl(), "Invalid CSS selector: " + cssSelector, e);
        }
    }

    /**
     * @return trimmed text of every element matching <cssSelector>, skipping
     *         empty ones
     */
    public List<String> selectText(String cssSelector) throws ExtractionException {
        List<String> result = new ArrayList<>();
        for (Element e : select(cssSelector)) {
            String text = e.text().trim();
            if (!text.isEmpty()) {
                result.add(text);
            }
        }

        return result;
    }

    /**
     * @return absolute value of <attribute> for every element matching
     *         <cssSelector>
     */
    public List<String> selectAttribute(String cssSelector, String attribute)
            throws ExtractionException {
        List<String> result = new ArrayList<>();
        for (Element e : select(cssSelector)) {
            String value = e.attr("abs:" + attribute);
            if (value.isEmpty()) {
                value = e.attr(attribute);
            }

            if (!value.isEmpty()) {
                result.add(value);
            }
        }

        return result;
    }

    /**
     * Run <pattern> over the page's HTML. When the pattern has a capturing group
     * we return group 1, otherwise the whole match.
     */
    public List<String> matchRegex(Pattern pattern) {
        List<String> result = new ArrayList<>();
        Matcher m = pattern.matcher(_root.outerHtml());
        while (m.find()) {
            String value = (m.groupCount() > 0) ? m.group(1) : m.group();
            if (value != null) {
                result.add(value);
            }
        }

        return result;
    }

    public String getTitle() {
        return _document.title();
    }

    /**
     * @return true if a robots meta tag says not to follow links on this page.
     */
    public boolean isNoFollow() {
        for (Element meta : _document.select("meta[name]")) {
            if (!meta.attr("name").equalsIgnoreCase("robots")) {
                continue;
            }

            for (String directive : meta.attr("content").split(",")) {
                directive = directive.trim().toLowerCase(Locale.ROOT);
                if (directive.equals("none") || directive.equals("nofollow")) {
                    return true;
                }
            }
        }

        return false;
    }

    /**
     * @return <link> resolved against the page's base URL, or null if that fails
     */
    public String resolve(String link) {
        try {
            return new URL(_baseUrl, link.trim()).toExternalForm();
        } catch (MalformedURLException e) {
            return null;
        }
    }

    private static String getCharset(FetchedResponse response) {
        String charset = CharsetUtils.clean(HttpUtils.getCharsetFromContentType(response.getContentType()));
        return (charset == null) ? DEFAULT_CHARSET : charset;
    }

    private static URL getContentLocation(FetchedResponse response) throws MalformedURLException {
        URL baseUrl = new URL(response.getUrl());

        String clUrl = response.getHeader(HttpUtils.CONTENT_LOCATION);
        if (clUrl != null) {
            baseUrl = new URL(baseUrl, clUrl);
        }

        return baseUrl;
    }
}
