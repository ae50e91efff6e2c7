/*
 * Copyright 2009-2018 Scale Unlimited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.scaleunlimited.crawlengine.urls;

import java.net.URI;
import java.net.URL;
import java.util.regex.Pattern;

/**
 * Accepts absolute http(s) URLs that have a host, and that parse both as a
 * {@link URL} and as a {@link URI} (so unencoded junk is rejected).
 */
@SuppressWarnings("serial")
public class SimpleUrlValidator extends BaseUrlValidator {
    private static final Pattern HTTP_PATTERN = Pattern.compile("^(http|https):", Pattern.CASE_INSENSITIVE);

    private Pattern _invalidSuffixes;

    public SimpleUrlValidator() {
        super();

        _invalidSuffixes = null;
    }

    public SimpleUrlValidator(String... suffixes) {
        super();

        if (suffixes.length == 0) {
            _invalidSuffixes = null;
        } else {
            _invalidSuffixes = Pattern.compile("\\.(" + String.join("|", suffixes) + ")$",
                    Pattern.CASE_INSENSITIVE);
        }
    }

    @Override
    public boolean isValid(String urlString) {
        if ((urlString == null) || !HTTP_PATTERN.matcher(urlString).find()) {
            return false;
        }

        try {
            URL url = new URL(urlString);
            String hostname = url.getHost();
            if ((hostname == null) || hostname.isEmpty()) {
                return false;
            }

            URI uri = new URI(urlString);
            hostname = uri.getHost();
            if ((hostname == null) || hostname.isEmpty()) {
                return false;
            }

            if (_invalidSuffixes == null) {
                return true;
            } else {
                return !_invalidSuffixes.matcher(url.getPath()).find();
            }
        } catch (Exception e) {
            return false;
        }
    }
}
