package com.scaleunlimited.crawlengine.pojos;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of named fields pulled from one page. A value is a String, a
 * list of Strings, or a nested record.
 */
@SuppressWarnings("serial")
public class ExtractedRecord implements Serializable {

    private final String _sourceUrl;
    private final long _fetchTime;
    private final LinkedHashMap<String, Object> _fields;

    public ExtractedRecord(String sourceUrl, long fetchTime) {
        _sourceUrl = sourceUrl;
        _fetchTime = fetchTime;
        _fields = new LinkedHashMap<>();
    }

    public ExtractedRecord put(String name, String value) {
        _fields.put(name, value);
        return this;
    }

    public ExtractedRecord put(String name, List<String> values) {
        _fields.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return this;
    }

    public ExtractedRecord put(String name, ExtractedRecord nested) {
        _fields.put(name, nested);
        return this;
    }

    public String getSourceUrl() {
        return _sourceUrl;
    }

    public long getFetchTime() {
        return _fetchTime;
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(_fields);
    }

    public Object get(String name) {
        return _fields.get(name);
    }

    /**
     * @return the field as a single string (first entry for a list), or null
     */
    @SuppressWarnings("unchecked")
    public String getString(String name) {
        Object value = _fields.get(name);
        if (value instanceof String) {
            return (String) value;
        } else if (value instanceof List) {
            List<String> values = (List<String>) value;
            return values.isEmpty() ? null : values.get(0);
        } else {
            return null;
        }
    }

    public boolean isEmpty() {
        return _fields.isEmpty();
    }

    public int size() {
        return _fields.size();
    }

    /**
     * JSON-like rendering, used by the logging sink.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        append(result, this);
        return result.toString();
    }

    @SuppressWarnings("unchecked")
    private static void append(StringBuilder result, Object value) {
        if (value instanceof ExtractedRecord) {
            result.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : ((ExtractedRecord) value)._fields.entrySet()) {
                if (!first) {
                    result.append(", ");
                }
                first = false;
                appendString(result, entry.getKey());
                result.append(": ");
                append(result, entry.getValue());
            }
            result.append('}');
        } else if (value instanceof List) {
            result.append('[');
            boolean first = true;
            for (String item : (List<String>) value) {
                if (!first) {
                    result.append(", ");
                }
                first = false;
                appendString(result, item);
            }
            result.append(']');
        } else {
            appendString(result, (String) value);
        }
    }

    private static void appendString(StringBuilder result, String value) {
        result.append('"');
        result.append(value.replace("\\", "\\\\").replace("\"", "\\\""));
        result.append('"');
    }

    @Override
    public int hashCode() {
        return _fields.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ExtractedRecord other = (ExtractedRecord) obj;
        return _fields.equals(other._fields);
    }
}
