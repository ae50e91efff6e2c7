package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.List;

import com.scaleunlimited.crawlengine.pojos.ExtractedRecord;

/**
 * Contributes one named field to a page's record.
 */
@SuppressWarnings("serial")
public abstract class BaseFieldExtractor implements Serializable {

    private final String _fieldName;
    private ValueMapper _mapper;

    public BaseFieldExtractor(String fieldName) {
        if ((fieldName == null) || fieldName.isEmpty()) {
            throw new IllegalArgumentException("Field name must be set");
        }

        _fieldName = fieldName;
    }

    public String getFieldName() {
        return _fieldName;
    }

    public BaseFieldExtractor setMapper(ValueMapper mapper) {
        _mapper = mapper;
        return this;
    }

    /**
     * Add this extractor's field to <record>, if the page has a value for it.
     * 
     * @return true if a field was added
     */
    public boolean extract(Page page, ExtractedRecord record) throws ExtractionException {
        List<String> matches = getMatches(page);
        if (_mapper != null) {
            try {
                matches = _mapper.map(matches);
            } catch (Exception e) {
                throw new ExtractionException(page.getUrl(),
                        "Value mapper failed for field " + _fieldName, e);
            }
        }

        if ((matches == null) || matches.isEmpty()) {
            return false;
        }

        if (matches.size() == 1) {
            record.put(_fieldName, matches.get(0));
        } else {
            record.put(_fieldName, matches);
        }

        return true;
    }

    protected abstract List<String> getMatches(Page page) throws ExtractionException;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + _fieldName + ")";
    }
}
