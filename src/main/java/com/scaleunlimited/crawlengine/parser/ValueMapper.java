package com.scaleunlimited.crawlengine.parser;

import java.io.Serializable;
import java.util.List;

/**
 * Post-processing hook for a field extractor. Gets every match, returns the
 * value to store (null or empty to skip the field).
 */
public interface ValueMapper extends Serializable {

    List<String> map(List<String> matches) throws Exception;
}
