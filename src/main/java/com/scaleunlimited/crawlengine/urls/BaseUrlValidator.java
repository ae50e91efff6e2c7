package com.scaleunlimited.crawlengine.urls;

import java.io.Serializable;

@SuppressWarnings("serial")
public abstract class BaseUrlValidator implements Serializable {

    public abstract boolean isValid(String urlString);

}
