package com.titlesearch.pipeline.browser;

public interface BrowserSessionFactory {
    BrowserSession create();
}
