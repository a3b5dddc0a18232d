package com.myorg.justelparser.service;

import com.myorg.justelparser.model.ArticleContent;

public interface HtmlRenderer {

    /**
     * Renders an article. The same content must always yield the same bytes.
     */
    String render(ArticleContent content);
}
