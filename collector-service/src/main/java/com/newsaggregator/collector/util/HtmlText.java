package com.newsaggregator.collector.util;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * HTML 요소를 줄 구분이 살아있는 평문으로 변환
 */
public final class HtmlText {

    private static final String BLOCKS = "p, div, li, h1, h2, h3, h4, h5, h6, blockquote, pre, tr";

    private HtmlText() {
    }

    public static String toPlainText(Element root) {
        Element copy = root.clone();
        copy.select("br").forEach(br -> br.after(new TextNode("\n")));
        for (Element block : copy.select(BLOCKS)) {
            if (block != copy) {
                block.after(new TextNode("\n"));
            }
        }
        return TextNormalizer.cleanMultiline(copy.wholeText());
    }
}
