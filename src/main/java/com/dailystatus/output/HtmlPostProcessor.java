package com.dailystatus.output;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;

/**
 * Final HTML cleanup and plain-text extraction based on Jsoup.
 */
public final class HtmlPostProcessor {

    public String cleanDocument(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        doc.outputSettings().charset(StandardCharsets.UTF_8);
        doc.outputSettings().prettyPrint(false);
        doc.outputSettings().syntax(Document.OutputSettings.Syntax.html);
        doc.select("script,noscript,iframe,object,embed").remove();
        doc.select("meta[http-equiv=refresh]").remove();
        return doc.outerHtml();
    }

    /**
     * Text rendition of the nested report lists, one line per entry, indented by nesting depth.
     */
    public String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        StringBuilder sb = new StringBuilder();
        String title = doc.title();
        if (!title.isBlank()) {
            sb.append(title.trim()).append("\n\n");
        }
        for (Element el : doc.body().select("p, li")) {
            if (el.tagName().equals("li") && hasBlockChild(el)) {
                continue;
            }
            String text = el.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            sb.append("  ".repeat(Math.max(0, listDepth(el) - 1))).append("- ").append(text).append("\n");
        }
        return sb.toString();
    }

    private boolean hasBlockChild(Element li) {
        for (Element child : li.children()) {
            if (child.tagName().equals("p") || child.tagName().equals("ul")) {
                return true;
            }
        }
        return false;
    }

    private int listDepth(Element el) {
        int depth = 0;
        for (Element parent : el.parents()) {
            if (parent.tagName().equals("ul")) {
                depth++;
            }
        }
        return depth;
    }
}
