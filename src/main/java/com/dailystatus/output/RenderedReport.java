package com.dailystatus.output;

/**
 * Subject line plus the self-contained HTML document and its text rendition.
 */
public record RenderedReport(String subject, String html, String text) {
    public RenderedReport {
        subject = subject == null ? "" : subject;
        html = html == null ? "" : html;
        text = text == null ? "" : text;
    }
}
