package com.example.procloner.service;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Points saved markup and stylesheets at the local copies recorded in the URL to path table.
 * References with no local copy are left as they are.
 */
@Component
public class ReferenceRewriter {

    private static final String[] URL_ATTRIBUTES = {"src", "href", "poster", "data-src", "environment-image", "skybox-image", "data"};

    /**
     * Rewrites one saved page in place.
     *
     * @param localByUrl absolute source URL to output-relative path, for pages and downloaded assets
     * @return the number of references rewritten
     */
    public int rewritePage(Path outputRoot, String pageUrl, String pageLocalPath, Map<String, String> localByUrl)
            throws IOException {
        Path file = outputRoot.resolve(pageLocalPath);
        Document doc = Jsoup.parse(file.toFile(), null, pageUrl);
        int rewritten = 0;
        for (String attr : URL_ATTRIBUTES) {
            for (Element el : doc.select("[" + attr + "]")) {
                String local = localFor(el.attr(attr), pageUrl, pageLocalPath, localByUrl);
                if (local != null) {
                    el.attr(attr, local);
                    rewritten++;
                }
            }
        }
        for (Element el : doc.select("[srcset]")) {
            String value = rewriteSrcSet(el.attr("srcset"), pageUrl, pageLocalPath, localByUrl);
            if (!value.equals(el.attr("srcset"))) {
                el.attr("srcset", value);
                rewritten++;
            }
        }
        for (Element el : doc.select("[style]")) {
            String css = el.attr("style");
            String value = rewriteCss(css, pageUrl, pageLocalPath, localByUrl);
            if (!value.equals(css)) {
                el.attr("style", value);
                rewritten++;
            }
        }
        for (Element st : doc.select("style")) {
            String css = st.data();
            String value = rewriteCss(css, pageUrl, pageLocalPath, localByUrl);
            if (!value.equals(css)) {
                st.text(value);
                rewritten++;
            }
        }
        Files.write(file, doc.outerHtml().getBytes(StandardCharsets.UTF_8));
        return rewritten;
    }

    /**
     * Rewrites a saved stylesheet in place.
     */
    public boolean rewriteStylesheet(Path outputRoot, String cssUrl, String cssLocalPath, Map<String, String> localByUrl)
            throws IOException {
        Path file = outputRoot.resolve(cssLocalPath);
        String css = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        String value = rewriteCss(css, cssUrl, cssLocalPath, localByUrl);
        if (value.equals(css)) return false;
        Files.write(file, value.getBytes(StandardCharsets.UTF_8));
        return true;
    }

    public String rewriteCss(String cssText, String baseUrl, String fromLocalPath, Map<String, String> localByUrl) {
        if (cssText == null || cssText.isEmpty()) return cssText == null ? "" : cssText;
        Matcher m = ReferenceExtractor.CSS_URL_PATTERN.matcher(cssText);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String local = localFor(m.group(2), baseUrl, fromLocalPath, localByUrl);
            if (local == null) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            } else {
                m.appendReplacement(sb, Matcher.quoteReplacement("url('" + local + "')"));
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    String rewriteSrcSet(String srcset, String baseUrl, String fromLocalPath, Map<String, String> localByUrl) {
        String[] parts = srcset.split(",");
        StringBuilder rebuilt = new StringBuilder();
        for (String part : parts) {
            String item = part.trim();
            if (item.isEmpty()) continue;
            String urlPart = item;
            String descriptor = "";
            int sp = item.indexOf(' ');
            if (sp > 0) {
                urlPart = item.substring(0, sp).trim();
                descriptor = item.substring(sp + 1).trim();
            }
            String local = localFor(urlPart, baseUrl, fromLocalPath, localByUrl);
            if (rebuilt.length() > 0) rebuilt.append(", ");
            rebuilt.append(local != null ? local : urlPart);
            if (!descriptor.isEmpty()) rebuilt.append(' ').append(descriptor);
        }
        return rebuilt.toString();
    }

    private static String localFor(String raw, String baseUrl, String fromLocalPath, Map<String, String> localByUrl) {
        String abs = ReferenceExtractor.resolve(raw, baseUrl);
        if (abs == null) return null;
        String target = localByUrl.get(abs);
        if (target == null) return null;
        String rel = PathMapper.relativize(fromLocalPath, target);
        int hash = raw.indexOf('#');
        return hash >= 0 ? rel + raw.substring(hash) : rel;
    }
}
