package com.contactfinder.core.crawler;

import com.contactfinder.core.model.Anchor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 기본 JSoup 기반 앵커 추출기: a[href] → (href, text, abs:href) */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<Anchor> anchors(String html, String baseUrl) {
        List<Anchor> out = new ArrayList<>();
        if (html == null || html.isEmpty()) return out;

        String base = baseUrl == null ? "" : baseUrl;
        Document doc = Jsoup.parse(html, base);
        // 문서 안의 <base href> 는 무시: 항상 페이지 URL 기준으로 해석
        doc.select("base").remove();
        doc.setBaseUri(base);
        for (Element a : doc.select("a[href]")) {
            // abs:href 는 해석 불가 시 "" 를 돌려준다
            out.add(new Anchor(a.attr("href"), a.text(), a.absUrl("href")));
        }
        return out;
    }
}
