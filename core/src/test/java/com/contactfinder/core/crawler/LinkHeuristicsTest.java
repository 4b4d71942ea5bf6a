package com.contactfinder.core.crawler;

import com.contactfinder.core.model.Anchor;
import com.contactfinder.core.model.CrawlerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkHeuristicsTest {

    private static final String BASE = "https://tidning.se/";

    private static final String HOME = """
            <html><body>
              <nav>
                <a href="/about-us">Who we are</a>
                <a href="/shop">Butik</a>
                <a href="/kontakt">KONTAKT</a>
                <a href="https://tidning.se/kontakt">Skriv till oss</a>
                <a href="/press">Press</a>
              </nav>
            </body></html>
            """;

    private static CrawlerConfig hints(String... hints) {
        return CrawlerConfig.defaults().setContactHints(List.of(hints));
    }

    @Test
    void candidates_follow_document_order_without_duplicates() {
        LinkHeuristics h = new LinkHeuristics();

        List<String> c = h.findCandidateContactPages(HOME, BASE, hints("kontakt", "about"));

        assertThat(c).containsExactly("https://tidning.se/about-us", "https://tidning.se/kontakt");
    }

    @Test
    void hint_matches_text_or_raw_href_case_insensitively() {
        LinkHeuristics h = new LinkHeuristics();

        assertThat(h.findCandidateContactPages(HOME, BASE, hints("PRESS")))
                .containsExactly("https://tidning.se/press");
        assertThat(h.findCandidateContactPages(HOME, BASE, hints("skriv")))
                .containsExactly("https://tidning.se/kontakt");
    }

    @Test
    void candidates_are_capped_by_maxContactPages() {
        LinkHeuristics h = new LinkHeuristics();

        assertThat(h.findCandidateContactPages(HOME, BASE, hints("kontakt", "about").setMaxContactPages(1)))
                .containsExactly("https://tidning.se/about-us");
        assertThat(h.findCandidateContactPages(HOME, BASE, hints("kontakt", "about").setMaxContactPages(0)))
                .isEmpty();
    }

    @Test
    void noHintMatch_gives_empty_list() {
        LinkHeuristics h = new LinkHeuristics();

        assertThat(h.findCandidateContactPages(HOME, BASE, hints("impressum"))).isEmpty();
    }

    @Test
    void extractLinks_resolves_relative_and_keeps_absolute_http() {
        String html = """
                <a href="/a">A</a>
                <a href="https://x.se/b">B</a>
                <a href="c">C</a>
                <a href="   ">blank</a>
                <a name="anchor-only">no href</a>
                """;

        LinkHeuristics h = new LinkHeuristics();

        assertThat(h.extractLinks(html, "https://tidning.se/dir/"))
                .containsExactlyInAnyOrder("https://tidning.se/a", "https://x.se/b", "https://tidning.se/dir/c");
    }

    @Test
    void base_element_in_page_is_ignored() {
        String html = """
                <html><head><base href="https://cdn.example/assets/"></head>
                <body><a href="/kontakt">Kontakt</a> <a href="om">Om oss</a></body></html>
                """;

        LinkHeuristics h = new LinkHeuristics();

        assertThat(h.extractLinks(html, "https://tidning.se/dir/"))
                .containsExactlyInAnyOrder("https://tidning.se/kontakt", "https://tidning.se/dir/om");
        assertThat(h.findCandidateContactPages(html, "https://tidning.se/dir/", hints("kontakt")))
                .containsExactly("https://tidning.se/kontakt");
    }

    @Test
    void custom_extractor_is_used() {
        LinkExtractor fake = (html, base) -> List.of(
                new Anchor("/contact", "Contact", base + "contact"),
                new Anchor("/contact", "Contact again", base + "contact"),
                new Anchor("/news", "News", base + "news"));
        LinkHeuristics h = new LinkHeuristics(fake);

        assertThat(h.findCandidateContactPages("<ignored>", "https://m.example/", hints("contact")))
                .containsExactly("https://m.example/contact");
        assertThat(h.extractLinks("<ignored>", "https://m.example/"))
                .containsExactlyInAnyOrder("https://m.example/contact", "https://m.example/news");
    }
}
