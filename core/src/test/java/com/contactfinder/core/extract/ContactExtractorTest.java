package com.contactfinder.core.extract;

import com.contactfinder.core.model.ContactSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContactExtractorTest {

    @Test
    void plainEmails_are_deduplicated_and_sorted() {
        String html = "<p>Redaktion: red@tidning.se</p>"
                + "<p>Annonser: ads@tidning.se, red@tidning.se</p>"
                + "<footer>INFO@tidning.se</footer>";

        ContactSet c = ContactExtractor.extract(html);

        // 사전순: 대문자가 먼저
        assertThat(c.emails()).containsExactly("INFO@tidning.se", "ads@tidning.se", "red@tidning.se");
        assertThat(c.phones()).isEmpty();
    }

    @Test
    @DisplayName("난독화 이메일: at/dot 치환 → 정규형 복원")
    void obfuscatedEmail_is_reconstructed() {
        ContactSet c = ContactExtractor.extract("Skriv till jane at example dot com");

        assertThat(c.emails()).containsExactly("jane@example.com");
    }

    @Test
    void obfuscatedEmail_with_brackets_and_mixed_case() {
        ContactSet c = ContactExtractor.extract("kontakt (at) tidning [dot] se / Jane AT Example DOT org");

        assertThat(c.emails()).contains("kontakt@tidning.se", "Jane@Example.org");
    }

    @Test
    @DisplayName("NBSP(U+00A0) 로 띄운 난독화 이메일도 복원")
    void obfuscatedEmail_with_non_breaking_spaces() {
        assertThat(ContactExtractor.extract("jane\u00a0at\u00a0example\u00a0dot\u00a0com").emails())
                .containsExactly("jane@example.com");
        assertThat(ContactExtractor.extract("jane\u00a0(at)\u00a0example\u00a0(dot)\u00a0se").emails())
                .containsExactly("jane@example.se");
    }

    @Test
    void obfuscated_and_plain_forms_merge_into_one_set() {
        ContactSet c = ContactExtractor.extract("jane@example.com eller jane at example dot com");

        assertThat(c.emails()).containsExactly("jane@example.com");
    }

    @Test
    void phones_are_trimmed_sorted_and_unique() {
        String text = "Tel: +46 70 000 00 02 \n Växel: +46 70 000 00 01 \n Fax: +46 70 000 00 02";

        ContactSet c = ContactExtractor.extract(text);

        assertThat(c.phones()).containsExactly("+46 70 000 00 01", "+46 70 000 00 02");
    }

    @Test
    void phone_with_parentheses_and_hyphen() {
        ContactSet c = ContactExtractor.extract("Ring 08-555 12 34 eller (0)8.555.12.35");

        assertThat(c.phones()).contains("08-555 12 34", "0)8.555.12.35");
    }

    @Test
    void shortDigitRuns_are_not_phones() {
        ContactSet c = ContactExtractor.extract("Nr 12345 och 123-45");

        assertThat(c.phones()).isEmpty();
    }

    @Test
    @DisplayName("전화 패턴 과매칭(날짜 등)은 관측 동작으로 유지")
    void permissivePhonePattern_matches_dates_too() {
        ContactSet c = ContactExtractor.extract("Publicerad 2024-01-15");

        assertThat(c.phones()).containsExactly("2024-01-15");
    }

    @Test
    void extraction_is_idempotent() {
        String text = "a@b.se, +46 8 123 45 67, c at d dot se, a@b.se";

        ContactSet first = ContactExtractor.extract(text);
        ContactSet second = ContactExtractor.extract(text);

        assertThat(second).isEqualTo(first);
        assertThat(first.emails()).doesNotHaveDuplicates().isSorted();
        assertThat(first.phones()).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void nullOrEmpty_yields_empty_set() {
        assertThat(ContactExtractor.extract(null).isEmpty()).isTrue();
        assertThat(ContactExtractor.extract("").isEmpty()).isTrue();
    }

    @Test
    void union_keeps_sorted_unique() {
        ContactSet a = ContactExtractor.extract("b@x.se +46 8 123 45 67");
        ContactSet b = ContactExtractor.extract("a@x.se b@x.se");

        ContactSet u = a.union(b);

        assertThat(u.emails()).containsExactly("a@x.se", "b@x.se");
        assertThat(u.phones()).containsExactly("+46 8 123 45 67");
    }
}
