package com.contactfinder.core.extract;

import com.contactfinder.core.model.ContactSet;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 원문 텍스트(HTML 포함)에서 연락처 추출.
 * - 이메일: local@domain.tld
 * - 난독화 이메일: "jane at example dot com", "jane (at) example [dot] com" → jane@example.com
 * - 전화: + 선택, 숫자 사이에 공백/괄호/점/하이픈 허용, 최소 8자
 * 결과는 발견 순서가 아니라 사전순 정렬 (페이지 레이아웃이 바뀌어도 출력 안정).
 * 전화 패턴은 날짜/ID 같은 숫자열도 잡는다. 관측되는 동작이므로 그대로 둔다.
 */
public final class ContactExtractor {

    static final Pattern EMAIL = Pattern.compile(
            "[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}");

    static final Pattern PHONE = Pattern.compile(
            "\\+?\\d[\\d\\s().\\-]{6,}\\d", Pattern.UNICODE_CHARACTER_CLASS);

    static final Pattern OBFUSCATED = Pattern.compile(
            "([a-zA-Z0-9._%+\\-]+)\\s*(?:\\(|\\[)?at(?:\\)|\\])?\\s*"
                    + "([a-zA-Z0-9.\\-]+)\\s*(?:\\(|\\[)?dot(?:\\)|\\])?\\s*([a-zA-Z]{2,})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    private ContactExtractor() {}

    public static ContactSet extract(String text) {
        if (text == null || text.isEmpty()) return ContactSet.EMPTY;

        Set<String> emails = new TreeSet<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) emails.add(m.group());

        m = OBFUSCATED.matcher(text);
        while (m.find()) {
            emails.add(m.group(1) + "@" + m.group(2) + "." + m.group(3));
        }

        Set<String> phones = new TreeSet<>();
        m = PHONE.matcher(text);
        while (m.find()) {
            String p = m.group().strip();
            if (!p.isEmpty()) phones.add(p);
        }

        return new ContactSet(emails.stream().toList(), phones.stream().toList());
    }
}
