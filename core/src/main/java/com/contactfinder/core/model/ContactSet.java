package com.contactfinder.core.model;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/** 정렬 + 중복 제거된 이메일/전화번호 묶음. */
public record ContactSet(List<String> emails, List<String> phones) {

    public static final ContactSet EMPTY = new ContactSet(List.of(), List.of());

    public ContactSet {
        emails = sortedUnique(emails);
        phones = sortedUnique(phones);
    }

    /** 두 묶음의 합집합(정렬 유지) */
    public ContactSet union(ContactSet other) {
        if (other == null || other.isEmpty()) return this;
        TreeSet<String> e = new TreeSet<>(emails);
        e.addAll(other.emails);
        TreeSet<String> p = new TreeSet<>(phones);
        p.addAll(other.phones);
        return new ContactSet(List.copyOf(e), List.copyOf(p));
    }

    public boolean isEmpty() { return emails.isEmpty() && phones.isEmpty(); }

    private static List<String> sortedUnique(Collection<String> in) {
        if (in == null || in.isEmpty()) return List.of();
        return List.copyOf(new TreeSet<>(in));
    }
}
