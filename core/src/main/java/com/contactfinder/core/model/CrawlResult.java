package com.contactfinder.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 사이트 1개의 크롤 결과.
 * 불변식: error != null 이면 outcome == FAILED 이고 emails/phones/contactPagesChecked 는 비어 있다.
 * 연락처 페이지 일부 실패는 오류가 아니라 PARTIAL + skippedContactPages 로 남긴다.
 */
public final class CrawlResult {

    public enum Outcome {
        /** 홈 + 모든 후보 페이지 성공 */
        COMPLETE,
        /** 홈은 성공, 후보 페이지 중 일부 실패(건너뜀) */
        PARTIAL,
        /** 홈 페이지 fetch 실패 */
        FAILED
    }

    private final String site;
    private final List<String> emails;
    private final List<String> phones;
    private final List<String> contactPagesChecked;
    private final List<String> skippedContactPages;
    private final String error;

    private CrawlResult(Builder b) {
        this.site = Objects.requireNonNull(b.site, "site");
        this.emails = (b.emails == null) ? List.of() : List.copyOf(b.emails);
        this.phones = (b.phones == null) ? List.of() : List.copyOf(b.phones);
        this.contactPagesChecked = (b.contactPagesChecked == null) ? List.of() : List.copyOf(b.contactPagesChecked);
        this.skippedContactPages = (b.skippedContactPages == null) ? List.of() : List.copyOf(b.skippedContactPages);
        this.error = b.error;
    }

    /** 홈 페이지 실패 결과: site + error 만 채운다. */
    public static CrawlResult failed(String site, String error) {
        return builder().site(site).error(error == null ? "unknown error" : error).build();
    }

    public String getSite() { return site; }
    public List<String> getEmails() { return emails; }
    public List<String> getPhones() { return phones; }
    public List<String> getContactPagesChecked() { return contactPagesChecked; }
    public List<String> getSkippedContactPages() { return skippedContactPages; }
    public String getError() { return error; }

    public Outcome getOutcome() {
        if (error != null) return Outcome.FAILED;
        return skippedContactPages.isEmpty() ? Outcome.COMPLETE : Outcome.PARTIAL;
    }

    public boolean isFailed() { return error != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrawlResult r)) return false;
        return site.equals(r.site)
                && emails.equals(r.emails)
                && phones.equals(r.phones)
                && contactPagesChecked.equals(r.contactPagesChecked)
                && skippedContactPages.equals(r.skippedContactPages)
                && Objects.equals(error, r.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(site, emails, phones, contactPagesChecked, skippedContactPages, error);
    }

    @Override
    public String toString() {
        return "CrawlResult{site=" + site + ", outcome=" + getOutcome()
                + ", emails=" + emails.size() + ", phones=" + phones.size()
                + ", pages=" + contactPagesChecked.size()
                + (error != null ? ", error=" + error : "") + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String site;
        private List<String> emails;
        private List<String> phones;
        private List<String> contactPagesChecked;
        private List<String> skippedContactPages;
        private String error;

        public Builder site(String site) { this.site = site; return this; }
        public Builder emails(List<String> emails) { this.emails = emails; return this; }
        public Builder phones(List<String> phones) { this.phones = phones; return this; }
        public Builder contacts(ContactSet contacts) {
            this.emails = contacts.emails();
            this.phones = contacts.phones();
            return this;
        }
        public Builder contactPagesChecked(List<String> pages) { this.contactPagesChecked = pages; return this; }
        public Builder skippedContactPages(List<String> pages) { this.skippedContactPages = pages; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public CrawlResult build() {
            if (error != null && (notEmpty(emails) || notEmpty(phones)
                    || notEmpty(contactPagesChecked) || notEmpty(skippedContactPages))) {
                throw new IllegalStateException("failed result must not carry contacts or pages");
            }
            return new CrawlResult(this);
        }

        private static boolean notEmpty(List<String> l) { return l != null && !l.isEmpty(); }
    }
}
