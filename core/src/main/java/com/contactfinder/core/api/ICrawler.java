package com.contactfinder.core.api;

import java.util.List;

/** 사이트 발견 최소 계약: 방문할 사이트 루트 목록(중복 제거 + 사전순)을 돌려준다. */
public interface ICrawler {
    List<String> crawlSeeds() throws InterruptedException;
}
