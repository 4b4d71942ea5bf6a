package com.contactfinder.core.api;

import com.contactfinder.core.http.TransportException;

import java.net.URI;

/** 페이지 fetch 최소 계약: GET 1회, 실패는 TransportException. 재시도 없음. */
@FunctionalInterface
public interface IFetcher {
    String fetch(URI url) throws TransportException, InterruptedException;
}
