package com.contactfinder.core.http;

import java.net.URI;

/**
 * 네트워크/HTTP 실패 (DNS, 연결 거부, 타임아웃, 비-2xx).
 * 항상 원인 URL 하나에 국한되며 호출자가 정책적으로 처리한다.
 */
public class TransportException extends Exception {

    private final URI url;
    private final int statusCode; // 응답 없이 실패하면 -1

    public TransportException(URI url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }

    /** 상태 코드 기반 실패인지 (false면 네트워크 단 실패) */
    public boolean isHttpStatus() { return statusCode > 0; }
}
