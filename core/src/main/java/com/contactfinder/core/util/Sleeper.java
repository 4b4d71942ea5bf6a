package com.contactfinder.core.util;

import java.time.Duration;

/** 대기 추상화: 테스트에서 실제 sleep 없이 호출만 기록하기 위함 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
