package com.contactfinder.core.util;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Thread.sleep 기반 기본 구현. null/0/음수는 바로 반환 */
public final class DefaultSleeper implements Sleeper {
    @Override public void sleep(Duration d) throws InterruptedException {
        if (d == null || d.isZero() || d.isNegative()) return;
        TimeUnit.MILLISECONDS.sleep(d.toMillis());
    }
}
