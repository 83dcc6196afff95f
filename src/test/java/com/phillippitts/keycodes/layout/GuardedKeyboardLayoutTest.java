package com.phillippitts.keycodes.layout;

import com.phillippitts.keycodes.domain.KeyCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class GuardedKeyboardLayoutTest {

    @Test
    void convertsFailuresToEmpty() {
        KeyboardLayout guarded = GuardedKeyboardLayout.wrap(key -> {
            throw new SecurityException("permission denied");
        });

        assertThat(guarded.glyphFor(KeyCode.KEY_A)).isEmpty();
    }

    @Test
    void doesNotWrapTwice() {
        KeyboardLayout once = GuardedKeyboardLayout.wrap(key -> Optional.of("a"));

        assertThat(GuardedKeyboardLayout.wrap(once)).isSameAs(once);
        assertThat(GuardedKeyboardLayout.wrap(NoKeyboardLayout.INSTANCE)).isSameAs(NoKeyboardLayout.INSTANCE);
        assertThat(GuardedKeyboardLayout.wrap(null)).isSameAs(NoKeyboardLayout.INSTANCE);
    }

    @Test
    void serializesConcurrentCalls() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        KeyboardLayout guarded = GuardedKeyboardLayout.wrap(key -> {
            int now = inside.incrementAndGet();
            maxInside.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inside.decrementAndGet();
            return Optional.of("a");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<String>>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return guarded.glyphFor(KeyCode.KEY_A);
                }));
            }
            start.countDown();
            for (Future<Optional<String>> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).contains("a");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside).hasValue(1);
    }
}
