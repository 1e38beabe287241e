package com.questrail.consensus.test.harness;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void startsLive() {
        assertFalse(new CancellationToken().isCancelled());
    }

    @Test
    void secondCancelIsNoOp() {
        CancellationToken token = new CancellationToken();

        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(token.isCancelled());
    }

    @Test
    void exactlyOneConcurrentCancelWins() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        AtomicInteger winners = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);

        for (int i = 0; i < 8; i++) {
            new Thread(() -> {
                try {
                    go.await();
                    if (token.cancel()) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        go.countDown();

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
    }
}
