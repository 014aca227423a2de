package com.sandy.aiot.alert.digest;

import com.sandy.aiot.alert.digest.service.DigestEmailTransport;
import com.sandy.aiot.alert.digest.vo.DigestEmail;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory transport for the test profile: records what would have been mailed and can be
 * told to fail or stall.
 */
@Service
@Profile("test")
public class RecordingDigestEmailTransport implements DigestEmailTransport {

    private final List<DigestEmail> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicInteger interrupted = new AtomicInteger();
    private volatile boolean failing;
    private volatile long delayMs;
    private volatile Consumer<DigestEmail> duringSend;

    @Override
    public void send(DigestEmail email) throws Exception {
        int gen = generation.get();
        calls.incrementAndGet();
        Consumer<DigestEmail> hook = duringSend;
        if (hook != null) hook.accept(email);
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                throw e;
            }
        }
        if (failing) throw new IllegalStateException("SMTP unavailable");
        // a stalled send that outlives its test must not leak into the next one
        if (gen == generation.get()) sent.add(email);
    }

    public void reset() {
        generation.incrementAndGet();
        sent.clear();
        calls.set(0);
        interrupted.set(0);
        failing = false;
        delayMs = 0;
        duringSend = null;
    }

    public List<DigestEmail> getSent() { return sent; }
    public int getCalls() { return calls.get(); }
    public int getInterrupted() { return interrupted.get(); }
    public void setFailing(boolean failing) { this.failing = failing; }
    public void setDelayMs(long delayMs) { this.delayMs = delayMs; }
    public void setDuringSend(Consumer<DigestEmail> duringSend) { this.duringSend = duringSend; }
}
