package com.tollgate.server.infrastructure.stdio;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Input stream that releases waiters once the wrapped stream reports end of input or fails.
 */
public class EndOfInputLatch extends FilterInputStream {

    private final CountDownLatch ended = new CountDownLatch(1);

    public EndOfInputLatch(InputStream in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        return observe(() -> super.read());
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return observe(() -> super.read(b, off, len));
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            ended.countDown();
        }
    }

    public void await() throws InterruptedException {
        ended.await();
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return ended.await(timeout, unit);
    }

    public boolean isEnded() {
        return ended.getCount() == 0;
    }

    private int observe(Read read) throws IOException {
        try {
            int result = read.read();
            if (result < 0) {
                ended.countDown();
            }
            return result;
        } catch (IOException e) {
            ended.countDown();
            throw e;
        }
    }

    @FunctionalInterface
    private interface Read {
        int read() throws IOException;
    }
}
