package io.llmops.platform.runtime.support;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Process} whose exit is driven by the test.
 */
public class FakeProcess extends Process {

    private final CountDownLatch exited = new CountDownLatch(1);
    private final boolean ignoresTermination;
    private volatile int exitCode;

    public FakeProcess() {
        this(false);
    }

    /**
     * @param ignoresTermination true to survive {@link #destroy()}, only a forced kill ends it
     */
    public FakeProcess(boolean ignoresTermination) {
        this.ignoresTermination = ignoresTermination;
    }

    /**
     * Create a process that has already exited.
     */
    public static FakeProcess exited(int code) {
        FakeProcess process = new FakeProcess();
        process.exit(code);
        return process;
    }

    public void exit(int code) {
        if (exited.getCount() > 0) {
            exitCode = code;
            exited.countDown();
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return OutputStream.nullOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public InputStream getErrorStream() {
        return InputStream.nullInputStream();
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    @Override
    public int exitValue() {
        if (isAlive()) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        if (!ignoresTermination) {
            exit(143);
        }
    }

    @Override
    public Process destroyForcibly() {
        exit(137);
        return this;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }
}
