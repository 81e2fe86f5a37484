package io.llmops.platform.runtime.support;

import io.llmops.platform.runtime.process.ServiceController;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory service manager recording every call as {@code <verb> <unit>}.
 */
public class FakeServiceController implements ServiceController {

    private final Set<String> active = ConcurrentHashMap.newKeySet();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    public void setActive(String unit, boolean isActive) {
        if (isActive) {
            active.add(unit);
        } else {
            active.remove(unit);
        }
    }

    /**
     * Make every start, restart and reload of a unit fail.
     */
    public void failOn(String unit) {
        failing.add(unit);
    }

    @Override
    public boolean isActive(@Nonnull String unit) {
        return active.contains(unit);
    }

    @Override
    public void start(@Nonnull String unit) throws IOException {
        call("start", unit);
        active.add(unit);
    }

    @Override
    public void stop(@Nonnull String unit) {
        calls.add("stop " + unit);
        active.remove(unit);
    }

    @Override
    public void restart(@Nonnull String unit) throws IOException {
        call("restart", unit);
        active.add(unit);
    }

    @Override
    public void reload(@Nonnull String unit) throws IOException {
        call("reload", unit);
    }

    private void call(String verb, String unit) throws IOException {
        calls.add(verb + " " + unit);
        if (failing.contains(unit)) {
            throw new IOException("Job for " + unit + ".service failed");
        }
    }

    public List<String> getCalls() {
        return calls;
    }
}
