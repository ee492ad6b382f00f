package com.callqueue.dispatch.testsupport;

import com.callqueue.dispatch.common.error.CallerHangupException;
import com.callqueue.dispatch.session.CallerSession;
import com.callqueue.dispatch.session.CallerSignal;
import com.callqueue.dispatch.session.Subscription;
import com.callqueue.dispatch.telephony.CallLeg;
import com.callqueue.dispatch.telephony.CallerContext;
import com.callqueue.dispatch.telephony.ConnectedLine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Caller side driven by the test: digits and hangup are injected, everything played is recorded.
 */
public class FakeCallerSession implements CallerSession {

    private final String callId;
    private final CallLeg leg;
    private final CallerContext context;
    private final Map<String, String> variables = new ConcurrentHashMap<>();
    private final LinkedBlockingQueue<Character> digits = new LinkedBlockingQueue<>();
    private final List<Consumer<CallerSignal>> listeners = new CopyOnWriteArrayList<>();
    private final List<String> played = new CopyOnWriteArrayList<>();
    private final List<String> indications = new CopyOnWriteArrayList<>();
    private final List<ConnectedLine> connectedLines = new CopyOnWriteArrayList<>();
    private final Set<String> extensions = new HashSet<>();

    private volatile boolean hungUp;

    public FakeCallerSession(String callId) {
        this.callId = callId;
        this.leg = new CallLeg("caller-" + callId, callId);
        this.context = new CallerContext(callId, "5550" + Math.abs(callId.hashCode() % 1000), "Caller " + callId, Map.of());
    }

    /**
     * Registers {@code context/digits} as an extension a caller may exit to.
     */
    public FakeCallerSession withExtension(String exitContext, String exten) {
        synchronized (extensions) {
            extensions.add(exitContext + "/" + exten);
        }
        return this;
    }

    public void press(char digit) {
        if (listeners.isEmpty()) {
            digits.add(digit);
            return;
        }
        for (var l : listeners) {
            l.accept(CallerSignal.digit(digit));
        }
    }

    public void hangup() {
        hungUp = true;
        for (var l : listeners) {
            l.accept(CallerSignal.hangup());
        }
    }

    public List<String> played() {
        return new ArrayList<>(played);
    }

    public List<String> indications() {
        return new ArrayList<>(indications);
    }

    public List<ConnectedLine> connectedLines() {
        return new ArrayList<>(connectedLines);
    }

    public Map<String, String> variables() {
        return Map.copyOf(variables);
    }

    @Override
    public String callId() {
        return callId;
    }

    @Override
    public CallLeg leg() {
        return leg;
    }

    @Override
    public CallerContext callerContext() {
        return context;
    }

    @Override
    public Optional<String> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public void setVariable(String name, String value) {
        variables.put(name, value);
    }

    @Override
    public char playPrompt(String sound) {
        checkAlive();
        played.add(sound);
        var d = digits.poll();
        return d == null ? NO_DIGIT : d;
    }

    @Override
    public char sayNumber(int number) {
        checkAlive();
        played.add("number:" + number);
        return NO_DIGIT;
    }

    @Override
    public char waitForDigit(Duration timeout) {
        checkAlive();
        var deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                var left = deadline - System.nanoTime();
                if (left <= 0) return NO_DIGIT;
                var d = digits.poll(Math.min(left, TimeUnit.MILLISECONDS.toNanos(20)), TimeUnit.NANOSECONDS);
                if (d != null) return d;
                checkAlive();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallerHangupException(callId);
        }
    }

    @Override
    public void startMusicOnHold(String musicClass) {
        indications.add("moh:" + musicClass);
    }

    @Override
    public void stopMusicOnHold() {
        indications.add("moh-stop");
    }

    @Override
    public void indicateRinging() {
        indications.add("ringing");
    }

    @Override
    public void stopIndications() {
        indications.add("indications-stop");
    }

    @Override
    public void updateConnectedLine(ConnectedLine info) {
        connectedLines.add(info);
    }

    @Override
    public void updateRedirecting(ConnectedLine info) {
        indications.add("redirecting:" + info.number());
    }

    @Override
    public boolean canMatchExtension(String exitContext, String digits) {
        synchronized (extensions) {
            return extensions.stream().anyMatch(e -> e.startsWith(exitContext + "/" + digits));
        }
    }

    @Override
    public boolean gotoIfExists(String exitContext, String digits) {
        synchronized (extensions) {
            return extensions.contains(exitContext + "/" + digits);
        }
    }

    @Override
    public Subscription subscribe(Consumer<CallerSignal> listener) {
        listeners.add(listener);
        if (hungUp) listener.accept(CallerSignal.hangup());
        return () -> listeners.remove(listener);
    }

    private void checkAlive() {
        if (hungUp) throw new CallerHangupException(callId);
    }
}
