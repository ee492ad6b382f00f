package com.callqueue.dispatch.session;

import com.callqueue.dispatch.telephony.CallLeg;
import com.callqueue.dispatch.telephony.CallerContext;
import com.callqueue.dispatch.telephony.ConnectedLine;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Caller-facing side of one queued call. Blocking methods throw
 * {@link com.callqueue.dispatch.common.error.CallerHangupException} once the caller is gone.
 * Methods returning a digit return {@link #NO_DIGIT} when none was pressed.
 */
public interface CallerSession {

    char NO_DIGIT = 0;

    String callId();

    CallLeg leg();

    CallerContext callerContext();

    Optional<String> getVariable(String name);

    void setVariable(String name, String value);

    char playPrompt(String sound);

    char sayNumber(int number);

    char waitForDigit(Duration timeout);

    void startMusicOnHold(String musicClass);

    void stopMusicOnHold();

    void indicateRinging();

    void stopIndications();

    void updateConnectedLine(ConnectedLine info);

    void updateRedirecting(ConnectedLine info);

    boolean canMatchExtension(String context, String digits);

    /**
     * Moves the caller to {@code context/digits} if that extension exists.
     */
    boolean gotoIfExists(String context, String digits);

    /**
     * Delivers hangup and digit signals while members are being dialed.
     */
    Subscription subscribe(Consumer<CallerSignal> listener);
}
