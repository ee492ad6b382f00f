package com.callqueue.dispatch.session;

public record CallerSignal(Type type, char digit) {

    public enum Type {
        HANGUP,
        DIGIT
    }

    public static CallerSignal hangup() {
        return new CallerSignal(Type.HANGUP, CallerSession.NO_DIGIT);
    }

    public static CallerSignal digit(char digit) {
        return new CallerSignal(Type.DIGIT, digit);
    }
}
