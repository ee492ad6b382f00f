package com.callqueue.dispatch.caller;

import com.callqueue.dispatch.penalty.PenaltyRule;
import com.callqueue.dispatch.queue.CallQueue;
import com.callqueue.dispatch.queue.RoundRobinCursor;
import com.callqueue.dispatch.session.CallerSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One waiting caller. Mutated by its own caller flow, except for the position which peers renumber
 * under the waiting-list lock. Penalty band and rule cursor are guarded by this object's monitor.
 */
public final class QueueEntry {

    private static final int MAX_DIGITS = 78;

    private final CallQueue queue;
    private final CallerSession session;
    private final int priority;
    private final Instant joinedAt;
    private final Instant expiresAt;
    private final Set<QueueOption> options;
    private final List<PenaltyRule> rules;
    private final RoundRobinCursor linearCursor = new RoundRobinCursor();
    private final Set<String> dialedInterfaces = new HashSet<>();
    private final StringBuilder digits = new StringBuilder();
    private final List<EntryState> path = new ArrayList<>();

    private volatile int position;
    private volatile boolean pending;
    private int originalPosition;

    private PenaltyBand band;
    private int ruleIndex;

    private EntryState state = EntryState.JOINING;

    private Instant lastPositionAnnounce;
    private int lastPositionSaid;
    private Instant lastPeriodicAnnounce;
    private int nextPeriodicIndex;

    public QueueEntry(CallQueue queue, CallerSession session, QueueRequest request, List<PenaltyRule> rules, Instant joinedAt) {
        this.queue = queue;
        this.session = session;
        this.priority = request.priority();
        this.joinedAt = joinedAt;
        this.expiresAt = request.timeout() == null || request.timeout().isZero() || request.timeout().isNegative()
                ? null : joinedAt.plus(request.timeout());
        this.options = request.options();
        this.band = request.band();
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.lastPeriodicAnnounce = joinedAt;
        path.add(EntryState.JOINING);
    }

    public CallQueue queue() {
        return queue;
    }

    public CallerSession session() {
        return session;
    }

    public String callId() {
        return session.callId();
    }

    public int priority() {
        return priority;
    }

    public Instant joinedAt() {
        return joinedAt;
    }

    /**
     * @return null when the caller has no overall time limit
     */
    public Instant expiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean has(QueueOption option) {
        return options.contains(option);
    }

    public int position() {
        return position;
    }

    public void assignPosition(int position) {
        this.position = position;
    }

    public int originalPosition() {
        return originalPosition;
    }

    public void setOriginalPosition(int originalPosition) {
        this.originalPosition = originalPosition;
    }

    /**
     * True while this caller's ring cycle is in progress; such callers do not hold back callers behind them.
     */
    public boolean isPending() {
        return pending;
    }

    public void setPending(boolean pending) {
        this.pending = pending;
    }

    public synchronized PenaltyBand band() {
        return band;
    }

    public synchronized void setBand(PenaltyBand band) {
        this.band = band == null ? PenaltyBand.NONE : band;
    }

    /**
     * @return the rule that applies next, or null once the list is exhausted
     */
    public synchronized PenaltyRule activeRule() {
        return ruleIndex < rules.size() ? rules.get(ruleIndex) : null;
    }

    public synchronized int ruleIndex() {
        return ruleIndex;
    }

    /**
     * Moves past the current rule to the first later rule whose time has not passed yet.
     */
    public synchronized void advanceRule(long elapsedSeconds) {
        var next = ruleIndex + 1;
        while (next < rules.size() && rules.get(next).timeSeconds() < elapsedSeconds) {
            next++;
        }
        ruleIndex = next;
    }

    public RoundRobinCursor linearCursor() {
        return linearCursor;
    }

    public void clearDialedInterfaces() {
        dialedInterfaces.clear();
    }

    /**
     * @return false when the interface was already dialed in this cycle
     */
    public boolean markDialed(String iface) {
        return iface != null && dialedInterfaces.add(iface.toLowerCase(Locale.ROOT));
    }

    public String appendDigit(char digit) {
        if (digits.length() >= MAX_DIGITS) {
            digits.setLength(0);
            return null;
        }
        digits.append(digit);
        return digits.toString();
    }

    public String digits() {
        return digits.toString();
    }

    public void resetDigits() {
        digits.setLength(0);
    }

    public synchronized EntryState state() {
        return state;
    }

    public synchronized void transition(EntryState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("invalid_entry_transition from=" + state + " to=" + next);
        }
        state = next;
        path.add(next);
    }

    public synchronized List<EntryState> path() {
        return List.copyOf(path);
    }

    public Instant lastPositionAnnounce() {
        return lastPositionAnnounce;
    }

    public int lastPositionSaid() {
        return lastPositionSaid;
    }

    public void recordPositionAnnounce(Instant at, int position) {
        this.lastPositionAnnounce = at;
        this.lastPositionSaid = position;
    }

    public Instant lastPeriodicAnnounce() {
        return lastPeriodicAnnounce;
    }

    public int nextPeriodicIndex() {
        return nextPeriodicIndex;
    }

    public void recordPeriodicAnnounce(Instant at, int nextIndex) {
        this.lastPeriodicAnnounce = at;
        this.nextPeriodicIndex = nextIndex;
    }
}
