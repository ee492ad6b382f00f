package com.callqueue.dispatch.member;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered member set of one queue. Positions are dense and follow insertion order; they feed the
 * ordered round-robin and linear strategies.
 */
public final class MemberRoster {

    private final List<Member> members = new ArrayList<>();

    public synchronized Optional<Member> find(String iface) {
        for (var m : members) {
            if (m.sameInterface(iface)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public synchronized Optional<Member> findByUniqueId(String uniqueId) {
        if (uniqueId == null || uniqueId.isBlank()) return Optional.empty();
        for (var m : members) {
            if (uniqueId.equals(m.uniqueId())) return Optional.of(m);
        }
        return Optional.empty();
    }

    /**
     * @return false when a member with the same interface is already present
     */
    public synchronized boolean add(Member member) {
        for (var m : members) {
            if (m.sameInterface(member.iface())) return false;
        }
        member.setPosition(members.size());
        members.add(member);
        return true;
    }

    public synchronized Optional<Member> remove(String iface) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).sameInterface(iface)) {
                var removed = members.remove(i);
                renumber();
                return Optional.of(removed);
            }
        }
        return Optional.empty();
    }

    public synchronized List<Member> snapshot() {
        return List.copyOf(members);
    }

    public synchronized int size() {
        return members.size();
    }

    public synchronized boolean contains(String iface) {
        return find(iface).isPresent();
    }

    private void renumber() {
        for (int i = 0; i < members.size(); i++) {
            members.get(i).setPosition(i);
        }
    }
}
