package com.ospicorp.migrationflow.flow.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Keeps only the newest result per view session. Each load takes a ticket; a result committed
 * with a ticket older than the session's latest one is rejected. A session is tracked only while
 * one of its loads is outstanding.
 */
@Component
public class LatestRequestGuard {
  private final AtomicLong sequence = new AtomicLong();
  private final Map<String, Long> latest = new ConcurrentHashMap<>();

  public Ticket begin(String sessionKey) {
    if (sessionKey == null) {
      return Ticket.UNTRACKED;
    }
    long seq = sequence.incrementAndGet();
    latest.merge(sessionKey, seq, Math::max);
    return new Ticket(sessionKey, seq);
  }

  public <T> T commit(Ticket ticket, T result) {
    if (ticket.sessionKey() != null && !latest.remove(ticket.sessionKey(), ticket.sequence())) {
      throw new SupersededRequestException(ticket.sessionKey());
    }
    return result;
  }

  /** Stops tracking the session if this ticket is still its latest; for loads that failed. */
  public void release(Ticket ticket) {
    if (ticket.sessionKey() != null) {
      latest.remove(ticket.sessionKey(), ticket.sequence());
    }
  }

  public boolean isCurrent(Ticket ticket) {
    if (ticket.sessionKey() == null) {
      return true;
    }
    Long current = latest.get(ticket.sessionKey());
    return current != null && current == ticket.sequence();
  }

  int trackedSessions() {
    return latest.size();
  }

  public record Ticket(String sessionKey, long sequence) {
    static final Ticket UNTRACKED = new Ticket(null, 0);
  }
}
