package io.hmis.backend.event;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local streams. Entries do not survive a restart. */
@Component
@ConditionalOnProperty(name = "hmis.store.type", havingValue = "memory")
public class InMemoryEventLogStore implements EventLogStore {

  private final Map<String, Deque<EventLogEntry>> streams = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryEventLogStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String append(String stream, Map<String, String> fields, int maxLength) {
    var entries = streams.computeIfAbsent(stream, name -> new ArrayDeque<>());
    synchronized (entries) {
      var now = clock.instant();
      String id = now.toEpochMilli() + "-" + sequence.incrementAndGet();
      entries.addLast(new EventLogEntry(id, stream, fields, now));
      while (entries.size() > maxLength) {
        entries.removeFirst();
      }
      return id;
    }
  }

  @Override
  public long length(String stream) {
    var entries = streams.get(stream);
    if (entries == null) {
      return 0;
    }
    synchronized (entries) {
      return entries.size();
    }
  }

  @Override
  public boolean exists(String stream) {
    return streams.containsKey(stream);
  }

  @Override
  public List<EventLogEntry> latest(String stream, int count) {
    var entries = streams.get(stream);
    if (entries == null) {
      return List.of();
    }
    synchronized (entries) {
      var result = new ArrayList<EventLogEntry>(Math.min(count, entries.size()));
      Iterator<EventLogEntry> newestFirst = entries.descendingIterator();
      while (newestFirst.hasNext() && result.size() < count) {
        result.add(newestFirst.next());
      }
      return result;
    }
  }
}
