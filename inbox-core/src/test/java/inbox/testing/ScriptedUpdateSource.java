package inbox.testing;

import inbox.Update;
import inbox.spi.UpdateSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * UpdateSource that serves a fixed list of pending updates, honoring offset and limit.
 *
 * <p>Pages queued with {@link #enqueuePage} are returned verbatim before the backing list
 * is consulted, which lets tests simulate redelivery. Every fetch is recorded in
 * {@link #fetchOffsets()} and, if set, appended to a shared event log.
 */
public class ScriptedUpdateSource implements UpdateSource {
  private final List<Update> pending = new CopyOnWriteArrayList<>();
  private final Deque<Object> scripted = new ArrayDeque<>();
  private final List<Long> fetchOffsets = new CopyOnWriteArrayList<>();
  private List<String> events;

  public ScriptedUpdateSource(Update... updates) {
    pending.addAll(List.of(updates));
  }

  public ScriptedUpdateSource add(Update update) {
    pending.add(update);
    return this;
  }

  public synchronized ScriptedUpdateSource enqueuePage(Update... page) {
    scripted.add(List.of(page));
    return this;
  }

  public synchronized ScriptedUpdateSource failNextFetch(Exception failure) {
    scripted.add(failure);
    return this;
  }

  public ScriptedUpdateSource recordEventsTo(List<String> events) {
    this.events = events;
    return this;
  }

  public List<Long> fetchOffsets() {
    return fetchOffsets;
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<Update> fetch(long offset, int limit) throws Exception {
    fetchOffsets.add(offset);
    if (events != null) {
      events.add("fetch:" + offset);
    }
    Object next;
    synchronized (this) {
      next = scripted.poll();
    }
    if (next instanceof Exception failure) {
      throw failure;
    }
    if (next != null) {
      return (List<Update>) next;
    }
    List<Update> page = new ArrayList<>();
    for (Update update : pending) {
      if (update.updateId() >= offset && page.size() < limit) {
        page.add(update);
      }
    }
    return page;
  }
}
