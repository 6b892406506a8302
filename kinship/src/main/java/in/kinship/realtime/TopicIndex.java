package in.kinship.realtime;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Inverted index topic -> connection ids. A topic exists only while it has members; the last
 * removal drops the key in the same atomic step.
 */
final class TopicIndex {

    private final ConcurrentMap<String, Set<String>> members = new ConcurrentHashMap<>();

    void add(String topic, String connectionId) {
        members.compute(topic, (t, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            set.add(connectionId);
            return set;
        });
    }

    void remove(String topic, String connectionId) {
        members.computeIfPresent(topic, (t, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
    }

    Set<String> listenersOf(String topic) {
        Set<String> ids = members.get(topic);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    int topicCount() {
        return members.size();
    }
}
