package dustin.amm.domains.engine.state;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * 저널에 변경을 기록하는 HashMap
 * HashMap whose writes can be rolled back through a {@link StateJournal}
 *
 * 값은 불변 객체여야 합니다. 값을 바꾸려면 새 객체로 put 하세요.
 * (내부 필드를 직접 바꾸면 롤백되지 않음)
 */
public class JournaledMap<K, V> {

    private final StateJournal journal;
    private final Map<K, V> entries = new HashMap<>();

    public JournaledMap(StateJournal journal) {
        this.journal = journal;
    }

    /**
     * 값 조회 (없으면 null)
     */
    public V get(K key) {
        return entries.get(key);
    }

    public V getOrDefault(K key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    /**
     * 값 저장 (이전 값 복구 작업을 저널에 기록)
     */
    public V put(K key, V value) {
        boolean existed = entries.containsKey(key);
        V previous = entries.put(key, value);
        journal.record(() -> {
            if (existed) {
                entries.put(key, previous);
            } else {
                entries.remove(key);
            }
        });
        return previous;
    }

    /**
     * 값 삭제 (없으면 아무 것도 하지 않음)
     */
    public V remove(K key) {
        if (!entries.containsKey(key)) {
            return null;
        }
        V previous = entries.remove(key);
        journal.record(() -> entries.put(key, previous));
        return previous;
    }

    /**
     * 기존 값과 새 값을 합쳐 저장
     * 합친 결과가 null이면 삭제
     */
    public V merge(K key, V value, BiFunction<V, V, V> remapping) {
        V current = entries.get(key);
        V next = current == null ? value : remapping.apply(current, value);
        if (next == null) {
            remove(key);
        } else {
            put(key, next);
        }
        return next;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 읽기 전용 뷰
     */
    public Map<K, V> asMap() {
        return Collections.unmodifiableMap(entries);
    }
}
