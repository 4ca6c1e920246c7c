package com.example.puzzleroom.global.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 하나의 재진입 락으로 보호되는 key/value 저장소
 *
 * 각 연산(get/set/delete/contains/items/size)은 개별적으로 원자적이다.
 * "정원 확인 후 추가"처럼 여러 호출에 걸친 복합 연산은 원자적이지 않으므로
 * 호출자가 LockStrategy로 감싸야 한다.
 */
public class GuardedStore<K, V> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, V> data = new LinkedHashMap<>();

    public Optional<V> get(K key) {
        lock.lock();
        try {
            return Optional.ofNullable(data.get(key));
        } finally {
            lock.unlock();
        }
    }

    public void set(K key, V value) {
        lock.lock();
        try {
            data.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 삭제된 값 (없었으면 empty)
     */
    public Optional<V> delete(K key) {
        lock.lock();
        try {
            return Optional.ofNullable(data.remove(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 값이 expected와 같은 객체일 때만 삭제
     */
    public boolean delete(K key, V expected) {
        lock.lock();
        try {
            if (data.get(key) != expected) {
                return false;
            }
            data.remove(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 값이 expected와 같은 객체일 때만 replacement로 교체
     */
    public boolean replace(K key, V expected, V replacement) {
        lock.lock();
        try {
            if (data.get(key) != expected) {
                return false;
            }
            data.put(key, replacement);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(K key) {
        lock.lock();
        try {
            return data.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 호출 시점의 스냅샷. 이후 변경은 반영되지 않는다.
     */
    public List<Map.Entry<K, V>> items() {
        lock.lock();
        try {
            List<Map.Entry<K, V>> snapshot = new ArrayList<>(data.size());
            for (Map.Entry<K, V> entry : data.entrySet()) {
                snapshot.add(Map.entry(entry.getKey(), entry.getValue()));
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public List<V> values() {
        lock.lock();
        try {
            return new ArrayList<>(data.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }
}
