package com.example.puzzleroom.global.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class GuardedStoreTest {

    private final GuardedStore<String, String> store = new GuardedStore<>();

    @Test
    @DisplayName("set/get/contains/delete 기본 동작")
    void basicOperations() {
        store.set("a", "1");

        assertThat(store.get("a")).contains("1");
        assertThat(store.contains("a")).isTrue();
        assertThat(store.get("missing")).isEmpty();

        assertThat(store.delete("a")).contains("1");
        assertThat(store.delete("a")).isEmpty();
        assertThat(store.contains("a")).isFalse();
    }

    @Test
    @DisplayName("조건부 삭제는 같은 객체일 때만 지운다")
    void conditionalDelete() {
        String original = new String("room");
        String replacement = new String("room");
        store.set("123456", original);
        store.set("123456", replacement);

        assertThat(store.delete("123456", original)).isFalse();
        assertThat(store.get("123456")).containsSame(replacement);
        assertThat(store.delete("123456", replacement)).isTrue();
    }

    @Test
    @DisplayName("조건부 교체는 읽은 객체가 그대로일 때만 바꾼다")
    void conditionalReplace() {
        String read = new String("session");
        store.set("c1", read);

        assertThat(store.replace("c1", read, "joined")).isTrue();
        assertThat(store.replace("c1", read, "stale")).isFalse();
        assertThat(store.get("c1")).contains("joined");

        store.delete("c1");
        assertThat(store.replace("c1", "joined", "again")).isFalse();
        assertThat(store.contains("c1")).isFalse();
    }

    @Test
    @DisplayName("items()는 호출 시점 스냅샷이다")
    void itemsIsSnapshot() {
        store.set("a", "1");
        store.set("b", "2");

        List<Map.Entry<String, String>> snapshot = store.items();
        store.set("c", "3");
        store.delete("a");

        assertThat(snapshot).extracting(Map.Entry::getKey).containsExactly("a", "b");
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("여러 스레드가 동시에 써도 모든 키가 남는다")
    void concurrentWrites() throws InterruptedException {
        int threadCount = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch latch = new CountDownLatch(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);

        for (int i = 0; i < threadCount; i++) {
            String key = "key" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    store.set(key, key);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }
        startLatch.countDown();
        latch.await();
        executor.shutdown();

        assertThat(store.size()).isEqualTo(threadCount);
        assertThat(store.values()).hasSize(threadCount);
    }
}
