package fr.lapetina.apiruntime.domain.swap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentCellTest {

    @Test
    @DisplayName("should return the initial value")
    void shouldReturnInitialValue() {
        ComponentCell<String> cell = new ComponentCell<>("test", "v1");

        assertThat(cell.read()).isEqualTo("v1");
        assertThat(cell.getName()).isEqualTo("test");
    }

    @Test
    @DisplayName("swap should return the previous value and install the new one")
    void swapShouldReturnPrevious() {
        ComponentCell<String> cell = new ComponentCell<>("test", "v1");

        String previous = cell.swap("v2");

        assertThat(previous).isEqualTo("v1");
        assertThat(cell.read()).isEqualTo("v2");
    }

    @Test
    @DisplayName("reader should keep its copy after a swap")
    void readerShouldKeepItsCopy() {
        ComponentCell<List<String>> cell = new ComponentCell<>("test", List.of("old"));

        List<String> held = cell.read();
        cell.swap(List.of("new"));

        assertThat(held).containsExactly("old");
        assertThat(cell.read()).containsExactly("new");
    }

    @Test
    @DisplayName("should reject null values")
    void shouldRejectNull() {
        assertThatThrownBy(() -> new ComponentCell<String>("test", null))
                .isInstanceOf(NullPointerException.class);

        ComponentCell<String> cell = new ComponentCell<>("test", "v1");
        assertThatThrownBy(() -> cell.swap(null))
                .isInstanceOf(NullPointerException.class);
        assertThat(cell.read()).isEqualTo("v1");
    }

    @Test
    @DisplayName("concurrent readers should only ever observe installed values")
    void concurrentReadersShouldSeeInstalledValues() throws Exception {
        ComponentCell<Integer> cell = new ComponentCell<>("counter", 0);
        Set<Integer> observed = ConcurrentHashMap.newKeySet();
        AtomicBoolean writerDone = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> readers = new ArrayList<>();

        try {
            for (int r = 0; r < 4; r++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    int last = -1;
                    while (!writerDone.get()) {
                        int value = cell.read();
                        // values only ever increase
                        assertThat(value).isGreaterThanOrEqualTo(last);
                        last = value;
                        observed.add(value);
                    }
                    return null;
                }));
            }
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int i = 1; i <= 1000; i++) {
                    cell.swap(i);
                }
                writerDone.set(true);
                return null;
            });

            start.countDown();
            writer.get(10, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(observed).allMatch(v -> v >= 0 && v <= 1000);
        // A read after the last swap returns the last value
        assertThat(cell.read()).isEqualTo(1000);
    }
}
