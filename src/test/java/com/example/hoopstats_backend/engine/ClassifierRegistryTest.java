package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.dto.ClassifierInfo;
import com.example.hoopstats_backend.engine.Interfaces.ActionClassifier;
import com.example.hoopstats_backend.exception.UnknownClassifierException;
import com.example.hoopstats_backend.video.Clip;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifierRegistryTest {

    /** Counts loads; the first {@code failures} loads fail. */
    static class CountingClassifier extends AbstractActionClassifier {
        final AtomicInteger loads = new AtomicInteger();
        private final int failures;

        CountingClassifier(int failures) {
            this.failures = failures;
        }

        @Override
        public String name() {
            return "counting";
        }

        @Override
        protected boolean loadResources() {
            int n = loads.incrementAndGet();
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return n > failures;
        }

        @Override
        protected ClassificationResult doClassify(Clip clip) {
            return ClassificationResult.of("playing basketball", 0.5);
        }
    }

    @Test
    void unknownIdListsAvailableIds() {
        ClassifierRegistry registry = new ClassifierRegistry()
                .register("videomae", "VideoMAE", () -> new CountingClassifier(0))
                .register("yolo", "YOLO", () -> new CountingClassifier(0));

        assertThatThrownBy(() -> registry.get("resnet"))
                .isInstanceOf(UnknownClassifierException.class)
                .hasMessage("Invalid classifier: resnet. Available: videomae, yolo");
    }

    @Test
    void duplicateRegistrationIsRejected() {
        ClassifierRegistry registry = new ClassifierRegistry().register("x3d", "X3D", () -> new CountingClassifier(0));

        assertThatThrownBy(() -> registry.register("x3d", "X3D again", () -> new CountingClassifier(0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void instanceIsCreatedLazilyAndReused() {
        AtomicInteger created = new AtomicInteger();
        ClassifierRegistry registry = new ClassifierRegistry().register("videomae", "VideoMAE", () -> {
            created.incrementAndGet();
            return new CountingClassifier(0);
        });
        assertThat(created).hasValue(0);
        assertThat(registry.info()).containsExactly(new ClassifierInfo("videomae", "VideoMAE", false, false));

        ActionClassifier first = registry.get("videomae");
        ActionClassifier second = registry.get("videomae");

        assertThat(first).isSameAs(second);
        assertThat(created).hasValue(1);
        assertThat(((CountingClassifier) first).loads).hasValue(1);
        assertThat(registry.info()).containsExactly(new ClassifierInfo("videomae", "VideoMAE", true, true));
    }

    @Test
    void concurrentFirstUseInitialisesOnce() throws Exception {
        AtomicInteger created = new AtomicInteger();
        ClassifierRegistry registry = new ClassifierRegistry().register("timesformer", "TimeSformer", () -> {
            created.incrementAndGet();
            return new CountingClassifier(0);
        });
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ActionClassifier>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.get("timesformer");
                }));
            }
            start.countDown();

            ActionClassifier expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<ActionClassifier> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
            assertThat(created).hasValue(1);
            assertThat(((CountingClassifier) expected).loads).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedInitialisationIsRetriedOnNextUse() {
        ClassifierRegistry registry = new ClassifierRegistry().register("slowfast", "SlowFast", () -> new CountingClassifier(1));

        ActionClassifier first = registry.get("slowfast");
        assertThat(first.isReady()).isFalse();

        ActionClassifier second = registry.get("slowfast");
        assertThat(second).isSameAs(first);
        assertThat(second.isReady()).isTrue();
        assertThat(((CountingClassifier) second).loads).hasValue(2);
    }

    @Test
    void availableIsSorted() {
        ClassifierRegistry registry = new ClassifierRegistry()
                .register("yolo", "YOLO", () -> new CountingClassifier(0))
                .register("clip", "CLIP", () -> new CountingClassifier(0));

        assertThat(registry.available()).containsExactly("clip", "yolo");
        assertThat(registry.isRegistered("clip")).isTrue();
        assertThat(registry.isRegistered("vivit")).isFalse();
        assertThat(registry.isRegistered(null)).isFalse();
    }
}
