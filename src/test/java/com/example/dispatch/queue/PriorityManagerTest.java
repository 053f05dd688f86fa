package com.example.dispatch.queue;

import com.example.dispatch.exception.InvalidPriorityClassException;
import com.example.dispatch.model.Task;
import com.example.dispatch.model.TaskListing;
import com.example.dispatch.model.TaskStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class PriorityManagerTest {

    private PriorityManager manager;

    @BeforeEach
    void setUp() {
        manager = PriorityManager.withDefaultClasses();
    }

    @Test
    void servesHigherClassFirstAndFifoWithinClass() {
        manager.submit(Task.of("A", "first high", 1));
        manager.submit(Task.of("B", "medium", 2));
        manager.submit(Task.of("C", "second high", 1));

        assertThat(manager.next()).map(Task::getName).contains("A");
        assertThat(manager.next()).map(Task::getName).contains("C");
        assertThat(manager.next()).map(Task::getName).contains("B");

        TaskStatistics stats = manager.statistics();
        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getPerClass()).containsExactly(entry(1, 0), entry(2, 0), entry(3, 0));
    }

    @Test
    void lowSubmittedBeforeHighStillWaits() {
        manager.submit(Task.of("low", "", 3));
        manager.submit(Task.of("high", "", 1));

        assertThat(manager.next()).map(Task::getName).contains("high");
        assertThat(manager.next()).map(Task::getName).contains("low");
    }

    @Test
    void rejectsUnrecognizedPriorityWithoutChangingState() {
        manager.submit(Task.of("ok", "", 2));

        assertThatThrownBy(() -> manager.submit(Task.of("bad", "", 99)))
                .isInstanceOf(InvalidPriorityClassException.class)
                .hasMessage("Invalid priority (99)")
                .satisfies(e -> {
                    InvalidPriorityClassException ex = (InvalidPriorityClassException) e;
                    assertThat(ex.getPriority()).isEqualTo(99);
                    assertThat(ex.getRecognizedClasses()).containsExactly(1, 2, 3);
                });

        assertThat(manager.statistics().getTotal()).isEqualTo(1);
        assertThat(manager.next()).map(Task::getName).contains("ok");
        assertThat(manager.next()).isEmpty();
    }

    @Test
    void peekNextIsIdempotentAndDoesNotMutate() {
        manager.submit(Task.of("B", "", 2));
        manager.submit(Task.of("A", "", 1));
        TaskStatistics before = manager.statistics();

        Optional<Task> first = manager.peekNext();
        Optional<Task> second = manager.peekNext();

        assertThat(first).map(Task::getName).contains("A");
        assertThat(second).isEqualTo(first);
        assertThat(manager.statistics()).isEqualTo(before);
        assertThat(manager.next()).isEqualTo(first);
    }

    @Test
    void emptyManagerReturnsEmptyForNextAndPeek() {
        assertThat(manager.next()).isEmpty();
        assertThat(manager.peekNext()).isEmpty();
        assertThat(manager.size()).isZero();
    }

    @Test
    void totalTracksSubmitsMinusRemovals() {
        int submitted = 0;
        int removed = 0;
        for (int i = 0; i < 30; i++) {
            manager.submit(Task.of("t" + i, "", (i % 3) + 1));
            submitted++;
            if (i % 4 == 0 && manager.next().isPresent()) {
                removed++;
            }
            assertThat(manager.statistics().getTotal()).isEqualTo(submitted - removed);
            assertThat(manager.size()).isEqualTo(submitted - removed);
        }
    }

    @Test
    void exhaustionLeavesManagerEmpty() {
        manager.submit(Task.of("a", "", 3));
        manager.submit(Task.of("b", "", 1));
        manager.submit(Task.of("c", "", 2));

        int drained = 0;
        while (manager.next().isPresent()) {
            drained++;
        }

        assertThat(drained).isEqualTo(3);
        assertThat(manager.next()).isEmpty();
        assertThat(manager.statistics().getTotal()).isZero();
    }

    @Test
    void statisticsCountsEachClass() {
        manager.submit(Task.of("a", "", 1));
        manager.submit(Task.of("b", "", 3));
        manager.submit(Task.of("c", "", 3));

        TaskStatistics stats = manager.statistics();

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getPerClass()).containsExactly(entry(1, 1), entry(2, 0), entry(3, 2));
    }

    @Test
    void customClassSetIsServedInAscendingOrder() {
        PriorityManager custom = new PriorityManager(Arrays.asList(20, 5, 10));
        custom.submit(Task.of("twenty", "", 20));
        custom.submit(Task.of("ten", "", 10));
        custom.submit(Task.of("five", "", 5));

        assertThat(custom.getPriorityClasses()).containsExactly(5, 10, 20);
        assertThat(custom.statistics().getPerClass().keySet()).containsExactly(5, 10, 20);
        assertThat(custom.next()).map(Task::getName).contains("five");
        assertThat(custom.next()).map(Task::getName).contains("ten");
        assertThat(custom.next()).map(Task::getName).contains("twenty");
        assertThatThrownBy(() -> custom.submit(Task.of("one", "", 1)))
                .isInstanceOf(InvalidPriorityClassException.class);
    }

    @Test
    void constructionRequiresPositiveClasses() {
        assertThatThrownBy(() -> new PriorityManager(Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriorityManager(Arrays.asList(1, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriorityManager(Collections.singletonList(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listAllGroupsByClassWithTruncatedPreviews() {
        String longDescription = "0123456789012345678901234567890123456789012345678901234567890";
        manager.submit(Task.of("first", "short", 1));
        manager.submit(Task.of("low", longDescription, 3));
        manager.submit(Task.of("second", "exactly fifty characters long, no more no less!!!!", 1));

        TaskListing listing = manager.listAll();

        assertThat(listing.getTotal()).isEqualTo(3);
        assertThat(listing.getClasses()).extracting(TaskListing.ClassListing::getPriority)
                .containsExactly(1, 2, 3);

        TaskListing.ClassListing high = listing.getClasses().get(0);
        assertThat(high.getLabel()).isEqualTo("High");
        assertThat(high.getCount()).isEqualTo(2);
        assertThat(high.getTasks()).extracting(TaskListing.Entry::getIndex).containsExactly(1, 2);
        assertThat(high.getTasks()).extracting(TaskListing.Entry::getName).containsExactly("first", "second");
        assertThat(high.getTasks().get(1).getPreview())
                .isEqualTo("exactly fifty characters long, no more no less!!!!");

        assertThat(listing.getClasses().get(1).getCount()).isZero();
        assertThat(listing.getClasses().get(1).getTasks()).isEmpty();

        assertThat(listing.getClasses().get(2).getTasks().get(0).getPreview())
                .isEqualTo(longDescription.substring(0, 50) + "...");

        assertThat(manager.statistics().getTotal()).isEqualTo(3);
        assertThat(manager.next()).map(Task::getName).contains("first");
    }

    @Test
    void previewLengthIsConfigurable() {
        PriorityManager shortPreview = new PriorityManager(Collections.singletonList(1), 5);
        shortPreview.submit(Task.of("t", "abcdefgh", 1));
        shortPreview.submit(Task.of("n", null, 1));

        List<TaskListing.Entry> entries = shortPreview.listAll().getClasses().get(0).getTasks();

        assertThat(entries.get(0).getPreview()).isEqualTo("abcde...");
        assertThat(entries.get(1).getPreview()).isEmpty();
    }

    @Test
    void previewCountsCharactersNotCodeUnits() {
        StringBuilder emoji = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            emoji.appendCodePoint(0x1F600);
        }
        String thirtyEmoji = emoji.toString();
        String mixed = "a" + thirtyEmoji + thirtyEmoji;
        PriorityManager single = new PriorityManager(Collections.singletonList(1));
        single.submit(Task.of("fits", thirtyEmoji, 1));
        single.submit(Task.of("cut", mixed, 1));

        List<TaskListing.Entry> entries = single.listAll().getClasses().get(0).getTasks();

        assertThat(entries.get(0).getPreview()).isEqualTo(thirtyEmoji);

        String cut = entries.get(1).getPreview();
        assertThat(cut).endsWith("...");
        String kept = cut.substring(0, cut.length() - 3);
        assertThat(kept.codePointCount(0, kept.length())).isEqualTo(50);
        assertThat(kept).isEqualTo(mixed.substring(0, mixed.offsetByCodePoints(0, 50)));
        assertThat(Character.isHighSurrogate(kept.charAt(kept.length() - 1))).isFalse();
    }

    @Test
    void concurrentNextNeverHandsOutTheSameTaskTwice() throws Exception {
        int taskCount = 1000;
        for (int i = 0; i < taskCount; i++) {
            manager.submit(Task.of("t" + i, "", (i % 3) + 1));
        }

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<Task> taken = new ConcurrentLinkedQueue<>();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    Optional<Task> task;
                    while ((task = manager.next()).isPresent()) {
                        taken.add(task.get());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(taken).hasSize(taskCount);
        assertThat(taken).extracting(Task::getName).doesNotHaveDuplicates();
        assertThat(manager.statistics().getTotal()).isZero();
    }
}
