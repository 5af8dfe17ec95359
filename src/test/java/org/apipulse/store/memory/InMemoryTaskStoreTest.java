package org.apipulse.store.memory;

import org.apipulse.TestFixtures;
import org.apipulse.model.Task;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTaskStoreTest {

    private static final Instant NOW = TestFixtures.NOW;

    private final InMemoryTaskStore store = new InMemoryTaskStore();

    @Test
    void claimReturnsDueTasksOldestFirstAndLeasesThem() {
        Task later = store.insert(TestFixtures.dueTask("https://a.example.com/2", NOW.minusSeconds(5)));
        Task earlier = store.insert(TestFixtures.dueTask("https://a.example.com/1", NOW.minusSeconds(50)));
        store.insert(TestFixtures.dueTask("https://a.example.com/future", NOW.plusSeconds(5)));
        Instant lease = NOW.plusSeconds(300);

        List<Task> claimed = store.claimDueTasks(NOW, lease, 10);

        assertThat(claimed).extracting(Task::id).containsExactly(earlier.id(), later.id());
        assertThat(claimed.get(0).nextRunAt()).isEqualTo(NOW.minusSeconds(50));
        assertThat(store.findById(earlier.id()).orElseThrow().nextRunAt()).isEqualTo(lease);
        assertThat(store.claimDueTasks(NOW, lease, 10)).isEmpty();
    }

    @Test
    void claimHonoursLimit() {
        for (int i = 0; i < 5; i++) {
            store.insert(TestFixtures.dueTask("https://a.example.com/" + i, NOW.minusSeconds(i)));
        }

        assertThat(store.claimDueTasks(NOW, NOW.plusSeconds(60), 3)).hasSize(3);
        assertThat(store.claimDueTasks(NOW, NOW.plusSeconds(60), 3)).hasSize(2);
    }

    @Test
    void expiredLeaseMakesTaskClaimableAgain() {
        Task task = store.insert(TestFixtures.dueTask("https://a.example.com", NOW));
        store.claimDueTasks(NOW, NOW.plusSeconds(60), 10);

        assertThat(store.claimDueTasks(NOW.plusSeconds(61), NOW.plusSeconds(120), 10))
                .extracting(Task::id).containsExactly(task.id());
    }

    @Test
    void inactiveTasksAreNeverClaimed() {
        Task task = store.insert(TestFixtures.dueTask("https://a.example.com", NOW));
        store.pause(task.id());

        assertThat(store.claimDueTasks(NOW, NOW.plusSeconds(60), 10)).isEmpty();
    }

    @Test
    void deleteNotifiesListenersOnlyForExistingTasks() {
        Task task = store.insert(TestFixtures.dueTask("https://a.example.com", NOW));
        List<Object> deleted = new ArrayList<>();
        store.onDelete(deleted::add);

        assertThat(store.delete(task.id())).isTrue();
        assertThat(store.delete(task.id())).isFalse();
        assertThat(deleted).containsExactly(task.id());
    }
}
