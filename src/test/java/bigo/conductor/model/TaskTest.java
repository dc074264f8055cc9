package bigo.conductor.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void buildMinimalTask() {
        Task task = Task.builder()
                .id("task-1")
                .title("fix typo")
                .build();

        assertEquals("task-1", task.id());
        assertEquals("", task.description());
        assertEquals(Tier.STANDARD, task.tier());
        assertEquals(TaskStatus.PENDING, task.status());
        assertNull(task.backend());
        assertNull(task.parentId());
        assertFalse(task.isTerminal());
    }

    @Test
    void toBuilderCopiesEveryField() {
        Instant now = Instant.now();
        Task task = Task.builder()
                .id("task-2")
                .parentId("task-1")
                .title("implement login")
                .description("with sessions")
                .tier(Tier.CRITICAL)
                .status(TaskStatus.WORKING)
                .backend(Backend.CLAUDE_OPUS)
                .contextPath("/repo")
                .createdAt(now)
                .updatedAt(now)
                .build();

        Task updated = task.toBuilder().status(TaskStatus.DONE).build();

        assertEquals("task-1", updated.parentId());
        assertEquals("with sessions", updated.description());
        assertEquals(Tier.CRITICAL, updated.tier());
        assertEquals(Backend.CLAUDE_OPUS, updated.backend());
        assertEquals("/repo", updated.contextPath());
        assertEquals(now, updated.createdAt());
        assertEquals(TaskStatus.DONE, updated.status());
        assertTrue(updated.isTerminal());
        assertEquals(task, updated);
    }

    @Test
    void titleIsRequired() {
        assertThrows(NullPointerException.class, () -> Task.builder().id("t").build());
    }
}
