package bigo.conductor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a unit of requested work.
 * The same value is handed to workers, carrying the resolved backend.
 */
public final class Task {
    private final String id;
    private final String parentId; // reserved for subtask decomposition
    private final String title;
    private final String description;
    private final Tier tier;
    private final TaskStatus status;
    private final Backend backend;
    private final String contextPath;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.parentId = builder.parentId;
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description != null ? builder.description : "";
        this.tier = Objects.requireNonNull(builder.tier, "tier is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.backend = builder.backend;
        this.contextPath = builder.contextPath;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String parentId() {
        return parentId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public Tier tier() {
        return tier;
    }

    public TaskStatus status() {
        return status;
    }

    public Backend backend() {
        return backend;
    }

    public String contextPath() {
        return contextPath;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .parentId(parentId)
                .title(title)
                .description(description)
                .tier(tier)
                .status(status)
                .backend(backend)
                .contextPath(contextPath)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String parentId;
        private String title;
        private String description;
        private Tier tier = Tier.STANDARD;
        private TaskStatus status = TaskStatus.PENDING;
        private Backend backend;
        private String contextPath;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tier(Tier tier) {
            this.tier = tier;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder backend(Backend backend) {
            this.backend = backend;
            return this;
        }

        public Builder contextPath(String contextPath) {
            this.contextPath = contextPath;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', tier=" + tier + ", status=" + status + ", backend=" + backend + "}";
    }
}
