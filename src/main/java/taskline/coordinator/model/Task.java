package taskline.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a task record as held by the status store.
 */
public final class Task {
    private final String id;
    private final String payload;
    private final TaskState state;
    private final String result; // value on SUCCESS, error message on FAILURE
    private final Instant enqueuedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.result = builder.result;
        this.enqueuedAt = Objects.requireNonNull(builder.enqueuedAt, "enqueuedAt is required");
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String payload() {
        return payload;
    }

    public TaskState state() {
        return state;
    }

    public String result() {
        return result;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isPending() {
        return state == TaskState.PENDING;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .payload(payload)
                .state(state)
                .result(result)
                .enqueuedAt(enqueuedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String payload;
        private TaskState state = TaskState.PENDING;
        private String result;
        private Instant enqueuedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder enqueuedAt(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
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
        return "Task{id='" + id + "', state=" + state + ", enqueuedAt=" + enqueuedAt + "}";
    }
}
