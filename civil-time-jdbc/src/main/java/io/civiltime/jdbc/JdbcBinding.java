package io.civiltime.jdbc;

import java.util.Objects;

/**
 * How {@link CivilJdbc} writes civil values into statement parameters.
 *
 * <p>Use {@link #builder()} to override the defaults:
 * <pre>{@code
 * JdbcBinding binding = JdbcBinding.builder()
 *     .dateTimeStorage(JdbcBinding.Storage.NATIVE)
 *     .build();
 * }</pre>
 */
public final class JdbcBinding {

    /**
     * Parameter representation.
     */
    public enum Storage {
        /**
         * The scalar text form, bound with {@code setString}. Any value can be stored.
         */
        TEXT,
        /**
         * {@code LocalDate}, {@code LocalTime} or {@code LocalDateTime}, bound with {@code setObject}.
         * Only valid values can be stored.
         */
        NATIVE
    }

    private static final JdbcBinding DEFAULTS = builder().build();

    private final Storage dateStorage;
    private final Storage timeStorage;
    private final Storage dateTimeStorage;

    private JdbcBinding(Builder builder) {
        this.dateStorage = builder.dateStorage;
        this.timeStorage = builder.timeStorage;
        this.dateTimeStorage = builder.dateTimeStorage;
    }

    /**
     * Text storage for all three types.
     */
    public static JdbcBinding defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Storage dateStorage() {
        return dateStorage;
    }

    public Storage timeStorage() {
        return timeStorage;
    }

    public Storage dateTimeStorage() {
        return dateTimeStorage;
    }

    /**
     * Builder for {@link JdbcBinding}.
     */
    public static final class Builder {
        private Storage dateStorage = Storage.TEXT;
        private Storage timeStorage = Storage.TEXT;
        private Storage dateTimeStorage = Storage.TEXT;

        private Builder() {}

        /**
         * Sets the storage of all three types.
         */
        public Builder storage(Storage storage) {
            return dateStorage(storage).timeStorage(storage).dateTimeStorage(storage);
        }

        public Builder dateStorage(Storage storage) {
            this.dateStorage = Objects.requireNonNull(storage, "storage");
            return this;
        }

        public Builder timeStorage(Storage storage) {
            this.timeStorage = Objects.requireNonNull(storage, "storage");
            return this;
        }

        public Builder dateTimeStorage(Storage storage) {
            this.dateTimeStorage = Objects.requireNonNull(storage, "storage");
            return this;
        }

        public JdbcBinding build() {
            return new JdbcBinding(this);
        }
    }
}
