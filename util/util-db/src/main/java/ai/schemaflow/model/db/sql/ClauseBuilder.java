package ai.schemaflow.model.db.sql;

import jakarta.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Folds optional {@code column = ?} fragments into a single SQL clause, keeping the argument list in the
 * same order as the placeholders.
 *
 * <p>Null values are skipped, so a request object with optional fields can be passed field by field:
 * <pre>
 * var where = ClauseBuilder.conjunction()
 *     .add("id", find.id())
 *     .add("status", find.status());
 * </pre>
 */
public final class ClauseBuilder {
    private final String separator;
    @Nullable
    private final String whenEmpty;
    private final List<String> fragments = new ArrayList<>();
    private final List<Object> args = new ArrayList<>();

    private ClauseBuilder(String separator, @Nullable String whenEmpty) {
        this.separator = separator;
        this.whenEmpty = whenEmpty;
    }

    /**
     * WHERE predicates joined with AND. An empty conjunction matches every row.
     */
    public static ClauseBuilder conjunction() {
        return new ClauseBuilder(" AND ", "1 = 1");
    }

    /**
     * SET assignments joined with commas. Must not be empty when built.
     */
    public static ClauseBuilder assignments() {
        return new ClauseBuilder(", ", null);
    }

    public ClauseBuilder add(String column, @Nullable Object value) {
        if (value != null) {
            fragments.add(column + " = ?");
            args.add(value);
        }
        return this;
    }

    public ClauseBuilder addIn(String column, @Nullable Collection<?> values) {
        if (values == null) {
            return this;
        }
        if (values.isEmpty()) {
            fragments.add("1 = 0");
            return this;
        }
        fragments.add(column + " IN (" + values.stream().map(v -> "?").collect(Collectors.joining(", ")) + ")");
        args.addAll(values);
        return this;
    }

    /**
     * Appends a fragment verbatim. The number of {@code ?} in the fragment must match {@code values}.
     */
    public ClauseBuilder addRaw(String fragment, Object... values) {
        long placeholders = fragment.chars().filter(c -> c == '?').count();
        if (placeholders != values.length) {
            throw new IllegalArgumentException(
                "Fragment '%s' has %d placeholders, got %d values".formatted(fragment, placeholders, values.length));
        }
        fragments.add(fragment);
        Collections.addAll(args, values);
        return this;
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public String build() {
        if (fragments.isEmpty()) {
            if (whenEmpty == null) {
                throw new IllegalStateException("Clause must contain at least one fragment");
            }
            return whenEmpty;
        }
        return String.join(separator, fragments);
    }

    public List<Object> args() {
        return Collections.unmodifiableList(args);
    }

    @Override
    public String toString() {
        return "ClauseBuilder{" + (fragments.isEmpty() ? whenEmpty : build()) + ", args=" + args + '}';
    }
}
