package com.jobscheduler.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Positional and keyword arguments bound to a job callable at submission.
 *
 * <p>Instances are immutable. Null values are allowed in both positions and
 * keyword values; keyword names are not.</p>
 *
 * <pre>{@code
 * JobArguments args = JobArguments.builder()
 *     .add("report.csv")
 *     .put("rows", 500)
 *     .build();
 * scheduler.addJob(JobTarget.of((ctx, a) -> export(a.get(0, String.class), a.get("rows", Integer.class))), args);
 * }</pre>
 *
 * @author Job Scheduler Team
 */
public final class JobArguments {
    private static final JobArguments NONE = new JobArguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private JobArguments(List<Object> positional, Map<String, Object> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    /**
     * @return the empty argument set
     */
    public static JobArguments none() {
        return NONE;
    }

    /**
     * Positional arguments only.
     *
     * @param args the values, in order
     * @return the argument set
     */
    public static JobArguments of(Object... args) {
        if (args == null || args.length == 0) {
            return NONE;
        }
        return new JobArguments(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    /**
     * @param index zero-based position
     * @return the positional argument
     * @throws IndexOutOfBoundsException if there is no such position
     */
    public Object get(int index) {
        return positional.get(index);
    }

    public <T> T get(int index, Class<T> type) {
        return type.cast(positional.get(index));
    }

    /**
     * @param name keyword name
     * @return the keyword value, or null if absent
     */
    public Object get(String name) {
        return keywords.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(keywords.get(name));
    }

    public boolean has(String name) {
        return keywords.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobArguments)) {
            return false;
        }
        JobArguments other = (JobArguments) o;
        return positional.equals(other.positional) && keywords.equals(other.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, keywords);
    }

    @Override
    public String toString() {
        return "JobArguments{positional=" + positional + ", keywords=" + keywords + '}';
    }

    /**
     * Accumulates arguments in call order.
     */
    public static final class Builder {
        private final List<Object> positional = new ArrayList<>();
        private final Map<String, Object> keywords = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(Object value) {
            positional.add(value);
            return this;
        }

        public Builder put(String name, Object value) {
            keywords.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public JobArguments build() {
            if (positional.isEmpty() && keywords.isEmpty()) {
                return NONE;
            }
            return new JobArguments(
                Collections.unmodifiableList(new ArrayList<>(positional)),
                Collections.unmodifiableMap(new LinkedHashMap<>(keywords)));
        }
    }
}
