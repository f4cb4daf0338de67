package io.tally.api.assertion;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered assertions of one test case, or of a whole run when passed to
 * {@code done}. The duration is measured by the engine, in milliseconds.
 */
public final class AssertionList implements Iterable<Assertion> {

    private final List<Assertion> assertions;
    private final long duration;

    public AssertionList(List<? extends Assertion> assertions, long duration) {
        if (assertions == null) {
            throw new IllegalArgumentException("Assertions must not be null");
        }
        if (duration < 0) {
            throw new IllegalArgumentException("Duration must be non-negative");
        }
        this.assertions = List.copyOf(assertions);
        this.duration = duration;
    }

    public static AssertionList of(Assertion... assertions) {
        return new AssertionList(List.of(assertions), 0);
    }

    public static AssertionList empty() {
        return new AssertionList(List.of(), 0);
    }

    /**
     * @return number of failed assertions
     */
    public int failures() {
        int count = 0;
        for (Assertion a : assertions) {
            if (a.failed()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return assertions.size();
    }

    public boolean isEmpty() {
        return assertions.isEmpty();
    }

    public Assertion get(int index) {
        return assertions.get(index);
    }

    public long duration() {
        return duration;
    }

    public Stream<Assertion> stream() {
        return assertions.stream();
    }

    public List<Assertion> asList() {
        return assertions;
    }

    @Override
    public Iterator<Assertion> iterator() {
        return assertions.iterator();
    }

    @Override
    public String toString() {
        return "AssertionList[size=" + assertions.size() + ", failures=" + failures() + ", duration=" + duration + "ms]";
    }
}
