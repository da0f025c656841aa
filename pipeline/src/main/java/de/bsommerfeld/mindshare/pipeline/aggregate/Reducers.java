package de.bsommerfeld.mindshare.pipeline.aggregate;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The reducer vocabulary used by {@link AggregationRules}.
 */
public final class Reducers {

    private Reducers() {
    }

    public static FieldReducer<Double> sum() {
        return Double::sum;
    }

    public static <T> FieldReducer<T> takeFirst() {
        return (earlier, later) -> earlier;
    }

    public static <T> FieldReducer<T> takeLast() {
        return (earlier, later) -> later;
    }

    /**
     * Order-preserving concatenation; duplicates are kept.
     */
    public static <T> FieldReducer<List<T>> concat() {
        return (earlier, later) -> ImmutableList.<T>builderWithExpectedSize(earlier.size() + later.size())
                .addAll(earlier)
                .addAll(later)
                .build();
    }
}
