package com.tierstore.store;

public record AggregateSpec(Op op, String field, String groupBy) {

    public enum Op {
        COUNT,
        SUM,
        MIN,
        MAX
    }

    public AggregateSpec {
        if (op == null) {
            throw new IllegalArgumentException("aggregate op is required");
        }
        if (op != Op.COUNT && (field == null || field.isBlank())) {
            throw new IllegalArgumentException(op + " aggregation requires a field");
        }
    }

    public static AggregateSpec count() {
        return new AggregateSpec(Op.COUNT, null, null);
    }

    public static AggregateSpec countBy(String groupBy) {
        return new AggregateSpec(Op.COUNT, null, groupBy);
    }

    public static AggregateSpec of(Op op, String field) {
        return new AggregateSpec(op, field, null);
    }
}
