package com.tierstore.filter;

public interface FilterVisitor<R> {
    R visitEq(FilterExpression.Eq eq);

    R visitIn(FilterExpression.In in);

    R visitRange(FilterExpression.Range range);

    R visitContains(FilterExpression.Contains contains);

    R visitPathPrefix(FilterExpression.PathPrefix pathPrefix);

    R visitAnd(FilterExpression.And and);

    R visitOr(FilterExpression.Or or);

    R visitNot(FilterExpression.Not not);
}
