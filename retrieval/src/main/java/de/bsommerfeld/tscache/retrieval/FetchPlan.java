package de.bsommerfeld.tscache.retrieval;

import java.util.List;

/** Ordered list of plan items; executed strictly in this order. */
public record FetchPlan(List<FetchPlanItem> items) {

    public FetchPlan {
        items = List.copyOf(items);
    }

    public static FetchPlan of(FetchPlanItem... items) {
        return new FetchPlan(List.of(items));
    }

    public long count(ItemClassification classification) {
        return items.stream().filter(i -> i.classification() == classification).count();
    }
}
