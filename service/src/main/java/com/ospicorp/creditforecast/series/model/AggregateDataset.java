package com.ospicorp.creditforecast.series.model;

import com.ospicorp.creditforecast.series.model.enums.AggregateView;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class AggregateDataset {

  private final Map<AggregateView, List<AggregateRow>> views;

  public AggregateDataset(Map<AggregateView, List<AggregateRow>> views) {
    Map<AggregateView, List<AggregateRow>> copy = new EnumMap<>(AggregateView.class);
    for (AggregateView view : AggregateView.values()) {
      List<AggregateRow> rows = views.get(view);
      copy.put(view, rows == null ? List.of() : List.copyOf(rows));
    }
    this.views = copy;
  }

  public static AggregateDataset empty() {
    return new AggregateDataset(Map.of());
  }

  public List<AggregateRow> rows(AggregateView view) {
    return views.get(view);
  }
}
