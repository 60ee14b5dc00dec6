package com.ospicorp.creditforecast.support;

import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.model.AggregateRow;
import com.ospicorp.creditforecast.series.model.Observation;
import com.ospicorp.creditforecast.series.model.enums.AggregateView;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

public final class SeriesFixtures {
  private SeriesFixtures() {
  }

  public static List<Observation> monthly(int year, int month, int count,
      IntToDoubleFunction value) {
    List<Observation> out = new ArrayList<>(count);
    YearMonth start = YearMonth.of(year, month);
    for (int t = 0; t < count; t++) {
      out.add(new Observation(start.plusMonths(t), value.applyAsDouble(t), 0d, 0d));
    }
    return out;
  }

  // trend + yearly seasonality + bounded noise, always well above zero
  public static List<Observation> seasonal(int count, long seed) {
    Random random = new Random(seed);
    double[] noise = new double[count];
    for (int t = 0; t < count; t++) {
      noise[t] = (random.nextDouble() - 0.5) * 60d;
    }
    return monthly(2019, 1, count,
        t -> 1000d + 20d * t + 150d * Math.sin(2d * Math.PI * ((t % 12) + 1) / 12d) + noise[t]);
  }

  public static AggregateDataset monthlyTotals(List<Observation> observations) {
    List<AggregateRow> rows = new ArrayList<>();
    for (Observation o : observations) {
      rows.add(new AggregateRow(o.year(), o.month(), null, o.value(), o.contracts(), o.area()));
    }
    return new AggregateDataset(Map.of(AggregateView.MONTHLY, rows));
  }
}
