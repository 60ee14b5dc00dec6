package com.ospicorp.creditforecast.series.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.creditforecast.series.model.AggregateDataset;
import com.ospicorp.creditforecast.series.model.AggregateRow;
import com.ospicorp.creditforecast.series.model.enums.AggregateView;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the aggregated artifact written by the ETL and keeps the views the forecasting pipeline
 * consumes. Credit value, contract count and area are coerced to numbers (missing or non-numeric
 * count as zero); year and month are part of the upstream contract and must be numeric.
 */
@Component
public class AggregateLoader {

  private static final Logger log = LoggerFactory.getLogger(AggregateLoader.class);

  private final ObjectMapper objectMapper;

  public AggregateLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public AggregateDataset load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new DataFormatException("Aggregated dataset not found at " + path);
    }
    JsonNode root;
    try (InputStream in = Files.newInputStream(path)) {
      root = objectMapper.readTree(in);
    } catch (JsonProcessingException ex) {
      throw new DataFormatException("Aggregated dataset at " + path + " is not valid JSON", ex);
    } catch (IOException ex) {
      throw new DataFormatException("Failed to read aggregated dataset at " + path, ex);
    }
    AggregateDataset dataset = parse(root);
    for (AggregateView view : AggregateView.values()) {
      log.debug("View {} has {} rows", view.key(), dataset.rows(view).size());
    }
    return dataset;
  }

  AggregateDataset parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new DataFormatException("Aggregated dataset root must be a JSON object");
    }
    Map<AggregateView, List<AggregateRow>> views = new EnumMap<>(AggregateView.class);
    for (AggregateView view : AggregateView.values()) {
      views.put(view, readView(root.get(view.key()), view));
    }
    return new AggregateDataset(views);
  }

  private List<AggregateRow> readView(JsonNode node, AggregateView view) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      throw new DataFormatException("View " + view.key() + " must be an array");
    }
    List<AggregateRow> rows = new ArrayList<>(node.size());
    int index = 0;
    for (JsonNode row : node) {
      if (!row.isObject()) {
        throw new DataFormatException("Row " + index + " of " + view.key() + " is not an object");
      }
      int year = requireInt(row, "ano", view, index);
      Integer month = null;
      if (view.monthly()) {
        month = requireInt(row, "mes", view, index);
        if (month < 1 || month > 12) {
          throw new DataFormatException(
              "Row " + index + " of " + view.key() + " has month out of range: " + month);
        }
      }
      String purpose = view.byPurpose() ? text(row.get("finalidade")) : null;
      rows.add(new AggregateRow(year, month, purpose,
          coerce(row.get("valor")), coerce(row.get("contratos")), coerce(row.get("area"))));
      index++;
    }
    return rows;
  }

  private int requireInt(JsonNode row, String field, AggregateView view, int index) {
    JsonNode node = row.get(field);
    double value = node == null ? Double.NaN : number(node);
    if (Double.isNaN(value) || value != Math.rint(value)) {
      throw new DataFormatException(
          "Row " + index + " of " + view.key() + " has no integral '" + field + "'");
    }
    return (int) value;
  }

  static double coerce(JsonNode node) {
    double value = node == null ? Double.NaN : number(node);
    return Double.isFinite(value) ? value : 0d;
  }

  private static double number(JsonNode node) {
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        // non-numeric text is treated as missing
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  private static String text(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }
}
