package io.almanac.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.almanac.AlmanacException;
import io.almanac.model.HolidayCategory;
import io.almanac.model.HolidayDefinition;
import io.almanac.model.HolidayRule;
import io.almanac.parser.RuleParser;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads holiday definitions from JSON.
 *
 * <p>The document is an array of objects:
 *
 * <pre>{@code
 * [
 *   {"name": "Thanksgiving", "rule": "fourth thursday of nov", "recurring": true,
 *    "category": "cultural", "emoji": "...", "description": "..."},
 *   {"name": "Total Solar Eclipse", "date": "2024-04-08", "recurring": false,
 *    "category": "seasonal"}
 * ]
 * }</pre>
 *
 * <p>{@code recurring} defaults to true. Recurring entries need a {@code rule}; one-off entries
 * need an ISO {@code date}.
 */
public final class HolidayCatalog {
  private static final Logger log = LoggerFactory.getLogger(HolidayCatalog.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Classpath location of the bundled catalog. */
  public static final String DEFAULT_RESOURCE = "/io/almanac/holidays.json";

  private HolidayCatalog() {}

  /**
   * Loads the bundled catalog.
   *
   * @return the bundled definitions in file order
   * @throws AlmanacException if the bundled catalog is missing or invalid
   */
  public static List<HolidayDefinition> loadDefault() throws AlmanacException {
    try (InputStream in = HolidayCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw AlmanacException.catalog("missing catalog resource " + DEFAULT_RESOURCE);
      }
      return load(in);
    } catch (IOException e) {
      throw AlmanacException.catalog("cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  /**
   * Loads definitions from a JSON stream. The stream is not closed.
   *
   * @param in the JSON input
   * @return the definitions in document order
   * @throws AlmanacException if the document is malformed or an entry is invalid
   */
  public static List<HolidayDefinition> load(InputStream in) throws AlmanacException {
    JsonNode root;
    try {
      root = MAPPER.readTree(in);
    } catch (IOException e) {
      throw AlmanacException.catalog("malformed catalog JSON: " + e.getMessage(), e);
    }
    return fromTree(root);
  }

  /**
   * Loads definitions from a JSON string.
   *
   * @param json the JSON text
   * @return the definitions in document order
   * @throws AlmanacException if the document is malformed or an entry is invalid
   */
  public static List<HolidayDefinition> parse(String json) throws AlmanacException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw AlmanacException.catalog("malformed catalog JSON: " + e.getOriginalMessage(), e);
    }
    return fromTree(root);
  }

  private static List<HolidayDefinition> fromTree(JsonNode root) throws AlmanacException {
    if (root == null || !root.isArray()) {
      throw AlmanacException.catalog("catalog must be a JSON array");
    }

    List<HolidayDefinition> definitions = new ArrayList<>();
    Set<String> names = new HashSet<>();
    int index = 0;
    for (JsonNode entry : root) {
      HolidayDefinition definition = readEntry(entry, index);
      if (!names.add(definition.name())) {
        throw AlmanacException.catalog("duplicate holiday name '" + definition.name() + "'");
      }
      definitions.add(definition);
      index++;
    }

    log.info("Loaded {} holiday definitions", definitions.size());
    return definitions;
  }

  private static HolidayDefinition readEntry(JsonNode entry, int index) throws AlmanacException {
    if (!entry.isObject()) {
      throw AlmanacException.catalog("entry " + index + " is not an object");
    }

    String name = text(entry, "name");
    if (name == null || name.isBlank()) {
      throw AlmanacException.catalog("entry " + index + " has no name");
    }

    String categoryText = text(entry, "category");
    HolidayCategory category =
        categoryText == null
            ? HolidayCategory.OTHER
            : HolidayCategory.parse(categoryText)
                .orElseThrow(
                    () ->
                        AlmanacException.catalog(
                            "'" + name + "': unknown category '" + categoryText + "'"));

    boolean recurring = !entry.has("recurring") || entry.get("recurring").asBoolean(true);
    String emoji = text(entry, "emoji");
    String description = text(entry, "description");

    HolidayRule rule = null;
    LocalDate date = null;
    if (recurring) {
      String ruleText = text(entry, "rule");
      if (ruleText == null) {
        throw AlmanacException.catalog("'" + name + "': recurring holiday needs a rule");
      }
      try {
        rule = RuleParser.parse(ruleText);
      } catch (AlmanacException e) {
        throw AlmanacException.catalog("'" + name + "': " + e.displayRich(), e);
      }
    } else {
      String dateText = text(entry, "date");
      if (dateText == null) {
        throw AlmanacException.catalog("'" + name + "': one-off holiday needs a date");
      }
      try {
        date = LocalDate.parse(dateText);
      } catch (DateTimeParseException e) {
        throw AlmanacException.catalog("'" + name + "': invalid date " + dateText, e);
      }
    }

    return new HolidayDefinition(name, date, recurring, category, rule, emoji, description);
  }

  private static String text(JsonNode entry, String field) {
    JsonNode node = entry.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }
}
