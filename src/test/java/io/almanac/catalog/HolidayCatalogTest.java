package io.almanac.catalog;

import static org.junit.jupiter.api.Assertions.*;

import io.almanac.AlmanacException;
import io.almanac.ErrorKind;
import io.almanac.model.HolidayCategory;
import io.almanac.model.HolidayDefinition;
import io.almanac.model.HolidayRule;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests for loading holiday definitions from JSON. */
public class HolidayCatalogTest {

  private static HolidayDefinition find(List<HolidayDefinition> defs, String name) {
    return defs.stream().filter(d -> d.name().equals(name)).findFirst().orElseThrow();
  }

  @Test
  void testLoadDefault() throws AlmanacException {
    List<HolidayDefinition> defs = HolidayCatalog.loadDefault();
    assertTrue(defs.size() > 50);

    Set<String> names = new HashSet<>();
    for (HolidayDefinition d : defs) {
      assertTrue(names.add(d.name()), "duplicate " + d.name());
    }

    HolidayDefinition thanksgiving = find(defs, "Thanksgiving");
    assertTrue(thanksgiving.recurring());
    assertEquals(HolidayCategory.CULTURAL, thanksgiving.category());
    assertEquals("fourth thursday of nov", thanksgiving.rule().toString());
    assertFalse(thanksgiving.emoji().isEmpty());

    HolidayDefinition christmas = find(defs, "Christmas Day");
    assertEquals(LocalDate.of(HolidayDefinition.SCAFFOLD_YEAR, 12, 25), christmas.referenceDate());

    HolidayDefinition eclipse = find(defs, "Total Solar Eclipse");
    assertFalse(eclipse.recurring());
    assertNull(eclipse.rule());
    assertEquals(LocalDate.of(2024, 4, 8), eclipse.referenceDate());
  }

  @Test
  void testDefaultsForOptionalFields() throws AlmanacException {
    List<HolidayDefinition> defs = HolidayCatalog.parse("[{\"name\": \"Pi Day\", \"rule\": \"mar 14\"}]");
    HolidayDefinition pi = defs.get(0);
    assertTrue(pi.recurring());
    assertEquals(HolidayCategory.OTHER, pi.category());
    assertEquals("", pi.emoji());
    assertEquals("", pi.description());
    assertEquals(HolidayRule.Kind.FIXED_DATE, pi.rule().kind());
  }

  @Test
  void testLoadFromStream() throws AlmanacException {
    String json =
        "[{\"name\": \"Diwali\", \"date\": \"2025-10-20\", \"recurring\": false,"
            + " \"category\": \"Religious\"}]";
    List<HolidayDefinition> defs =
        HolidayCatalog.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    assertEquals(HolidayCategory.RELIGIOUS, defs.get(0).category());
    assertEquals(LocalDate.of(2025, 10, 20), defs.get(0).referenceDate());
  }

  @Test
  void testDuplicateNameRejected() {
    AlmanacException e =
        assertThrows(
            AlmanacException.class,
            () ->
                HolidayCatalog.parse(
                    "[{\"name\": \"Easter\", \"rule\": \"easter\"},"
                        + " {\"name\": \"Easter\", \"rule\": \"easter + 1\"}]"));
    assertEquals(ErrorKind.CATALOG, e.kind());
    assertTrue(e.getMessage().contains("duplicate"));
  }

  @Test
  void testUnknownCategoryRejected() {
    AlmanacException e =
        assertThrows(
            AlmanacException.class,
            () ->
                HolidayCatalog.parse(
                    "[{\"name\": \"Pi Day\", \"rule\": \"mar 14\", \"category\": \"maths\"}]"));
    assertTrue(e.getMessage().contains("unknown category 'maths'"));
  }

  @Test
  void testBadRuleWrapsParseError() {
    AlmanacException e =
        assertThrows(
            AlmanacException.class,
            () -> HolidayCatalog.parse("[{\"name\": \"Oops\", \"rule\": \"4th thursday of nov\"}]"));
    assertEquals(ErrorKind.CATALOG, e.kind());
    assertTrue(e.getMessage().startsWith("'Oops': error:"));
    assertInstanceOf(AlmanacException.class, e.getCause());
    assertEquals(ErrorKind.PARSE, ((AlmanacException) e.getCause()).kind());
  }

  @Test
  void testMissingFieldsRejected() {
    assertThrows(AlmanacException.class, () -> HolidayCatalog.parse("[{\"rule\": \"jan 1\"}]"));
    assertThrows(AlmanacException.class, () -> HolidayCatalog.parse("[{\"name\": \"No Rule\"}]"));
    assertThrows(
        AlmanacException.class,
        () -> HolidayCatalog.parse("[{\"name\": \"No Date\", \"recurring\": false}]"));
    assertThrows(
        AlmanacException.class,
        () ->
            HolidayCatalog.parse(
                "[{\"name\": \"Bad Date\", \"recurring\": false, \"date\": \"2025-02-30\"}]"));
  }

  @Test
  void testMalformedDocumentRejected() {
    assertThrows(AlmanacException.class, () -> HolidayCatalog.parse("{\"name\": \"x\"}"));
    assertThrows(AlmanacException.class, () -> HolidayCatalog.parse("[1, 2]"));
    assertThrows(AlmanacException.class, () -> HolidayCatalog.parse("[{"));
  }
}
