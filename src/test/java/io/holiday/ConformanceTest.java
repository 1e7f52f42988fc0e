package io.holiday;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.holiday.date.RecurrencePattern;
import io.holiday.parser.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json on the test classpath. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;
  private static LocalDate TODAY;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json missing from test resources");
      CASES = MAPPER.readTree(in);
    }
    TODAY = LocalDate.parse(CASES.get("today").asText());
  }

  // Parse tests

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse").get("tests")) {
      String input = tc.get("input").asText();
      String canonical = tc.get("canonical").asText();

      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> {
                RecurrencePattern p = Parser.parsePattern(input);
                assertEquals(canonical, p.toString(), "parsePattern(" + input + ").toString()");

                // Roundtrip test
                RecurrencePattern p2 = Parser.parsePattern(canonical);
                assertEquals(p, p2, "roundtrip: parsePattern(" + canonical + ")");
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse_errors").get("tests")) {
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();

      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> {
                HolidayException e =
                    assertThrows(
                        HolidayException.class,
                        () -> Parser.parsePattern(input),
                        "expected error for: " + input);
                assertEquals(kind, e.kind().value(), "error kind for: " + input);
              }));
    }
    return tests.stream();
  }

  // Resolution tests

  @TestFactory
  Stream<DynamicTest> resolveTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("resolve").get("tests")) {
      String expression = tc.get("expression").asText();
      LocalDate from = LocalDate.parse(tc.get("from").asText());
      String name = tc.get("name").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name + "/after",
              () -> {
                RecurrencePattern p = Parser.parsePattern(expression);
                LocalDate expected = LocalDate.parse(tc.get("after").asText());
                assertEquals(expected, p.after(from), "after() mismatch");
                assertTrue(p.matches(expected));
              }));

      tests.add(
          DynamicTest.dynamicTest(
              name + "/before",
              () -> {
                RecurrencePattern p = Parser.parsePattern(expression);
                LocalDate expected = LocalDate.parse(tc.get("before").asText());
                assertEquals(expected, p.before(from), "before() mismatch");
                assertTrue(p.matches(expected));
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> inYearTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("in_year").get("tests")) {
      String expression = tc.get("expression").asText();
      int year = tc.get("year").asInt();
      LocalDate expected = LocalDate.parse(tc.get("date").asText());

      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> {
                Holiday h = new Holiday(expression, Parser.parsePattern(expression));
                assertEquals(expected, h.inYear(year), "inYear() mismatch");
              }));
    }
    return tests.stream();
  }

  // Date expression tests

  @TestFactory
  Stream<DynamicTest> dateTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("dates").get("tests")) {
      String input = tc.get("input").asText();
      LocalDate expected = LocalDate.parse(tc.get("date").asText());

      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () ->
                  assertEquals(
                      expected, Parser.parseDate(input, TODAY), "parseDate(" + input + ")")));
    }
    return tests.stream();
  }
}
