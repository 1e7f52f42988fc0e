package io.holiday.catalog;

import io.holiday.Holiday;
import io.holiday.HolidayException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up named holidays by loosely written names.
 *
 * <p>Names are compared after normalizing: lower case, apostrophes removed, runs of whitespace
 * collapsed, a leading "the" and a trailing "day" dropped. "The Fourth of July", "independence
 * day" and "Independence" all find {@link UnitedStatesHolidays#INDEPENDENCE_DAY}.
 */
public final class HolidayCatalog {
  private static final Logger log = LoggerFactory.getLogger(HolidayCatalog.class);

  private static final Map<String, Holiday> BY_NAME = new HashMap<>();

  static {
    for (Holiday h : all()) {
      BY_NAME.put(normalize(h.name()), h);
    }
    alias(UnitedStatesHolidays.MLK_DAY, "martin luther king jr.", "martin luther king", "mlk");
    alias(UnitedStatesHolidays.SUPER_BOWL_SUNDAY, "superbowl sunday", "superbowl", "super bowl");
    alias(UnitedStatesHolidays.DST_START, "dst start", "spring forward");
    alias(UnitedStatesHolidays.DST_END, "dst end", "fall back");
    alias(UnitedStatesHolidays.MOTHERS_DAY, "mother");
    alias(UnitedStatesHolidays.FATHERS_DAY, "father");
    alias(UnitedStatesHolidays.PRESIDENTS_DAY, "president");
    alias(UnitedStatesHolidays.VALENTINES_DAY, "valentine", "st. valentines", "st valentines");
    alias(UnitedStatesHolidays.VETERANS_DAY, "veteran");
    alias(UnitedStatesHolidays.APRIL_FOOLS_DAY, "april fool");
    alias(
        UnitedStatesHolidays.INDEPENDENCE_DAY,
        "july 4th",
        "july fourth",
        "fourth of july",
        "4th of july");
    alias(GlobalHolidays.ST_PATRICKS_DAY, "st patricks", "saint patricks");
    alias(GlobalHolidays.CHRISTMAS, "xmas");
    alias(GlobalHolidays.CHRISTMAS_EVE, "xmas eve");
    alias(GlobalHolidays.NEW_YEARS_DAY, "new year");
  }

  private HolidayCatalog() {}

  /**
   * Returns every holiday in the catalog, sorted by pattern.
   *
   * @return the sorted holidays
   */
  public static List<Holiday> all() {
    List<Holiday> all = new ArrayList<>(GlobalHolidays.all());
    all.addAll(UnitedStatesHolidays.all());
    Collections.sort(all);
    return all;
  }

  /**
   * Finds a holiday by name.
   *
   * @param name the name, written loosely
   * @return the holiday, or empty if the name is not recognized
   */
  public static Optional<Holiday> lookup(String name) {
    String key = normalize(name);
    Holiday found = BY_NAME.get(key);
    if (found == null) {
      log.debug("no holiday named '{}' (normalized '{}')", name, key);
    }
    return Optional.ofNullable(found);
  }

  /**
   * Finds a holiday by name, failing if it is not recognized.
   *
   * @param name the name, written loosely
   * @return the holiday
   * @throws HolidayException of kind LOOKUP if the name is not recognized
   */
  public static Holiday find(String name) throws HolidayException {
    return lookup(name).orElseThrow(() -> HolidayException.lookup(name));
  }

  /**
   * Normalizes a holiday name for lookup.
   *
   * @param name the name
   * @return the lookup key
   */
  static String normalize(String name) {
    String s =
        name.toLowerCase(Locale.ROOT)
            .replace("'", "")
            .replace("’", "")
            .trim()
            .replaceAll("\\s+", " ");
    if (s.startsWith("the ")) {
      s = s.substring(4);
    }
    if (s.endsWith(" day")) {
      s = s.substring(0, s.length() - 4);
    }
    return s.trim();
  }

  private static void alias(Holiday holiday, String... names) {
    for (String name : names) {
      BY_NAME.put(normalize(name), holiday);
    }
  }
}
