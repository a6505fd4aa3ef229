package io.almanac.host;

import io.almanac.model.Weekday;

/**
 * The components of a calendar date.
 *
 * @param year the year
 * @param month the month (1-12)
 * @param day the day of month (1-31)
 * @param weekday the day of the week
 */
public record DateParts(int year, int month, int day, Weekday weekday) {}
