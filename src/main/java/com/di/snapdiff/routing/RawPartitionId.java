package com.di.snapdiff.routing;

import com.di.snapdiff.exception.ConfigurationException;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coverage of a raw partition, parsed from the leading token of its file name:
 * {@code YYYY}, {@code YYYY-YYYY}, {@code YYYY-MM} or {@code YYYY-MM-YYYY-MM}.
 * Bounds are inclusive and held as months; a year range spans January to December.
 */
public record RawPartitionId(String token, Grain grain, YearMonth start, YearMonth end) {

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern YEAR_RANGE = Pattern.compile("^(\\d{4})-(\\d{4})$");
    private static final Pattern MONTH = Pattern.compile("^(\\d{4})-(\\d{2})$");
    private static final Pattern MONTH_RANGE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{4})-(\\d{2})$");

    /**
     * @throws ConfigurationException for an unrecognized token or an inverted range
     */
    public static RawPartitionId parse(String token) {
        if (token == null) {
            throw new ConfigurationException("Raw partition id is missing");
        }
        String t = token.trim();
        try {
            Matcher m = YEAR_RANGE.matcher(t);
            if (m.matches()) {
                int s = Integer.parseInt(m.group(1));
                int e = Integer.parseInt(m.group(2));
                return ordered(t, Grain.YEAR, YearMonth.of(s, 1), YearMonth.of(e, 12));
            }
            m = YEAR.matcher(t);
            if (m.matches()) {
                int y = Integer.parseInt(m.group(1));
                return new RawPartitionId(t, Grain.YEAR, YearMonth.of(y, 1), YearMonth.of(y, 12));
            }
            m = MONTH_RANGE.matcher(t);
            if (m.matches()) {
                YearMonth s = YearMonth.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                YearMonth e = YearMonth.of(Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
                return ordered(t, Grain.MONTH, s, e);
            }
            m = MONTH.matcher(t);
            if (m.matches()) {
                YearMonth ym = YearMonth.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                return new RawPartitionId(t, Grain.MONTH, ym, ym);
            }
        } catch (java.time.DateTimeException e) {
            throw new ConfigurationException("Invalid raw partition id '" + token + "': " + e.getMessage(), e);
        }
        throw new ConfigurationException("Unrecognized raw partition id '" + token + "'");
    }

    /** Extracts the coverage token from a file name such as {@code 2020-2022-part-000.parquet}. */
    public static RawPartitionId fromFileName(String fileName) {
        String stem = fileName;
        int dot = stem.indexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        int part = stem.indexOf("-part-");
        return parse(part >= 0 ? stem.substring(0, part) : stem);
    }

    private static RawPartitionId ordered(String token, Grain grain, YearMonth s, YearMonth e) {
        if (s.isAfter(e)) {
            throw new ConfigurationException("Inverted " + grain.label() + " range in raw partition id '" + token + "'");
        }
        return new RawPartitionId(token, grain, s, e);
    }

    /**
     * Canonical partition ids covered at {@code target} grain: {@code YYYY} per touched year or
     * {@code YYYY-MM} per covered month.
     */
    public List<String> expand(Grain target) {
        if (target == Grain.MONTH) {
            List<String> months = new ArrayList<>();
            for (YearMonth ym = start; !ym.isAfter(end); ym = ym.plusMonths(1)) {
                months.add(ym.toString());
            }
            return months;
        }
        Set<String> years = new LinkedHashSet<>();
        for (int y = start.getYear(); y <= end.getYear(); y++) {
            years.add(String.valueOf(y));
        }
        return new ArrayList<>(years);
    }

    @Override
    public String toString() {
        return token;
    }
}
