package com.mimecast.pdbconf.config.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;
import org.joda.time.Days;
import org.joda.time.Minutes;
import org.joda.time.Period;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Setting types used by the section schemas.
 */
public final class SettingTypes {

    /**
     * Whole number, converted to Long.
     */
    public static final SettingType INTEGER = new IntegerType();

    /**
     * Free text.
     */
    public static final SettingType STRING = new StringType();

    /**
     * <code>true</code> or <code>false</code>, converted to Boolean.
     */
    public static final SettingType BOOLEAN = new BooleanType();

    /**
     * Whole number of minutes, converted to {@link Minutes}.
     */
    public static final SettingType MINUTES = new MinutesType();

    /**
     * Whole number of days, converted to {@link Days}.
     */
    public static final SettingType DAYS = new DaysType();

    /**
     * Period string, converted to {@link Period}.
     *
     * @see Periods
     */
    public static final SettingType PERIOD = new PeriodType();

    /**
     * Comma or semicolon delimited string or list, converted to a list of strings.
     */
    public static final SettingType STRING_LIST = new StringListType();

    private static final Pattern WHOLE_NUMBER = Pattern.compile("[-+]?\\d+");

    private static final Pattern LIST_DELIMITER = Pattern.compile("[,;]");

    private SettingTypes() {
        throw new IllegalStateException("Static class");
    }

    /**
     * One of a fixed set of strings.
     *
     * @param values Allowed values.
     * @return SettingType instance.
     */
    public static SettingType oneOf(String... values) {
        return new EnumType(values);
    }

    /**
     * IntegerType
     */
    static class IntegerType implements SettingType {

        @Override
        public String getName() {
            return "integer";
        }

        @Override
        public boolean accepts(Object raw) {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
                return true;
            }
            if (raw instanceof String text) {
                String trimmed = text.trim();
                if (WHOLE_NUMBER.matcher(trimmed).matches()) {
                    try {
                        Long.parseLong(trimmed);
                        return true;
                    } catch (NumberFormatException e) {
                        return false;
                    }
                }
            }
            return false;
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof String text && WHOLE_NUMBER.matcher(text.trim()).matches()) {
                try {
                    return Long.parseLong(text.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("out of range for an integer", e);
                }
            }
            throw new IllegalArgumentException("not an " + getName());
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof Long;
        }

        @Override
        public Object render(Object value) {
            return String.valueOf(value);
        }
    }

    /**
     * StringType
     */
    static class StringType implements SettingType {

        @Override
        public String getName() {
            return "string";
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof String;
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof String) {
                return raw;
            }
            throw new IllegalArgumentException("not a " + getName());
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof String;
        }

        @Override
        public Object render(Object value) {
            return value;
        }
    }

    /**
     * BooleanType
     */
    static class BooleanType implements SettingType {

        @Override
        public String getName() {
            return "boolean";
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof Boolean
                    || "true".equalsIgnoreCase(StringUtils.trim(asString(raw)))
                    || "false".equalsIgnoreCase(StringUtils.trim(asString(raw)));
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            if (accepts(raw)) {
                return Boolean.valueOf(((String) raw).trim().toLowerCase(Locale.ROOT));
            }
            throw new IllegalArgumentException("not a " + getName() + ", expected true or false");
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof Boolean;
        }

        @Override
        public Object render(Object value) {
            return String.valueOf(value);
        }
    }

    /**
     * MinutesType
     */
    static class MinutesType implements SettingType {

        @Override
        public String getName() {
            return "number of minutes";
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof Minutes || INTEGER.accepts(raw);
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof Minutes) {
                return raw;
            }
            return Minutes.minutes(toInt(raw));
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof Minutes;
        }

        @Override
        public Object render(Object value) {
            return String.valueOf(((Minutes) value).getMinutes());
        }
    }

    /**
     * DaysType
     */
    static class DaysType implements SettingType {

        @Override
        public String getName() {
            return "number of days";
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof Days || INTEGER.accepts(raw);
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof Days) {
                return raw;
            }
            return Days.days(toInt(raw));
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof Days;
        }

        @Override
        public Object render(Object value) {
            return String.valueOf(((Days) value).getDays());
        }
    }

    /**
     * PeriodType
     */
    static class PeriodType implements SettingType {

        @Override
        public String getName() {
            return "period";
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof Period || (raw instanceof String text && Periods.isPeriod(text));
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof Period) {
                return raw;
            }
            if (raw instanceof String text && Periods.isPeriod(text)) {
                return Periods.parse(text);
            }
            throw new IllegalArgumentException("not a " + getName() + ", expected e.g. 14d, 12h, 30m, 10s or 500ms");
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof Period;
        }

        @Override
        public Object render(Object value) {
            return Periods.format((Period) value);
        }
    }

    /**
     * StringListType
     */
    static class StringListType implements SettingType {

        @Override
        public String getName() {
            return "list of strings";
        }

        @Override
        public boolean accepts(Object raw) {
            if (raw instanceof String) {
                return true;
            }
            return raw instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
        }

        @Override
        public Object convert(Object raw) {
            if (raw instanceof String text) {
                return clean(Arrays.asList(LIST_DELIMITER.split(text)));
            }
            if (accepts(raw)) {
                return clean((List<?>) raw);
            }
            throw new IllegalArgumentException("not a " + getName());
        }

        @Override
        public boolean isInstance(Object value) {
            return value instanceof ImmutableList<?> list && list.stream().allMatch(String.class::isInstance);
        }

        @Override
        public Object render(Object value) {
            return String.join(",", ((List<?>) value).stream().map(String::valueOf).toArray(String[]::new));
        }

        private static ImmutableList<String> clean(List<?> items) {
            ImmutableList.Builder<String> builder = ImmutableList.builder();
            for (Object item : items) {
                String trimmed = StringUtils.trimToEmpty((String) item);
                if (!trimmed.isEmpty()) {
                    builder.add(trimmed);
                }
            }
            return builder.build();
        }
    }

    /**
     * EnumType
     */
    static class EnumType implements SettingType {
        private final Set<String> values;

        EnumType(String... values) {
            this.values = ImmutableSet.copyOf(values);
        }

        @Override
        public String getName() {
            return "one of " + values;
        }

        @Override
        public boolean accepts(Object raw) {
            return raw instanceof String && values.contains(raw);
        }

        @Override
        public Object convert(Object raw) {
            if (accepts(raw)) {
                return raw;
            }
            throw new IllegalArgumentException("not " + getName());
        }

        @Override
        public boolean isInstance(Object value) {
            return accepts(value);
        }

        @Override
        public Object render(Object value) {
            return value;
        }
    }

    private static String asString(Object raw) {
        return raw instanceof String ? (String) raw : null;
    }

    private static int toInt(Object raw) {
        long value = (Long) INTEGER.convert(raw);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("out of range for a number of minutes or days");
        }
        return (int) value;
    }
}
