package com.mimecast.pdbconf.config.schema;

import org.joda.time.Days;
import org.joda.time.Minutes;
import org.joda.time.Period;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettingTypesTest {

    @Test
    void integer() {
        assertTrue(SettingTypes.INTEGER.accepts(5L));
        assertTrue(SettingTypes.INTEGER.accepts(5));
        assertTrue(SettingTypes.INTEGER.accepts(" 42 "));
        assertFalse(SettingTypes.INTEGER.accepts("4.2"));
        assertFalse(SettingTypes.INTEGER.accepts(4.2d));
        assertFalse(SettingTypes.INTEGER.accepts(true));

        assertEquals(42L, SettingTypes.INTEGER.convert("42"));
        assertEquals(-3L, SettingTypes.INTEGER.convert(-3));
        assertTrue(SettingTypes.INTEGER.isInstance(1L));
        assertFalse(SettingTypes.INTEGER.isInstance(1));
    }

    @Test
    void integerOutOfRange() {
        assertFalse(SettingTypes.INTEGER.accepts("99999999999999999999"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SettingTypes.INTEGER.convert("99999999999999999999"));
        assertEquals("out of range for an integer", e.getMessage());
    }

    @Test
    void bool() {
        assertTrue(SettingTypes.BOOLEAN.accepts("TRUE"));
        assertTrue(SettingTypes.BOOLEAN.accepts(false));
        assertFalse(SettingTypes.BOOLEAN.accepts("yes"));
        assertFalse(SettingTypes.BOOLEAN.accepts(1L));

        assertEquals(Boolean.TRUE, SettingTypes.BOOLEAN.convert(" True "));
        assertEquals(Boolean.FALSE, SettingTypes.BOOLEAN.convert("false"));
        assertThrows(IllegalArgumentException.class, () -> SettingTypes.BOOLEAN.convert("yes"));
    }

    @Test
    void string() {
        assertTrue(SettingTypes.STRING.accepts("x"));
        assertFalse(SettingTypes.STRING.accepts(1L));
        assertEquals("x", SettingTypes.STRING.convert("x"));
    }

    @Test
    void minutesAndDays() {
        assertEquals(Minutes.minutes(60), SettingTypes.MINUTES.convert(60L));
        assertEquals(Minutes.minutes(5), SettingTypes.MINUTES.convert("5"));
        assertEquals(Days.days(3), SettingTypes.DAYS.convert(3L));
        assertEquals("60", SettingTypes.MINUTES.render(Minutes.minutes(60)));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SettingTypes.DAYS.convert(3000000000L));
        assertEquals("out of range for a number of minutes or days", e.getMessage());
    }

    @Test
    void period() {
        assertTrue(SettingTypes.PERIOD.accepts("14d"));
        assertFalse(SettingTypes.PERIOD.accepts("14"));
        assertEquals(Period.days(14), SettingTypes.PERIOD.convert("14d"));
        assertEquals("14d", SettingTypes.PERIOD.render(Period.days(14)));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SettingTypes.PERIOD.convert("two weeks"));
        assertEquals("not a period, expected e.g. 14d, 12h, 30m, 10s or 500ms", e.getMessage());
    }

    @Test
    void stringList() {
        assertEquals(List.of("uptime", "memoryfree", "load"),
                SettingTypes.STRING_LIST.convert("uptime, memoryfree;load,"));
        assertEquals(List.of("a", "b"), SettingTypes.STRING_LIST.convert(List.of(" a", "", "b ")));
        assertFalse(SettingTypes.STRING_LIST.accepts(List.of("a", 1L)));
        assertTrue(SettingTypes.STRING_LIST.isInstance(SettingTypes.STRING_LIST.convert("a,b")));
        assertEquals("a,b", SettingTypes.STRING_LIST.render(List.of("a", "b")));
    }

    @Test
    void oneOf() {
        SettingType type = SettingTypes.oneOf("literal", "regex");
        assertTrue(type.accepts("regex"));
        assertFalse(type.accepts("glob"));
        assertThrows(IllegalArgumentException.class, () -> type.convert("glob"));
    }
}
