package com.yuzhi.sqlguard.common.sql;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SqlIdentifiersTest {

    @Test
    void normalize_stripsQuotesAndUpperCases() {
        assertEquals("EMPLOYEES", SqlIdentifiers.normalize("employees"));
        assertEquals("ORDER LINES", SqlIdentifiers.normalize("\"Order Lines\""));
        assertEquals("EMP", SqlIdentifiers.normalize("`emp`"));
        assertEquals("EMP", SqlIdentifiers.normalize("[emp]"));
        assertNull(SqlIdentifiers.normalize("  "));
    }

    @Test
    void render_quotesOnlyWhenNeeded() {
        assertEquals("EMPLOYEE_ID", SqlIdentifiers.render("EMPLOYEE_ID"));
        assertEquals("\"FIRST NAME\"", SqlIdentifiers.render("FIRST NAME"));
        assertEquals("\"A\"\"B\"", SqlIdentifiers.render("A\"B"));
    }

    @Test
    void requireSimple_rejectsInjectionAttempts() {
        assertEquals("AI_USERS", SqlIdentifiers.requireSimple("AI_USERS", "table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.requireSimple("AI_USERS; DROP TABLE X", "table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.requireSimple(null, "table"));
    }
}
