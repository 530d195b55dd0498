package com.jreinhal.querygate.sanitize;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.querygate.query.OpaqueId;
import java.time.Instant;
import java.util.Date;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TypedValuesTest {

    @Test
    @DisplayName("ISO dates and date-times parse to the same instant a store would hold")
    void parsesIsoForms() {
        assertThat(TypedValues.parseDate("2024-03-01")).isEqualTo(Date.from(Instant.parse("2024-03-01T00:00:00Z")));
        assertThat(TypedValues.parseDate(" 2024-03-01T12:30:15.250Z ")).isEqualTo(Date.from(Instant.parse("2024-03-01T12:30:15.250Z")));
        assertThat(TypedValues.parseDate("2024-03-01T08:00-04:00")).isEqualTo(Date.from(Instant.parse("2024-03-01T12:00:00Z")));
    }

    @Test
    @DisplayName("Impossible or free-text dates are not read")
    void rejectsInvalidDates() {
        assertThat(TypedValues.parseDate("2024-02-30")).isNull();
        assertThat(TypedValues.parseDate("01/03/2024")).isNull();
        assertThat(TypedValues.parseDate("yesterday")).isNull();
        assertThat(TypedValues.parseDate("")).isNull();
        assertThat(TypedValues.parseDate(null)).isNull();
    }

    @Test
    void objectIds() {
        assertThat(TypedValues.parseObjectId("64B7F0C2A1B2C3D4E5F60001")).isEqualTo(new OpaqueId("64b7f0c2a1b2c3d4e5f60001"));
        assertThat(TypedValues.parseObjectId("64b7f0c2")).isNull();
        assertThat(TypedValues.parseObjectId(null)).isNull();
    }
}
