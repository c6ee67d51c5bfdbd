package de.bsommerfeld.sqlserve.server.http;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryParametersTest {

    @Test
    void get_shouldFormDecodeValues() {
        QueryParameters params = QueryParameters.parse("sql=select+*+from+t%20where+a%3D1");
        assertEquals(Optional.of("select * from t where a=1"), params.get("sql"));
    }

    @Test
    void get_shouldPreferFirstOccurrence() {
        assertEquals(Optional.of("1"), QueryParameters.parse("a=1&a=2").get("a"));
    }

    @Test
    void get_shouldTreatBareKeyAsEmptyValue() {
        assertEquals(Optional.of(""), QueryParameters.parse("sql").get("sql"));
    }

    @Test
    void get_shouldBeEmptyForMissingQuery() {
        assertTrue(QueryParameters.parse(null).get("sql").isEmpty());
        assertTrue(QueryParameters.parse("").get("sql").isEmpty());
    }

    @Test
    void get_shouldSkipMalformedPairs() {
        QueryParameters params = QueryParameters.parse("bad=%zz&sql=select+1");

        assertTrue(params.get("bad").isEmpty());
        assertEquals(Optional.of("select 1"), params.get("sql"));
    }
}
