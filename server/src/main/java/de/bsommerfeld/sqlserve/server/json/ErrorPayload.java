package de.bsommerfeld.sqlserve.server.json;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** {@code {"ok":false,"error":"..."}} */
@JsonPropertyOrder({ "ok", "error" })
public record ErrorPayload(boolean ok, String error) {

    public static ErrorPayload of(String message) {
        return new ErrorPayload(false, message);
    }
}
