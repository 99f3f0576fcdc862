package Model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BatchStatus {
    SUCCESS,
    WARNING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
