package io.kneo.scheduler.model.cnst;

public enum CommandStyle {
    SQL_TEXT, STORED_PROCEDURE;

    public static CommandStyle of(String value) {
        if (value != null && value.equalsIgnoreCase("storedprocedure")) {
            return STORED_PROCEDURE;
        }
        return SQL_TEXT;
    }
}
