package com.medimind.intake.exception;

import com.medimind.intake.parser.DocumentFormat;
import lombok.Getter;

@Getter
public class DocumentParseException extends RuntimeException {
    private final DocumentFormat format;

    public DocumentParseException(DocumentFormat format, String message, Throwable cause) {
        super("Cannot parse " + format + " content: " + message, cause);
        this.format = format;
    }
}
