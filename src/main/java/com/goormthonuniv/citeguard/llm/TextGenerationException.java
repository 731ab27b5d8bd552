package com.goormthonuniv.citeguard.llm;

public class TextGenerationException extends RuntimeException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
