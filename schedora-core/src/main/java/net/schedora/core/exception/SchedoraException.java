package net.schedora.core.exception;

public class SchedoraException extends RuntimeException {
    public SchedoraException(String message) { super(message); }
    public SchedoraException(String message, Throwable cause) { super(message, cause); }
}
